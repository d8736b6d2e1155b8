package ca.gc.cra.screenlog.api;

import ca.gc.cra.screenlog.application.pipeline.RecordingCoordinator;
import ca.gc.cra.screenlog.application.port.EventChannel;
import ca.gc.cra.screenlog.application.retention.RetentionService;
import ca.gc.cra.screenlog.config.CompositionRoot;
import ca.gc.cra.screenlog.config.RecorderConfig;
import ca.gc.cra.screenlog.config.RetentionConfig;
import ca.gc.cra.screenlog.domain.recording.RecordingState;
import ca.gc.cra.screenlog.domain.recording.RecordingState.Phase;
import ca.gc.cra.screenlog.domain.recording.RecordingStatus;
import ca.gc.cra.screenlog.infrastructure.persistence.PersistenceException;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the recorder, the memory monitor and scheduled retention until the duration elapses or the process is
 * interrupted.
 *
 * @since 0.1.0
 */
final class RecordCli {
  private static final Logger log = LoggerFactory.getLogger(RecordCli.class);
  private static final String MODE = "record";
  private static final long START_TIMEOUT_SECONDS = 30L;
  private static final String SUMMARY_USAGE =
      "usage: record [durationSeconds=N] [dataDir=PATH] [fps=1-30] [chunkSeconds=10-3600] "
          + "[monitorIntervalSeconds=1-3600] [codec=h264|h265] [quality=low|medium|high|auto] "
          + "[config=PATH] [--resume] [--dry-run]";
  private static final String HELP_TEXT = """
      SCREENLOG recorder

      Usage:
        record [options]

      Options:
        durationSeconds=N          Stop after N seconds; 0 records until interrupted (default 0)
        dataDir=PATH               Data directory holding screenlog.db and recordings/ (default ~/.screenlog)
        fps=1-30                   Capture rate (default 1)
        chunkSeconds=10-3600       Chunk length (default 900)
        monitorIntervalSeconds=N   Memory sampling interval, 1-3600 (default 10)
        width=N height=N           Capture size when displays report none (default 1920x1080)
        codec=h264|h265            Codec recorded in chunk headers (default h264)
        quality=low|medium|high|auto  Bitrate preset (default auto)
        readPoolSize=1-16          Pooled read connections (default 4)
        bufferCapacity=N           Frame pool capacity (default 100)
        retention.enabled=BOOL retention.retentionDays=1-365 retention.maxStorageGB=1-1000
        retention.cleanupIntervalHours=1-24   Persisted retention policy overrides
        config=PATH                YAML file; 'common' and 'record' sections apply, CLI values win
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP endpoint when exporter=otlp
        --resume                   Only start when the previous session ended while recording
        --dry-run                  Print the effective configuration and exit
        --verbose                  Enable DEBUG logging
      """;

  private RecordCli() {}

  static ExitCode run(CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    Map<String, String> cli;
    long durationSeconds;
    try {
      cli = CliArgsParser.toMap(input.argumentsAfterCommand());
      durationSeconds = CliArgsParser.takeLong(cli, "durationSeconds", 0L, 0L, TimeUnit.DAYS.toSeconds(7));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    RecorderConfig config;
    RetentionConfig retentionOverride;
    try {
      Map<String, String> effective = CommandSupport.effectiveConfig(MODE, cli);
      config = RecorderConfig.fromMap(effective);
      retentionOverride = hasRetentionKeys(effective) ? RetentionConfig.fromMap(effective) : null;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid recorder configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      printPlan(config, durationSeconds, retentionOverride);
      return ExitCode.SUCCESS;
    }

    CompositionRoot root = new CompositionRoot(config);
    CountDownLatch shutdown = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      shutdown.countDown();
      root.close();
    }, "screenlog-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      RetentionService retention = root.retentionService();
      if (retentionOverride != null) {
        retention.updatePolicy(retentionOverride);
      }
      retention.start();
      root.memoryMonitor().startMonitoring(config.monitorIntervalSeconds());

      RecordingCoordinator recorder = root.recorder();
      try (EventChannel.Registration ignored = recorder.status().onEvent(RecordCli::report)) {
        RecordingState state;
        if (input.hasFlag("--resume")) {
          var resumed = root.resumeIfPreviouslyActive();
          if (resumed.isEmpty()) {
            CliPrinter.println("Recording was not active in the previous session; nothing to resume.");
            return ExitCode.SUCCESS;
          }
          state = resumed.get().get(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } else {
          state = recorder.start().get(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }
        if (state.is(Phase.ERROR)) {
          CliPrinter.println("Recording could not start: " + state);
          return ExitCode.RUNTIME_FAILURE;
        }
        CliPrinter.println("Recording to " + config.recordingsDirectory() + " (" + state + ")");

        if (durationSeconds > 0) {
          shutdown.await(durationSeconds, TimeUnit.SECONDS);
        } else {
          shutdown.await();
        }
        RecordingState last = recorder.currentState();
        recorder.stop().get(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        CliPrinter.println("Recording stopped (last state " + last + ")");
        return last.is(Phase.ERROR) ? ExitCode.RUNTIME_FAILURE : ExitCode.SUCCESS;
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Recording interrupted");
      return ExitCode.INTERRUPTED;
    } catch (ExecutionException | TimeoutException ex) {
      log.error("Recorder did not respond", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (PersistenceException ex) {
      log.error("Database unavailable at {}", config.databaseFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while recording", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      removeHook(hook);
      root.close();
    }
  }

  private static void report(RecordingStatus status) {
    status.error().ifPresent(error -> CliPrinter.printf(
        "[%s] %s: %s", error.code().code(), error.code().displayName(), error.message()));
  }

  private static boolean hasRetentionKeys(Map<String, String> effective) {
    return effective.keySet().stream().anyMatch(key -> key.startsWith("retention."));
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down");
    }
  }

  private static void printPlan(RecorderConfig config, long durationSeconds, RetentionConfig retention) {
    CliPrinter.printLines(
        "Record dry-run: nothing will be captured.",
        " Data dir        : " + config.dataDirectory(),
        " Database        : " + config.databaseFile(),
        " Recordings      : " + config.recordingsDirectory(),
        " Frames/second   : " + config.framesPerSecond(),
        " Chunk seconds   : " + config.chunkSeconds(),
        " Monitor every   : " + config.monitorIntervalSeconds() + " s",
        " Resolution      : " + config.width() + "x" + config.height(),
        " Codec/quality   : " + config.codec().displayName() + " / " + config.quality(),
        " Duration        : " + (durationSeconds == 0 ? "until interrupted" : durationSeconds + " s"),
        " Retention       : " + (retention == null ? "stored policy" : retention.toString()));
  }
}
