package ca.gc.cra.screenlog.api;

import ca.gc.cra.screenlog.application.monitor.MemoryMonitor;
import ca.gc.cra.screenlog.application.port.EventChannel;
import ca.gc.cra.screenlog.config.CompositionRoot;
import ca.gc.cra.screenlog.config.RecorderConfig;
import ca.gc.cra.screenlog.domain.memory.MemoryAlert;
import ca.gc.cra.screenlog.domain.memory.MemorySnapshot;
import ca.gc.cra.screenlog.infrastructure.persistence.PersistenceException;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples process memory a fixed number of times and prints each snapshot and every alert raised.
 *
 * @since 0.1.0
 */
final class MemoryCli {
  private static final Logger log = LoggerFactory.getLogger(MemoryCli.class);
  private static final String MODE = "memory";
  private static final String SUMMARY_USAGE = "usage: memory [samples=1-360] [intervalMillis=0-60000] [dataDir=PATH]";
  private static final String HELP_TEXT = """
      SCREENLOG memory sampler

      Usage:
        memory [options]

      Options:
        samples=1-360           Number of samples (default 6)
        intervalMillis=0-60000  Pause between samples (default 1000)
        dataDir=PATH            Data directory (default ~/.screenlog)
        config=PATH             YAML file; 'common' and 'memory' sections apply
        --verbose               Enable DEBUG logging
      """;

  private MemoryCli() {}

  static ExitCode run(CliInput input) {
    return run(input, config -> new CompositionRoot(config));
  }

  static ExitCode run(CliInput input, Function<RecorderConfig, CompositionRoot> rootFactory) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    long samples;
    long intervalMillis;
    RecorderConfig config;
    try {
      Map<String, String> cli = CliArgsParser.toMap(input.argumentsAfterCommand());
      samples = CliArgsParser.takeLong(cli, "samples", 6L, 1L, 360L);
      intervalMillis = CliArgsParser.takeLong(cli, "intervalMillis", 1_000L, 0L, 60_000L);
      config = RecorderConfig.fromMap(CommandSupport.effectiveConfig(MODE, cli));
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<MemoryAlert> alerts = new CopyOnWriteArrayList<>();
    try (CompositionRoot root = rootFactory.apply(config)) {
      MemoryMonitor monitor = root.memoryMonitor();
      try (EventChannel.Registration ignored = monitor.onAlert(alerts::add)) {
        CliPrinter.printf("%-24s %10s %10s %7s %8s %7s %5s",
            "TIME", "USED_MB", "AVAIL_MB", "USAGE", "PRESSURE", "THREADS", "DB");
        for (long i = 0; i < samples; i++) {
          if (i > 0 && intervalMillis > 0) {
            TimeUnit.MILLISECONDS.sleep(intervalMillis);
          }
          print(monitor.sampleNow());
        }
      }
      for (MemoryAlert alert : alerts) {
        CliPrinter.printf("ALERT %s: %s", alert.severity(), alert.message());
        CliPrinter.printf("  -> %s", alert.recommendedAction());
      }
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return ExitCode.INTERRUPTED;
    } catch (PersistenceException ex) {
      log.error("Unable to open {}", config.databaseFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while sampling memory", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void print(MemorySnapshot snapshot) {
    CliPrinter.printf("%-24s %10.1f %10.1f %6.1f%% %8s %7d %5s",
        Instant.ofEpochMilli(snapshot.timestampMillis()),
        snapshot.usedMemoryMb(),
        snapshot.availableMemoryMb(),
        snapshot.memoryUsagePercent(),
        snapshot.memoryPressure(),
        snapshot.activeThreadCount(),
        snapshot.persistenceConnectionCount().isPresent()
            ? Integer.toString(snapshot.persistenceConnectionCount().getAsInt())
            : "-");
  }
}
