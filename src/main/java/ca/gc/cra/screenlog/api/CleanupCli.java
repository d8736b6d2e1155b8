package ca.gc.cra.screenlog.api;

import ca.gc.cra.screenlog.application.retention.RetentionService;
import ca.gc.cra.screenlog.config.CompositionRoot;
import ca.gc.cra.screenlog.config.RecorderConfig;
import ca.gc.cra.screenlog.config.RetentionConfig;
import ca.gc.cra.screenlog.domain.chunk.CleanupStats;
import ca.gc.cra.screenlog.domain.chunk.StorageUsage;
import ca.gc.cra.screenlog.infrastructure.persistence.PersistenceException;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the retention policy once and prints what was removed and how much storage remains in use.
 *
 * @since 0.1.0
 */
final class CleanupCli {
  private static final Logger log = LoggerFactory.getLogger(CleanupCli.class);
  private static final String MODE = "cleanup";
  private static final double MB = 1024.0 * 1024.0;
  private static final String SUMMARY_USAGE =
      "usage: cleanup [dataDir=PATH] [retention.retentionDays=1-365] [retention.maxStorageGB=1-1000] "
          + "[retention.cleanupIntervalHours=1-24] [retention.enabled=true|false] [config=PATH] [--save]";
  private static final String HELP_TEXT = """
      SCREENLOG retention cleanup

      Usage:
        cleanup [options]

      Options:
        dataDir=PATH                      Data directory (default ~/.screenlog)
        retention.retentionDays=1-365     Keep chunks this many days (default: stored policy)
        retention.maxStorageGB=1-1000     Quota used for the usage report
        retention.cleanupIntervalHours=1-24
        retention.enabled=true|false
        config=PATH                       YAML file; 'common' and 'cleanup' sections apply
        --save                            Persist the given retention values as the stored policy
        --verbose                         Enable DEBUG logging
      """;

  private CleanupCli() {}

  static ExitCode run(CliInput input) {
    return run(input, config -> new CompositionRoot(config));
  }

  static ExitCode run(CliInput input, Function<RecorderConfig, CompositionRoot> rootFactory) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    RecorderConfig config;
    Map<String, String> effective;
    try {
      effective = CommandSupport.effectiveConfig(MODE, CliArgsParser.toMap(input.argumentsAfterCommand()));
      config = RecorderConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid cleanup arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = rootFactory.apply(config)) {
      RetentionService retention = root.retentionService();
      RetentionConfig stored = retention.policy();
      RetentionConfig policy = RetentionConfig.fromMap(effective, stored);
      Optional<CleanupStats> result;
      if (policy.equals(stored)) {
        result = retention.performCleanup();
      } else if (input.hasFlag("--save")) {
        retention.updatePolicy(policy);
        result = retention.performCleanup();
      } else {
        result = runOnce(root, policy);
      }
      if (result.isEmpty()) {
        CliPrinter.println(policy.enabled()
            ? "Cleanup did not complete; see the log for details."
            : "Retention is disabled; nothing was removed.");
        return policy.enabled() ? ExitCode.RUNTIME_FAILURE : ExitCode.SUCCESS;
      }
      CleanupStats stats = result.get();
      StorageUsage usage = root.store().storageUsage(config.recordingsDirectory());
      CliPrinter.printf("Chunks older than %d day(s): %d", policy.retentionDays(), stats.chunksFound());
      CliPrinter.printf("Files deleted   : %d", stats.filesDeleted());
      CliPrinter.printf("Records deleted : %d", stats.recordsDeleted());
      CliPrinter.printf("Freed           : %.1f MB", stats.megabytesFreed());
      CliPrinter.printf("Storage in use  : %.1f MB of %d GB (%.1f%%)",
          usage.totalBytes() / MB, policy.maxStorageGB(), usage.fractionOf(policy.maxStorageBytes()) * 100.0);
      return ExitCode.SUCCESS;
    } catch (PersistenceException ex) {
      log.error("Cleanup failed against {}", config.databaseFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid retention policy: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Unexpected cleanup failure", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Optional<CleanupStats> runOnce(CompositionRoot root, RetentionConfig policy) {
    if (!policy.enabled()) {
      return Optional.empty();
    }
    return Optional.of(root.store().cleanupOldChunks(policy.retentionDays()));
  }
}
