package ca.gc.cra.screenlog.api;

import ca.gc.cra.screenlog.config.CompositionRoot;
import ca.gc.cra.screenlog.config.RecorderConfig;
import ca.gc.cra.screenlog.domain.chunk.RecordingChunk;
import ca.gc.cra.screenlog.infrastructure.persistence.PersistenceException;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists completed chunks that no analysis batch has claimed yet.
 *
 * @since 0.1.0
 */
final class ChunksCli {
  private static final Logger log = LoggerFactory.getLogger(ChunksCli.class);
  private static final String MODE = "chunks";
  private static final String SUMMARY_USAGE = "usage: chunks [olderThan=EPOCH_SECONDS] [limit=N] [dataDir=PATH]";
  private static final String HELP_TEXT = """
      SCREENLOG unprocessed chunk listing

      Usage:
        chunks [options]

      Options:
        olderThan=EPOCH_SECONDS   Only chunks starting at or after this second (default 0)
        limit=N                   Print at most N chunks (default 100, 0 for all)
        dataDir=PATH              Data directory (default ~/.screenlog)
        config=PATH               YAML file; 'common' and 'chunks' sections apply
        --verbose                 Enable DEBUG logging
      """;

  private ChunksCli() {}

  static ExitCode run(CliInput input) {
    return run(input, config -> new CompositionRoot(config));
  }

  static ExitCode run(CliInput input, Function<RecorderConfig, CompositionRoot> rootFactory) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    long olderThan;
    long limit;
    RecorderConfig config;
    try {
      Map<String, String> cli = CliArgsParser.toMap(input.argumentsAfterCommand());
      olderThan = CliArgsParser.takeLong(cli, "olderThan", 0L, 0L, Long.MAX_VALUE);
      limit = CliArgsParser.takeLong(cli, "limit", 100L, 0L, Integer.MAX_VALUE);
      config = RecorderConfig.fromMap(CommandSupport.effectiveConfig(MODE, cli));
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = rootFactory.apply(config)) {
      List<RecordingChunk> chunks = root.store().fetchUnprocessedChunks(olderThan);
      if (chunks.isEmpty()) {
        CliPrinter.println("No unprocessed chunks.");
        return ExitCode.SUCCESS;
      }
      int shown = limit == 0 ? chunks.size() : (int) Math.min(limit, chunks.size());
      CliPrinter.printf("%-8s %-20s %-20s %s", "ID", "START", "END", "FILE");
      for (RecordingChunk chunk : chunks.subList(0, shown)) {
        CliPrinter.printf("%-8d %-20s %-20s %s",
            chunk.id(),
            Instant.ofEpochSecond(chunk.startEpochSeconds()),
            Instant.ofEpochSecond(chunk.endEpochSeconds()),
            chunk.file());
      }
      if (shown < chunks.size()) {
        CliPrinter.printf("... %d more", chunks.size() - shown);
      }
      return ExitCode.SUCCESS;
    } catch (PersistenceException ex) {
      log.error("Unable to query {}", config.databaseFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure listing chunks", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
