package ca.gc.cra.screenlog.api;

import ca.gc.cra.screenlog.logging.LoggingConfigurator;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SCREENLOG command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: screenlog <record|cleanup|chunks|memory> [key=value ...]";
  private static final String HELP_TEXT = """
      SCREENLOG screen recording core

      Usage:
        screenlog <command> [key=value ...]

      Commands:
        record    Record chunks until durationSeconds elapses or the process is interrupted
        cleanup   Apply the retention policy once and print what was removed
        chunks    List completed chunks not yet assigned to an analysis batch
        memory    Sample process memory and print snapshots and alerts

      Global flags:
        --help      Show this message (or a command's options: screenlog <command> --help)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * JVM entry point.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches to a command without exiting the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] tokens = input.arguments();
    if (tokens.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String command = tokens[0].toLowerCase(Locale.ROOT);
    return switch (command) {
      case "record" -> RecordCli.run(input);
      case "cleanup" -> CleanupCli.run(input);
      case "chunks" -> ChunksCli.run(input);
      case "memory" -> MemoryCli.run(input);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
