package ca.gc.cra.screenlog.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line tokens split into flags ({@code --name}) and {@code key=value} arguments.
 *
 * <p>{@code --help}/{@code -h}/{@code help} and {@code --verbose}/{@code -v} are recognised everywhere; other flags
 * are kept lower-cased for {@link #hasFlag(String)}.</p>
 *
 * @since 0.1.0
 */
final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v");

  private final List<String> arguments;
  private final Set<String> flags;

  private CliInput(List<String> arguments, Set<String> flags) {
    this.arguments = List.copyOf(arguments);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Splits raw tokens. {@code null} and blank tokens are skipped.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed input
   */
  static CliInput parse(String[] args) {
    List<String> arguments = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String token = raw.trim();
      String lower = token.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (token.startsWith("-") && !token.contains("=")) {
        flags.add(lower);
      } else {
        arguments.add(token);
      }
    }
    return new CliInput(arguments, flags);
  }

  /** Non-flag tokens in their original order. */
  String[] arguments() {
    return arguments.toArray(String[]::new);
  }

  /** Non-flag tokens after the first one; used by the dispatcher to forward to a command. */
  String[] argumentsAfterCommand() {
    String[] all = arguments();
    return all.length == 0 ? all : Arrays.copyOfRange(all, 1, all.length);
  }

  boolean help() {
    return flags.contains("--help");
  }

  boolean verbose() {
    return flags.contains("--verbose");
  }

  boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
