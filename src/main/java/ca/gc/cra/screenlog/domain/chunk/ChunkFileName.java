package ca.gc.cra.screenlog.domain.chunk;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Chunk file naming convention {@code <startEpochSeconds>_<endEpochSeconds>.<ext>}.
 * <p><strong>Why:</strong> Lets chunk time ranges be recovered from the file system if the store is rebuilt.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param startEpochSeconds chunk start
 * @param endEpochSeconds chunk end
 * @param extension file extension without the dot
 * @since 0.1.0
 */
public record ChunkFileName(long startEpochSeconds, long endEpochSeconds, String extension) {
  private static final Pattern PATTERN = Pattern.compile("^(\\d+)_(\\d+)\\.([A-Za-z0-9]+)$");

  public ChunkFileName {
    Objects.requireNonNull(extension, "extension");
    if (startEpochSeconds < 0 || endEpochSeconds < startEpochSeconds) {
      throw new IllegalArgumentException(
          "invalid chunk range " + startEpochSeconds + ".." + endEpochSeconds);
    }
    if (extension.isBlank() || !extension.chars().allMatch(Character::isLetterOrDigit)) {
      throw new IllegalArgumentException("extension must be alphanumeric: " + extension);
    }
  }

  /**
   * Formats the file name.
   *
   * @return name such as {@code 1700000000_1700000900.mp4}
   */
  public String fileName() {
    return startEpochSeconds + "_" + endEpochSeconds + "." + extension;
  }

  /**
   * Resolves the file name against a directory.
   *
   * @param directory recordings directory
   * @return chunk path
   */
  public Path resolveIn(Path directory) {
    return Objects.requireNonNull(directory, "directory").resolve(fileName());
  }

  /**
   * Parses a chunk file name.
   *
   * @param fileName bare file name
   * @return parsed name, or empty when the name does not follow the convention
   */
  public static Optional<ChunkFileName> parse(String fileName) {
    if (fileName == null) {
      return Optional.empty();
    }
    Matcher matcher = PATTERN.matcher(fileName.trim());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    try {
      long start = Long.parseLong(matcher.group(1));
      long end = Long.parseLong(matcher.group(2));
      if (end < start) {
        return Optional.empty();
      }
      return Optional.of(new ChunkFileName(start, end, matcher.group(3)));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }

  /**
   * Parses the last path element of a chunk file.
   *
   * @param file chunk path
   * @return parsed name, or empty when it does not follow the convention
   */
  public static Optional<ChunkFileName> parse(Path file) {
    if (file == null || file.getFileName() == null) {
      return Optional.empty();
    }
    return parse(file.getFileName().toString());
  }
}
