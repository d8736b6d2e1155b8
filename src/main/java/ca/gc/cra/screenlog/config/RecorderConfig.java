package ca.gc.cra.screenlog.config;

import ca.gc.cra.screenlog.application.pipeline.RecorderSettings;
import ca.gc.cra.screenlog.domain.compression.CompressionQuality;
import ca.gc.cra.screenlog.domain.compression.CompressionSettings;
import ca.gc.cra.screenlog.domain.compression.Resolution;
import ca.gc.cra.screenlog.domain.compression.VideoCodec;
import ca.gc.cra.screenlog.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated settings for a SCREENLOG process: where data lives and how the recorder, monitor
 * and store are tuned.
 * <p><strong>Role:</strong> Built from the merged YAML and CLI map and consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param dataDirectory root holding the database and the recordings directory
 * @param framesPerSecond capture rate (1-30)
 * @param chunkSeconds chunk length (10-3600)
 * @param monitorIntervalSeconds memory sampling interval (1-3600)
 * @param width capture width when no display reports one
 * @param height capture height when no display reports one
 * @param codec video codec
 * @param quality quality preset
 * @param readPoolSize pooled read connections (1-16)
 * @param bufferCapacity frame pool capacity (1-10000)
 * @since 0.1.0
 */
public record RecorderConfig(
    Path dataDirectory,
    int framesPerSecond,
    int chunkSeconds,
    int monitorIntervalSeconds,
    int width,
    int height,
    VideoCodec codec,
    CompressionQuality quality,
    int readPoolSize,
    int bufferCapacity) {

  public static final String DATABASE_FILE_NAME = "screenlog.db";
  public static final String RECORDINGS_DIRECTORY_NAME = "recordings";

  public RecorderConfig {
    Objects.requireNonNull(dataDirectory, "dataDirectory");
    Objects.requireNonNull(codec, "codec");
    Objects.requireNonNull(quality, "quality");
    Numbers.requireRange("fps", framesPerSecond, 1, 30);
    Numbers.requireRange("chunkSeconds", chunkSeconds, 10, 3600);
    Numbers.requireRange("monitorIntervalSeconds", monitorIntervalSeconds, 1, 3600);
    Numbers.requireRange("width", width, 16, 16_384);
    Numbers.requireRange("height", height, 16, 16_384);
    Numbers.requireRange("readPoolSize", readPoolSize, 1, 16);
    Numbers.requireRange("bufferCapacity", bufferCapacity, 1, 10_000);
  }

  /** {@code ~/.screenlog}, 1 fps, 15 minute chunks, 10 s sampling, 1920x1080, H.264 auto, 4 readers, 100 frames. */
  public static RecorderConfig defaults() {
    return new RecorderConfig(
        defaultDataDirectory(), 1, 900, 10, 1920, 1080, VideoCodec.H264, CompressionQuality.AUTO, 4, 100);
  }

  /**
   * Builds a configuration from flat keys, using defaults for missing ones.
   *
   * @param map merged YAML and CLI values
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static RecorderConfig fromMap(Map<String, String> map) {
    RecorderConfig d = defaults();
    if (map == null || map.isEmpty()) {
      return d;
    }
    String codec = map.get("codec");
    String quality = map.get("quality");
    return new RecorderConfig(
        parsePath(map.get("dataDir"), d.dataDirectory()),
        parseInt(map, "fps", d.framesPerSecond()),
        parseInt(map, "chunkSeconds", d.chunkSeconds()),
        parseInt(map, "monitorIntervalSeconds", d.monitorIntervalSeconds()),
        parseInt(map, "width", d.width()),
        parseInt(map, "height", d.height()),
        codec == null || codec.isBlank() ? d.codec() : VideoCodec.parse(codec),
        quality == null || quality.isBlank() ? d.quality() : CompressionQuality.parse(quality),
        parseInt(map, "readPoolSize", d.readPoolSize()),
        parseInt(map, "bufferCapacity", d.bufferCapacity()));
  }

  public Path databaseFile() {
    return dataDirectory.resolve(DATABASE_FILE_NAME);
  }

  public Path recordingsDirectory() {
    return dataDirectory.resolve(RECORDINGS_DIRECTORY_NAME);
  }

  public RecorderSettings recorderSettings() {
    return RecorderSettings.defaults()
        .withFramesPerSecond(framesPerSecond)
        .withChunkDuration(Duration.ofSeconds(chunkSeconds));
  }

  public CompressionSettings compressionSettings() {
    return CompressionSettings.defaults(new Resolution(width, height), codec, quality);
  }

  private static Path defaultDataDirectory() {
    return Path.of(System.getProperty("user.home", "."), ".screenlog");
  }

  private static Path parsePath(String raw, Path fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String value = raw.trim();
    if (value.equals("~") || value.startsWith("~/")) {
      value = System.getProperty("user.home", ".") + value.substring(1);
    }
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("dataDir is not a valid path: " + raw, ex);
    }
  }

  private static int parseInt(Map<String, String> map, String key, int defaultValue) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", ex);
    }
  }
}
