package ca.gc.cra.screenlog.domain.compression;

import java.util.Locale;

/**
 * Video codec choices offered to the encoder backend.
 *
 * @since 0.1.0
 */
public enum VideoCodec {
  /** H.264, widely compatible. */
  H264("H.264"),
  /** H.265/HEVC, smaller output for the same quality. */
  H265("H.265");

  private final String displayName;

  VideoCodec(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * Parses a configuration value such as {@code h264}, {@code H.265} or {@code hevc}.
   *
   * @param raw configuration value
   * @return matching codec
   * @throws IllegalArgumentException when the value is unknown
   */
  public static VideoCodec parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("codec must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace(".", "");
    return switch (normalized) {
      case "h264", "avc" -> H264;
      case "h265", "hevc" -> H265;
      default -> throw new IllegalArgumentException("codec must be h264 or h265 (was " + raw + ")");
    };
  }
}
