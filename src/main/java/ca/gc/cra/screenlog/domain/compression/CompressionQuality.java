package ca.gc.cra.screenlog.domain.compression;

import java.util.Locale;

/**
 * User-facing quality preset; each preset scales the base bitrate.
 *
 * @since 0.1.0
 */
public enum CompressionQuality {
  LOW(0.5),
  MEDIUM(1.0),
  HIGH(1.5),
  /** Starts at medium and relies on the adaptive controller. */
  AUTO(1.0);

  private final double bitrateFactor;

  CompressionQuality(double bitrateFactor) {
    this.bitrateFactor = bitrateFactor;
  }

  public double bitrateFactor() {
    return bitrateFactor;
  }

  /**
   * Parses a configuration value.
   *
   * @param raw value such as {@code high}
   * @return matching preset
   * @throws IllegalArgumentException when the value is unknown
   */
  public static CompressionQuality parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("quality must not be blank");
    }
    try {
      return CompressionQuality.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("quality must be one of low, medium, high, auto (was " + raw + ")", ex);
    }
  }
}
