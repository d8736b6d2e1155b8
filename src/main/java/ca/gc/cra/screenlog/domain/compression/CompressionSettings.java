package ca.gc.cra.screenlog.domain.compression;

import java.util.Objects;

/**
 * <strong>What:</strong> Encoder configuration for the next chunk.
 * <p><strong>Why:</strong> The adaptive controller tunes only the bitrate multiplier, which is bounded so that
 * quality never collapses or balloons regardless of observed chunk sizes.</p>
 * <p><strong>Thread-safety:</strong> Immutable; adjustments return new instances.</p>
 *
 * @param resolution output resolution
 * @param codec video codec
 * @param quality quality preset
 * @param baseBitrate bitrate in bits per second before multipliers
 * @param multiplier adaptive multiplier, clamped to {@code [0.4, 2.0]}
 * @param keyframeInterval frames between keyframes
 * @since 0.1.0
 */
public record CompressionSettings(
    Resolution resolution,
    VideoCodec codec,
    CompressionQuality quality,
    long baseBitrate,
    double multiplier,
    int keyframeInterval) {

  /** Lower bound of the adaptive multiplier. */
  public static final double MIN_MULTIPLIER = 0.4;
  /** Upper bound of the adaptive multiplier. */
  public static final double MAX_MULTIPLIER = 2.0;
  /** Base bitrate for 1920x1080 output. */
  public static final long REFERENCE_BITRATE = 560_000L;
  /** Default frames between keyframes. */
  public static final int DEFAULT_KEYFRAME_INTERVAL = 30;

  public CompressionSettings {
    Objects.requireNonNull(resolution, "resolution");
    Objects.requireNonNull(codec, "codec");
    Objects.requireNonNull(quality, "quality");
    if (baseBitrate <= 0) {
      throw new IllegalArgumentException("baseBitrate must be positive");
    }
    if (keyframeInterval <= 0) {
      throw new IllegalArgumentException("keyframeInterval must be positive");
    }
    if (Double.isNaN(multiplier)) {
      throw new IllegalArgumentException("multiplier must be a number");
    }
    multiplier = clampMultiplier(multiplier);
  }

  /**
   * Builds default settings scaled to the requested resolution.
   *
   * @param resolution output resolution
   * @return H.264, auto quality, multiplier {@code 1.0}
   */
  public static CompressionSettings defaults(Resolution resolution) {
    return defaults(resolution, VideoCodec.H264, CompressionQuality.AUTO);
  }

  /**
   * Builds default settings for the given codec and quality.
   *
   * @param resolution output resolution
   * @param codec codec to use
   * @param quality quality preset
   * @return settings with base bitrate proportional to the pixel count
   */
  public static CompressionSettings defaults(
      Resolution resolution, VideoCodec codec, CompressionQuality quality) {
    Objects.requireNonNull(resolution, "resolution");
    double scale = (double) resolution.pixels() / Resolution.FULL_HD.pixels();
    long bitrate = Math.max(1L, Math.round(REFERENCE_BITRATE * scale));
    return new CompressionSettings(resolution, codec, quality, bitrate, 1.0, DEFAULT_KEYFRAME_INTERVAL);
  }

  /**
   * Clamps a candidate multiplier into the supported range.
   *
   * @param candidate requested multiplier
   * @return value within {@code [MIN_MULTIPLIER, MAX_MULTIPLIER]}
   */
  public static double clampMultiplier(double candidate) {
    return Math.max(MIN_MULTIPLIER, Math.min(MAX_MULTIPLIER, candidate));
  }

  /**
   * Returns the bitrate the encoder should target.
   *
   * @return base bitrate scaled by multiplier and quality preset, in bits per second
   */
  public long effectiveBitrate() {
    return Math.max(1L, Math.round(baseBitrate * multiplier * quality.bitrateFactor()));
  }

  /**
   * Returns a copy with a new multiplier.
   *
   * @param newMultiplier requested multiplier; clamped into range
   * @return adjusted settings
   */
  public CompressionSettings withMultiplier(double newMultiplier) {
    return new CompressionSettings(resolution, codec, quality, baseBitrate, newMultiplier, keyframeInterval);
  }

  /**
   * Returns a copy for a new resolution, rescaling the base bitrate and keeping the multiplier.
   *
   * @param newResolution output resolution
   * @return adjusted settings
   */
  public CompressionSettings withResolution(Resolution newResolution) {
    CompressionSettings scaled = defaults(newResolution, codec, quality);
    return new CompressionSettings(
        newResolution, codec, quality, scaled.baseBitrate(), multiplier, keyframeInterval);
  }
}
