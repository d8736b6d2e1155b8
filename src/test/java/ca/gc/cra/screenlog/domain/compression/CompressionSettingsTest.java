package ca.gc.cra.screenlog.domain.compression;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CompressionSettingsTest {
  @Test
  void defaultBitrateScalesWithPixelCount() {
    CompressionSettings fullHd = CompressionSettings.defaults(Resolution.FULL_HD);
    CompressionSettings halfWidth = CompressionSettings.defaults(new Resolution(960, 1080));
    assertEquals(CompressionSettings.REFERENCE_BITRATE, fullHd.baseBitrate());
    assertEquals(CompressionSettings.REFERENCE_BITRATE / 2, halfWidth.baseBitrate());
    assertEquals(1.0, fullHd.multiplier());
  }

  @Test
  void multiplierIsClampedToSupportedRange() {
    CompressionSettings base = CompressionSettings.defaults(Resolution.FULL_HD);
    assertEquals(CompressionSettings.MIN_MULTIPLIER, base.withMultiplier(0.1).multiplier());
    assertEquals(CompressionSettings.MAX_MULTIPLIER, base.withMultiplier(9.0).multiplier());
  }

  @Test
  void effectiveBitrateAppliesQualityFactor() {
    CompressionSettings high = CompressionSettings.defaults(Resolution.FULL_HD, VideoCodec.H265, CompressionQuality.HIGH);
    assertEquals(840_000L, high.effectiveBitrate());
  }

  @Test
  void resolutionChangeKeepsMultiplier() {
    CompressionSettings tuned = CompressionSettings.defaults(Resolution.FULL_HD).withMultiplier(1.2);
    CompressionSettings rebased = tuned.withResolution(new Resolution(3840, 2160));
    assertEquals(1.2, rebased.multiplier(), 1e-9);
    assertEquals(CompressionSettings.REFERENCE_BITRATE * 4, rebased.baseBitrate());
  }

  @Test
  void parsesCodecAndQualityNames() {
    assertEquals(VideoCodec.H265, VideoCodec.parse("HEVC"));
    assertEquals(VideoCodec.H264, VideoCodec.parse("h.264"));
    assertEquals(CompressionQuality.LOW, CompressionQuality.parse(" low "));
    assertThrows(IllegalArgumentException.class, () -> VideoCodec.parse("vp9"));
    assertThrows(IllegalArgumentException.class, () -> CompressionQuality.parse("ultra"));
  }
}
