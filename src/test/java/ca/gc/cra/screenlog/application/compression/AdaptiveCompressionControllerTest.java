package ca.gc.cra.screenlog.application.compression;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.screenlog.domain.compression.AdjustmentRecord;
import ca.gc.cra.screenlog.domain.compression.AdjustmentStatistics;
import ca.gc.cra.screenlog.domain.compression.CompletedChunk;
import ca.gc.cra.screenlog.domain.compression.CompressionSettings;
import ca.gc.cra.screenlog.domain.compression.Resolution;
import ca.gc.cra.screenlog.testing.MutableClock;
import ca.gc.cra.screenlog.testing.RecordingMetricsPort;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AdaptiveCompressionControllerTest {
  private static final long CHUNK_SECONDS = 900L;
  private static final long TARGET = AdaptiveCompressionController.targetChunkBytes(CHUNK_SECONDS);

  private RecordingMetricsPort metrics;
  private AdaptiveCompressionController controller;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    controller = new AdaptiveCompressionController(
        CompressionSettings.defaults(Resolution.FULL_HD), new MutableClock(5_000L), metrics);
  }

  @Test
  void targetDerivesFromTwoGigabytesPerEightHourDay() {
    assertEquals(64L * 1024 * 1024, TARGET);
    assertEquals(2L * 1024 * 1024 * 1024, AdaptiveCompressionController.targetChunkBytes(8 * 3600));
  }

  @Test
  void waitsForFullWindowBeforeAdjusting() {
    for (int i = 0; i < AdaptiveCompressionController.WINDOW_SIZE - 1; i++) {
      assertTrue(controller.analyzeAndAdjust(chunk(TARGET * 2)).isEmpty());
    }
    assertEquals(1.0, controller.currentSettings().multiplier());
  }

  @Test
  void oversizedChunksLowerMultiplier() {
    Optional<CompressionSettings> adjusted = feed(TARGET * 2, 4);

    assertTrue(adjusted.isPresent());
    assertEquals(0.95, adjusted.get().multiplier(), 1e-9);
    assertEquals(0.95, controller.currentSettings().multiplier(), 1e-9);

    AdjustmentRecord record = controller.history().get(0);
    assertEquals("Oversized chunks", record.reason());
    assertEquals(1.0, record.deviation(), 1e-9);
    assertEquals(TARGET, record.targetChunkBytes());
    assertEquals(5_000L, record.timestampMillis());
    assertEquals(1, metrics.count("compression.adjusted"));
    assertEquals(950L, metrics.observed("compression.multiplierPermille").get(0));
  }

  @Test
  void undersizedChunksRaiseMultiplierMoreGently() {
    Optional<CompressionSettings> adjusted = feed(0L, 4);

    assertTrue(adjusted.isPresent());
    assertEquals(1.025, adjusted.get().multiplier(), 1e-9);
    assertEquals("Undersized chunks", controller.history().get(0).reason());
  }

  @Test
  void sizesWithinToleranceLeaveSettingsAlone() {
    assertTrue(feed(TARGET + TARGET / 20, 4).isEmpty());
    assertTrue(feed(TARGET - TARGET / 20, 4).isEmpty());
    assertTrue(controller.history().isEmpty());
  }

  @Test
  void windowRollsSoEveryFurtherChunkIsEvaluated() {
    feed(TARGET * 2, 4);
    Optional<CompressionSettings> second = controller.analyzeAndAdjust(chunk(TARGET * 2));

    assertTrue(second.isPresent());
    assertEquals(0.9025, second.get().multiplier(), 1e-9);

    AdjustmentStatistics stats = controller.statistics();
    assertEquals(2, stats.totalAdjustments());
    assertEquals(2, stats.decreasedCount());
    assertEquals(0, stats.increasedCount());
    assertEquals(0.9025, stats.minMultiplier(), 1e-9);
    assertEquals(0.95, stats.maxMultiplier(), 1e-9);
  }

  @Test
  void multiplierNeverLeavesSupportedRange() {
    Optional<CompressionSettings> adjusted = feed(TARGET * 100, 4);
    assertEquals(CompressionSettings.MIN_MULTIPLIER, adjusted.orElseThrow().multiplier());

    assertTrue(controller.analyzeAndAdjust(chunk(TARGET * 100)).isEmpty());
    assertEquals(CompressionSettings.MIN_MULTIPLIER, controller.currentSettings().multiplier());
  }

  @Test
  void zeroLengthChunksAreIgnored() {
    CompletedChunk empty = new CompletedChunk(
        Path.of("10_10.sfr"), 0L, 10L, 10L, 0, controller.currentSettings());
    for (int i = 0; i < 8; i++) {
      assertTrue(controller.analyzeAndAdjust(empty).isEmpty());
    }
    assertTrue(controller.history().isEmpty());
  }

  @Test
  void resetRestoresUnitMultiplierAndClearsWindow() {
    feed(TARGET * 2, 4);
    controller.reset();

    assertEquals(1.0, controller.currentSettings().multiplier());
    assertTrue(feed(TARGET * 2, 3).isEmpty());
  }

  @Test
  void rebaseKeepsLearnedMultiplier() {
    feed(TARGET * 2, 4);
    controller.rebase(CompressionSettings.defaults(new Resolution(1280, 720)));

    assertEquals(new Resolution(1280, 720), controller.currentSettings().resolution());
    assertEquals(0.95, controller.currentSettings().multiplier(), 1e-9);
  }

  @Test
  void statisticsWithoutHistoryReportCurrentMultiplier() {
    AdjustmentStatistics stats = controller.statistics();
    assertEquals(0, stats.totalAdjustments());
    assertEquals(1.0, stats.currentMultiplier());
    assertEquals(1.0, stats.stabilityScore());
  }

  private Optional<CompressionSettings> feed(long sizeBytes, int count) {
    Optional<CompressionSettings> last = Optional.empty();
    for (int i = 0; i < count; i++) {
      last = controller.analyzeAndAdjust(chunk(sizeBytes));
    }
    return last;
  }

  private CompletedChunk chunk(long sizeBytes) {
    return new CompletedChunk(
        Path.of("0_900.sfr"), sizeBytes, 0L, CHUNK_SECONDS, 900, controller.currentSettings());
  }
}
