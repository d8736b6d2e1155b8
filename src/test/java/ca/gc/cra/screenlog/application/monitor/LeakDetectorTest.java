package ca.gc.cra.screenlog.application.monitor;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.screenlog.domain.memory.MemorySnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class LeakDetectorTest {
  @Test
  void steadyGrowthAcrossAllThirdsIsALeak() {
    Optional<LeakDetector.Finding> finding = LeakDetector.analyze(window(500, 520, 540, 555, 570, 585), 5.0);

    assertTrue(finding.isPresent());
    assertEquals(17.0, finding.get().growthPercent(), 1e-9);
    assertEquals(510.0, finding.get().earlyAverageMb(), 1e-9);
    assertEquals(547.5, finding.get().middleAverageMb(), 1e-9);
    assertEquals(577.5, finding.get().lateAverageMb(), 1e-9);
  }

  @Test
  void spikeThatSettlesIsNotALeak() {
    assertTrue(LeakDetector.analyze(window(500, 600, 620, 550, 510, 505), 5.0).isEmpty());
  }

  @Test
  void growthWithFallingMiddleIsNotALeak() {
    assertTrue(LeakDetector.analyze(window(500, 520, 480, 490, 560, 600), 5.0).isEmpty());
  }

  @Test
  void growthAtOrBelowThresholdIsIgnored() {
    assertTrue(LeakDetector.analyze(window(500, 504, 508, 512, 516, 520), 5.0).isEmpty());
  }

  @Test
  void tooFewSamplesAreIgnored() {
    assertTrue(LeakDetector.analyze(window(100, 200), 5.0).isEmpty());
    assertEquals(0.0, LeakDetector.growthPercent(window(0, 50)));
  }

  private static List<MemorySnapshot> window(double... usedMb) {
    List<MemorySnapshot> snapshots = new ArrayList<>();
    for (int i = 0; i < usedMb.length; i++) {
      snapshots.add(new MemorySnapshot(i * 10_000L, usedMb[i], 8_000, 0, 1, OptionalInt.empty()));
    }
    return snapshots;
  }
}
