package ca.gc.cra.screenlog.domain.memory;

import static org.junit.jupiter.api.Assertions.*;

import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class MemorySnapshotTest {
  @Test
  void computesUsageAgainstUsedPlusAvailable() {
    MemorySnapshot snapshot = new MemorySnapshot(0L, 750, 250, 3, 12, OptionalInt.of(2));
    assertEquals(1000.0, snapshot.totalMemoryMb(), 1e-9);
    assertEquals(75.0, snapshot.memoryUsagePercent(), 1e-9);
    assertEquals(MemoryPressure.WARNING, snapshot.memoryPressure());
  }

  @Test
  void pressureBoundariesAreInclusive() {
    assertEquals(MemoryPressure.NORMAL, MemoryPressure.fromUsagePercent(74.9));
    assertEquals(MemoryPressure.WARNING, MemoryPressure.fromUsagePercent(75.0));
    assertEquals(MemoryPressure.WARNING, MemoryPressure.fromUsagePercent(89.9));
    assertEquals(MemoryPressure.CRITICAL, MemoryPressure.fromUsagePercent(90.0));
  }

  @Test
  void emptyTotalReportsZeroUsage() {
    MemorySnapshot snapshot = new MemorySnapshot(0L, 0, 0, 0, 0, null);
    assertEquals(0.0, snapshot.memoryUsagePercent());
    assertTrue(snapshot.persistenceConnectionCount().isEmpty());
  }

  @Test
  void rejectsNegativeFigures() {
    assertThrows(IllegalArgumentException.class,
        () -> new MemorySnapshot(0L, -1, 10, 0, 0, OptionalInt.empty()));
  }
}
