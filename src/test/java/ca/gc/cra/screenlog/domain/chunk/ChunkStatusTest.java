package ca.gc.cra.screenlog.domain.chunk;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ChunkStatusTest {
  @Test
  void onlyPendingChunksMayMove() {
    assertTrue(ChunkStatus.PENDING.canTransitionTo(ChunkStatus.COMPLETED));
    assertTrue(ChunkStatus.PENDING.canTransitionTo(ChunkStatus.FAILED));
    assertFalse(ChunkStatus.PENDING.canTransitionTo(ChunkStatus.PENDING));
    assertFalse(ChunkStatus.COMPLETED.canTransitionTo(ChunkStatus.PENDING));
    assertFalse(ChunkStatus.COMPLETED.canTransitionTo(ChunkStatus.FAILED));
    assertFalse(ChunkStatus.FAILED.canTransitionTo(ChunkStatus.COMPLETED));
  }

  @Test
  void databaseValuesRoundTripCaseInsensitively() {
    assertEquals("completed", ChunkStatus.COMPLETED.dbValue());
    assertEquals(ChunkStatus.FAILED, ChunkStatus.fromDbValue(" Failed "));
    assertThrows(IllegalArgumentException.class, () -> ChunkStatus.fromDbValue(null));
    assertThrows(IllegalArgumentException.class, () -> ChunkStatus.fromDbValue("archived"));
  }
}
