package ca.gc.cra.screenlog.domain.chunk;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ChunkFileNameTest {
  @Test
  void formatsStartAndEndSeparatedByUnderscore() {
    ChunkFileName name = new ChunkFileName(1_700_000_000L, 1_700_000_900L, "mp4");
    assertEquals("1700000000_1700000900.mp4", name.fileName());
    assertEquals(Path.of("/data/recordings/1700000000_1700000900.mp4"), name.resolveIn(Path.of("/data/recordings")));
  }

  @Test
  void parsesWellFormedNames() {
    Optional<ChunkFileName> parsed = ChunkFileName.parse("100_200.sfr");
    assertTrue(parsed.isPresent());
    assertEquals(100L, parsed.get().startEpochSeconds());
    assertEquals(200L, parsed.get().endEpochSeconds());
    assertEquals("sfr", parsed.get().extension());
  }

  @Test
  void parsesFileNameComponentOfPath() {
    assertEquals(Optional.of(new ChunkFileName(5, 9, "mp4")), ChunkFileName.parse(Path.of("/tmp/x/5_9.mp4")));
  }

  @Test
  void rejectsMalformedNames() {
    assertTrue(ChunkFileName.parse("100-200.mp4").isEmpty());
    assertTrue(ChunkFileName.parse("200_100.mp4").isEmpty());
    assertTrue(ChunkFileName.parse("100_200").isEmpty());
    assertTrue(ChunkFileName.parse("100_open.sfr.part").isEmpty());
    assertTrue(ChunkFileName.parse((String) null).isEmpty());
  }

  @Test
  void constructorRejectsInvertedRangeAndBadExtension() {
    assertThrows(IllegalArgumentException.class, () -> new ChunkFileName(10, 5, "mp4"));
    assertThrows(IllegalArgumentException.class, () -> new ChunkFileName(-1, 5, "mp4"));
    assertThrows(IllegalArgumentException.class, () -> new ChunkFileName(1, 5, "m.p4"));
  }
}
