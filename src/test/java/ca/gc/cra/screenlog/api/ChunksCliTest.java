package ca.gc.cra.screenlog.api;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.screenlog.application.port.ClockPort;
import ca.gc.cra.screenlog.config.CompositionRoot;
import ca.gc.cra.screenlog.infrastructure.persistence.PersistenceCoordinator;
import ca.gc.cra.screenlog.testing.RecordingMetricsPort;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChunksCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void emptyStoreReportsNothing() {
    assertEquals(ExitCode.SUCCESS, run("chunks", "dataDir=" + tempDir));
    assertTrue(buffer.toString().contains("No unprocessed chunks."));
  }

  @Test
  void listsCompletedUnbatchedChunksFromStartTime() {
    try (PersistenceCoordinator store = openStore()) {
      completed(store, 100L);
      completed(store, 200L);
      long batched = completed(store, 300L);
      store.registerChunk(tempDir.resolve("recordings/400_500.sfr"), 400L, 500L);
      store.saveBatch(300L, 400L, List.of(batched));
    }

    assertEquals(ExitCode.SUCCESS, run("chunks", "dataDir=" + tempDir, "olderThan=150"));

    String out = buffer.toString();
    assertTrue(out.contains("200_300.sfr"));
    assertFalse(out.contains("100_200.sfr"));
    assertFalse(out.contains("300_400.sfr"));
    assertFalse(out.contains("400_500.sfr"));
  }

  @Test
  void limitTruncatesListing() {
    try (PersistenceCoordinator store = openStore()) {
      completed(store, 100L);
      completed(store, 200L);
      completed(store, 300L);
    }

    assertEquals(ExitCode.SUCCESS, run("chunks", "dataDir=" + tempDir, "limit=1"));

    String out = buffer.toString();
    assertTrue(out.contains("100_200.sfr"));
    assertFalse(out.contains("200_300.sfr"));
    assertTrue(out.contains("... 2 more"));
  }

  @Test
  void negativeOlderThanIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, run("chunks", "olderThan=-5"));
    assertTrue(buffer.toString().contains("usage: chunks"));
  }

  private ExitCode run(String... args) {
    return ChunksCli.run(CliInput.parse(args),
        config -> new CompositionRoot(config, ClockPort.SYSTEM, new RecordingMetricsPort()));
  }

  private PersistenceCoordinator openStore() {
    return PersistenceCoordinator.open(tempDir.resolve("screenlog.db"), 1, ClockPort.SYSTEM, new RecordingMetricsPort());
  }

  private long completed(PersistenceCoordinator store, long start) {
    long id = store.registerChunk(tempDir.resolve("recordings/" + start + "_" + (start + 100) + ".sfr"), start,
        start + 100);
    store.markCompleted(id);
    return id;
  }
}
