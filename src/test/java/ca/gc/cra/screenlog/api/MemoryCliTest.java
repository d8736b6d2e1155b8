package ca.gc.cra.screenlog.api;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.screenlog.application.port.ClockPort;
import ca.gc.cra.screenlog.config.CompositionRoot;
import ca.gc.cra.screenlog.testing.RecordingMetricsPort;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MemoryCliTest {
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
  void printsOneRowPerSample() {
    ExitCode code = MemoryCli.run(CliInput.parse(new String[] {
        "memory", "dataDir=" + tempDir, "samples=3", "intervalMillis=0"}),
        config -> new CompositionRoot(config, ClockPort.SYSTEM, new RecordingMetricsPort()));

    assertEquals(ExitCode.SUCCESS, code);
    String[] lines = buffer.toString().split("\\R");
    assertTrue(lines[0].contains("USED_MB"));
    long rows = Arrays.stream(lines).filter(line -> line.matches("^\\d{4}-\\d{2}-\\d{2}T.*")).count();
    assertEquals(3, rows);
  }

  @Test
  void sampleCountIsBounded() {
    assertEquals(ExitCode.INVALID_ARGS, MemoryCli.run(CliInput.parse(new String[] {"memory", "samples=0"})));
    assertEquals(ExitCode.INVALID_ARGS, MemoryCli.run(CliInput.parse(new String[] {"memory", "samples=361"})));
    assertTrue(buffer.toString().contains("usage: memory"));
  }
}
