package ca.gc.cra.screenlog.api;

import static org.junit.jupiter.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
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
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: screenlog"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    String out = buffer.toString();
    for (String command : new String[] {"record", "cleanup", "chunks", "memory"}) {
      assertTrue(out.contains(command), command);
    }
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay"}));
    assertTrue(buffer.toString().contains("usage: screenlog"));
  }

  @Test
  void commandHelpIsDispatched() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"cleanup", "--help"}));
    assertTrue(buffer.toString().contains("retention cleanup"));
  }

  @Test
  void commandNamesAreCaseInsensitive() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"MEMORY", "-h"}));
    assertTrue(buffer.toString().contains("memory sampler"));
  }
}
