package ca.gc.cra.lumen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private final StringWriter buffer = new StringWriter();

  @BeforeEach
  void captureOutput() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("processes"));
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().startsWith("usage: lumen"));
  }

  @Test
  void unknownCommandRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture", "iface=en0"}));
  }

  @Test
  void commandHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"panda", "--help"}));
    assertTrue(buffer.toString().contains("LUMEN LuaPanda session"));
  }
}
