package ca.gc.cra.lumen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PandaCliTest {
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
  void unknownTransportIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, PandaCli.run(new String[] {"transport=udp"}));
    assertTrue(buffer.toString().contains("usage: panda"));
  }

  @Test
  void clientWithoutHostIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, PandaCli.run(new String[] {"transport=client", "host="}));
  }

  @Test
  void badMetricsExporterIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, PandaCli.run(new String[] {"metricsExporter=prometheus"}));
  }
}
