package ca.gc.cra.lumen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lumen.domain.session.FailureKind;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExitCodeTest {

  @Test
  void codesAreDistinct() {
    Set<Integer> seen = new HashSet<>();
    for (ExitCode code : ExitCode.values()) {
      assertTrue(seen.add(code.code()), code.name());
    }
    assertEquals(6, ExitCode.ATTACH_REFUSED.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }

  @Test
  void everyFailureKindHasAnExitCode() {
    for (FailureKind kind : FailureKind.values()) {
      assertNotNull(ExitCode.forFailure(kind), kind.name());
    }
    assertEquals(ExitCode.SUCCESS, ExitCode.forFailure(null));
    assertEquals(ExitCode.ATTACH_REFUSED, ExitCode.forFailure(FailureKind.DOUBLE_ATTACH));
    assertEquals(ExitCode.IO_ERROR, ExitCode.forFailure(FailureKind.CONNECT_FAILED));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forFailure(FailureKind.INTERNAL));
  }
}
