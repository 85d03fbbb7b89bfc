package ca.gc.cra.lumen.application.port;

import ca.gc.cra.lumen.domain.attach.ModuleScan;
import java.io.IOException;

/**
 * Inspects the modules loaded by a target process.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ModuleScanner {

  /**
   * Lists and classifies the modules of {@code pid}.
   *
   * @param pid target process id
   * @return classified module report
   * @throws IOException when no probe could produce a module list
   * @throws InterruptedException when interrupted while a probe runs
   */
  ModuleScan scan(int pid) throws IOException, InterruptedException;
}
