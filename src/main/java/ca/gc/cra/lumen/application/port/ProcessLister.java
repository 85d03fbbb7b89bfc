package ca.gc.cra.lumen.application.port;

import ca.gc.cra.lumen.domain.attach.ProcessInfo;
import java.io.IOException;
import java.util.List;

/**
 * Enumerates attachable processes.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProcessLister {

  /**
   * Lists running processes.
   *
   * @return processes in the order reported
   * @throws IOException when the listing tool fails
   * @throws InterruptedException when interrupted while waiting for the tool
   */
  List<ProcessInfo> listProcesses() throws IOException, InterruptedException;
}
