package ca.gc.cra.lumen.application.port;

import java.util.Optional;

/**
 * Loads script text by logical resource path (e.g. {@code debugger/emmy/emmyHelper.lua}). Consulted once per
 * handshake to build the init payload.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ScriptProvider {

  /**
   * Returns the script source for a logical path.
   *
   * @param logicalPath resource path or file system path
   * @return script text, or empty when the script does not exist or cannot be read
   */
  Optional<String> load(String logicalPath);
}
