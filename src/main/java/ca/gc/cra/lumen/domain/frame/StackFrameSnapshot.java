package ca.gc.cra.lumen.domain.frame;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> One stack frame reported with a break notification.
 * <p><strong>Why:</strong> Both protocols report frames with locals and upvalues; Emmy numbers them by stack level,
 * LuaPanda by a frame index, and both map onto {@code index}.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @param file source file as reported by the runtime (may be relative or a chunk name)
 * @param line 1-based line; 0 or negative for frames without line information (C functions)
 * @param functionName function name, empty when unknown
 * @param index stack level / frame index used to bind evaluation requests
 * @param locals local variables
 * @param upvalues upvalues
 * @since 0.1.0
 */
public record StackFrameSnapshot(
    String file,
    int line,
    String functionName,
    int index,
    List<Variable> locals,
    List<Variable> upvalues) {

  public StackFrameSnapshot {
    file = Objects.requireNonNullElse(file, "");
    functionName = Objects.requireNonNullElse(functionName, "");
    locals = locals == null ? List.of() : List.copyOf(locals);
    upvalues = upvalues == null ? List.of() : List.copyOf(upvalues);
  }

  /**
   * Label used by stack views, e.g. {@code update main.lua:12}.
   *
   * @return display label
   */
  public String label() {
    String fn = functionName.isEmpty() ? "?" : functionName;
    return fn + " " + file + ":" + line;
  }
}
