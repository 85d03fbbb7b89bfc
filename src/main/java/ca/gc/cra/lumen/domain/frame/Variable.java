package ca.gc.cra.lumen.domain.frame;

import java.util.List;
import java.util.Objects;

/**
 * Rendered Lua value as reported by the debuggee.
 *
 * <p>{@code childRef} is the opaque token the runtime hands out for tables and userdata; children are fetched
 * lazily with a correlated follow-up request keyed by it. Some runtimes inline the first level of children,
 * which then appear in {@code children}.</p>
 *
 * @param name variable or field name
 * @param value display rendering
 * @param typeName Lua type name ({@code table}, {@code number}, ...)
 * @param childRef opaque child reference, or {@code null} for leaf values
 * @param children inlined children, possibly empty
 * @since 0.1.0
 */
public record Variable(String name, String value, String typeName, String childRef, List<Variable> children) {

  public Variable {
    name = Objects.requireNonNullElse(name, "");
    value = Objects.requireNonNullElse(value, "nil");
    typeName = Objects.requireNonNullElse(typeName, "");
    childRef = childRef == null || childRef.isBlank() || "0".equals(childRef) ? null : childRef;
    children = children == null ? List.of() : List.copyOf(children);
  }

  public static Variable leaf(String name, String value, String typeName) {
    return new Variable(name, value, typeName, null, List.of());
  }

  /**
   * Indicates whether the value can be expanded in a variables view.
   *
   * @return {@code true} when children are inlined or can be fetched
   */
  public boolean expandable() {
    return childRef != null || !children.isEmpty();
  }
}
