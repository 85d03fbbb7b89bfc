package ca.gc.cra.lumen.application.callback;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Correlation id generators for {@link CallbackRegistry}.
 *
 * <p>Emmy matches replies by an increasing {@code seq}; LuaPanda by a random numeric {@code callbackId}.
 * Neither generator ever yields the {@code "0"} sentinel.</p>
 *
 * @since 0.1.0
 */
public final class CorrelationIds {
  /** Smallest random LuaPanda callback id. */
  public static final int RANDOM_MIN = 10;
  /** Largest random LuaPanda callback id. */
  public static final int RANDOM_MAX = 999_999_999;

  private CorrelationIds() {
    // Utility
  }

  /** Produces candidate ids; the registry retries while a candidate is still pending. */
  @FunctionalInterface
  public interface Generator {
    String next();
  }

  /**
   * Sequential ids starting at {@code 1}.
   *
   * @return generator
   */
  public static Generator sequential() {
    AtomicLong counter = new AtomicLong();
    return () -> Long.toString(counter.incrementAndGet());
  }

  /**
   * Random ids in {@code [10, 999999999]}.
   *
   * @return generator
   */
  public static Generator random() {
    return random(() -> ThreadLocalRandom.current().nextInt(RANDOM_MIN, RANDOM_MAX + 1));
  }

  /**
   * Random ids drawn from the supplied source; values outside the range are clamped into it.
   *
   * @param source integer source, replaceable in tests
   * @return generator
   */
  public static Generator random(IntSupplier source) {
    Objects.requireNonNull(source, "source");
    return () -> {
      int value = source.getAsInt();
      return Integer.toString(Math.max(RANDOM_MIN, Math.min(RANDOM_MAX, value)));
    };
  }
}
