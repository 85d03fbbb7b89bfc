package ca.gc.cra.lumen.testutil;

import java.util.function.BooleanSupplier;

/** Polling wait for conditions reached on other threads. */
public final class Await {
  private Await() {}

  public static void until(BooleanSupplier condition, String description) {
    long deadline = System.nanoTime() + 5_000_000_000L;
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("Timed out waiting for " + description);
      }
      try {
        Thread.sleep(5);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new AssertionError("Interrupted waiting for " + description, ex);
      }
    }
  }
}
