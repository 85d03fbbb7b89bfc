package ca.gc.cra.lumen.application.attach;

import java.time.Duration;
import java.util.Objects;

/**
 * Delays and bounds of the attach workflow. The defaults suit the stock {@code emmy_tool} startup latency.
 *
 * @param settleDelay wait after injection before probing or connecting
 * @param maxConnectAttempts connect rounds, each trying every loopback host
 * @param retryDelay wait between rounds
 * @param retrySlice granularity at which cancellation is observed during waits
 * @param detachGrace wait after closing the connection before the attachment is released
 * @since 0.1.0
 */
public record AttachTiming(
    Duration settleDelay,
    int maxConnectAttempts,
    Duration retryDelay,
    Duration retrySlice,
    Duration detachGrace) {

  public AttachTiming {
    Objects.requireNonNull(settleDelay, "settleDelay");
    Objects.requireNonNull(retryDelay, "retryDelay");
    Objects.requireNonNull(retrySlice, "retrySlice");
    Objects.requireNonNull(detachGrace, "detachGrace");
    if (maxConnectAttempts < 1) {
      throw new IllegalArgumentException("maxConnectAttempts must be >= 1 (was " + maxConnectAttempts + ")");
    }
    if (retrySlice.isZero() || retrySlice.isNegative()) {
      throw new IllegalArgumentException("retrySlice must be positive");
    }
    if (settleDelay.isNegative() || retryDelay.isNegative() || detachGrace.isNegative()) {
      throw new IllegalArgumentException("delays must not be negative");
    }
  }

  /** 100 ms settle, 15 rounds 2 s apart observed in 100 ms slices, 300 ms detach grace. */
  public static AttachTiming defaults() {
    return new AttachTiming(
        Duration.ofMillis(100), 15, Duration.ofMillis(2000), Duration.ofMillis(100), Duration.ofMillis(300));
  }
}
