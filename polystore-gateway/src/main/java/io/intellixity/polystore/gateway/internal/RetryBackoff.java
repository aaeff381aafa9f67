package io.intellixity.polystore.gateway.internal;

import java.time.Duration;
import java.util.Objects;

/** Exponential backoff: {@code initial * 2^(attempts-1)}, capped at {@code max}. */
public final class RetryBackoff {
  private final long initialMillis;
  private final long maxMillis;

  public RetryBackoff(Duration initial, Duration max) {
    Objects.requireNonNull(initial, "initial");
    Objects.requireNonNull(max, "max");
    this.initialMillis = initial.toMillis();
    this.maxMillis = max.toMillis();
    if (initialMillis <= 0) throw new IllegalArgumentException("initial must be > 0");
    if (maxMillis < initialMillis) throw new IllegalArgumentException("max must be >= initial");
  }

  /** Delay after the given number of consecutive failures (>= 1). */
  public long delayMillis(int attempts) {
    if (attempts < 1) return 0;
    int shift = Math.min(attempts - 1, 62);
    if (initialMillis > (maxMillis >> shift)) return maxMillis;
    return Math.min(maxMillis, initialMillis << shift);
  }
}
