package io.intellixity.polystore.gateway;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection lifecycle tuning.
 *
 * @param connectTimeout     bound for one connect or health check call
 * @param initialBackoff     delay after the first failed attempt; doubles per further failure
 * @param maxBackoff         backoff cap
 * @param maxConnectAttempts failures after which a paradigm stays degraded until {@code reconnect}
 * @param shutdownGrace      how long shutdown waits for in-flight calls before interrupting them
 */
public record SupervisorSettings(Duration connectTimeout,
                                 Duration initialBackoff,
                                 Duration maxBackoff,
                                 int maxConnectAttempts,
                                 Duration shutdownGrace) {
  public SupervisorSettings {
    positive(connectTimeout, "connectTimeout");
    positive(initialBackoff, "initialBackoff");
    positive(maxBackoff, "maxBackoff");
    Objects.requireNonNull(shutdownGrace, "shutdownGrace");
    if (shutdownGrace.isNegative()) throw new IllegalArgumentException("shutdownGrace must be >= 0");
    if (maxBackoff.compareTo(initialBackoff) < 0) throw new IllegalArgumentException("maxBackoff < initialBackoff");
    if (maxConnectAttempts < 1) throw new IllegalArgumentException("maxConnectAttempts must be >= 1");
  }

  public static SupervisorSettings defaults() {
    return new SupervisorSettings(Duration.ofSeconds(5), Duration.ofMillis(500), Duration.ofSeconds(30), 5,
        Duration.ofSeconds(5));
  }

  private static void positive(Duration d, String name) {
    Objects.requireNonNull(d, name);
    if (d.isNegative() || d.isZero()) throw new IllegalArgumentException(name + " must be > 0");
  }
}
