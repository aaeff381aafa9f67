package io.intellixity.polystore.gateway.internal;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class RetryBackoffTest {
  @Test
  void doublesUpToTheCap() {
    RetryBackoff b = new RetryBackoff(Duration.ofMillis(500), Duration.ofSeconds(3));
    assertEquals(0, b.delayMillis(0));
    assertEquals(500, b.delayMillis(1));
    assertEquals(1_000, b.delayMillis(2));
    assertEquals(2_000, b.delayMillis(3));
    assertEquals(3_000, b.delayMillis(4));
    assertEquals(3_000, b.delayMillis(Integer.MAX_VALUE));
  }

  @Test
  void rejectsBadBounds() {
    assertThrows(IllegalArgumentException.class, () -> new RetryBackoff(Duration.ZERO, Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class, () -> new RetryBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1)));
  }
}
