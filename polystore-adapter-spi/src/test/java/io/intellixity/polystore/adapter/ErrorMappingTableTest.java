package io.intellixity.polystore.adapter;

import io.intellixity.polystore.result.ErrorCategory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

final class ErrorMappingTableTest {
  private static final ErrorMappingTable TABLE = ErrorMappingTable.builder()
      .on(ConnectException.class, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .when("duplicate", IllegalStateException.class, e -> String.valueOf(e.getMessage()).contains("duplicate"),
          ErrorCategory.CONFLICT, false)
      .on(TimeoutException.class, ErrorCategory.TIMEOUT)
      .on(IOException.class, ErrorCategory.BACKEND_UNAVAILABLE, false)
      .build();

  @Test
  void firstMatchingRuleWins() {
    var m = TABLE.classify(new ConnectException("refused")).orElseThrow();
    assertEquals(ErrorCategory.BACKEND_UNAVAILABLE, m.category());
    assertTrue(m.retryable());
    assertEquals("ConnectException", m.rule());
  }

  @Test
  void walksCauseChain_outermostFirst() {
    Throwable t = new RuntimeException("wrapper", new UncheckedIOException(new ConnectException("refused")));
    var m = TABLE.classify(t).orElseThrow();
    // UncheckedIOException itself matches nothing; its IOException cause hits the ConnectException rule
    assertEquals("ConnectException", m.rule());
    assertTrue(m.source() instanceof ConnectException);
  }

  @Test
  void predicateRulesSeeTypedException() {
    assertEquals(ErrorCategory.CONFLICT,
        TABLE.classify(new IllegalStateException("duplicate id")).orElseThrow().category());
    assertTrue(TABLE.classify(new IllegalStateException("other")).isEmpty());
  }

  @Test
  void defaultsRetryabilityFromCategory() {
    assertTrue(TABLE.classify(new TimeoutException()).orElseThrow().retryable());
  }

  @Test
  void unmappedOrNullYieldsEmpty() {
    assertTrue(TABLE.classify(new ArithmeticException()).isEmpty());
    assertTrue(TABLE.classify(null).isEmpty());
    assertTrue(ErrorMappingTable.empty().classify(new IOException()).isEmpty());
  }

  @Test
  void survivesCyclicCauses() {
    RuntimeException a = new RuntimeException("a");
    RuntimeException b = new RuntimeException("b", a);
    a.initCause(b);
    assertTrue(TABLE.classify(a).isEmpty());
  }
}
