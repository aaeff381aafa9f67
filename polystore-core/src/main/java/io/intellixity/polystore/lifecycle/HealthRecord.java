package io.intellixity.polystore.lifecycle;

import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.result.ErrorInfo;

import java.time.Instant;
import java.util.Objects;

/**
 * Last known health of one paradigm.
 *
 * @param lastCheckedAt null until the first connect attempt or health check
 * @param lastError     null while healthy
 */
public record HealthRecord(Paradigm paradigm, AdapterState state, Instant lastCheckedAt, ErrorInfo lastError) {
  public HealthRecord {
    Objects.requireNonNull(paradigm, "paradigm");
    Objects.requireNonNull(state, "state");
  }

  public boolean healthy() {
    return state == AdapterState.READY;
  }
}
