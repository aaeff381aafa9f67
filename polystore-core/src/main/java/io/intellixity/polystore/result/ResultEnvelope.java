package io.intellixity.polystore.result;

import io.intellixity.polystore.op.Paradigm;

import java.util.Map;
import java.util.Objects;

/**
 * Uniform response shape for every paradigm.\n
 *
 * Invariant: {@code ok} implies {@code data != null && error == null}; {@code !ok} implies
 * {@code data == null && error != null}. Paradigm-specific richness lives in {@code data}.\n
 */
public record ResultEnvelope(boolean ok,
                             Paradigm paradigm,
                             String kind,
                             Object data,
                             ErrorInfo error,
                             long latencyMs) {
  /** Data returned by operations that only acknowledge. */
  public static final Map<String, Object> ACK = Map.of("acknowledged", true);

  public ResultEnvelope {
    if (ok) {
      if (data == null) throw new IllegalArgumentException("successful envelope requires data");
      if (error != null) throw new IllegalArgumentException("successful envelope cannot carry an error");
    } else {
      Objects.requireNonNull(error, "error");
      if (data != null) throw new IllegalArgumentException("failed envelope cannot carry data");
    }
    if (latencyMs < 0) latencyMs = 0;
  }

  public static ResultEnvelope success(Paradigm paradigm, String kind, Object data, long latencyMs) {
    return new ResultEnvelope(true, paradigm, kind, (data == null) ? ACK : data, null, latencyMs);
  }

  public static ResultEnvelope failure(Paradigm paradigm, String kind, ErrorInfo error, long latencyMs) {
    return new ResultEnvelope(false, paradigm, kind, null, error, latencyMs);
  }

  /** Convenience for callers and tests: the category of a failed envelope, or null. */
  public ErrorCategory category() {
    return (error == null) ? null : error.category();
  }
}
