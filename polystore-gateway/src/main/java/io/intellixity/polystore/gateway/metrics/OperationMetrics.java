package io.intellixity.polystore.gateway.metrics;

import io.intellixity.polystore.op.Paradigm;

import java.time.Instant;
import java.util.List;

/** Sink for per-operation latency samples recorded by the router. */
public interface OperationMetrics {
  void record(OperationSample sample);

  default void record(Paradigm paradigm, String kind, long latencyMs, boolean ok) {
    record(new OperationSample(paradigm, kind, latencyMs, ok, Instant.now()));
  }

  /** Retained samples, oldest first; {@code paradigm} null means all. */
  List<OperationSample> samples(Paradigm paradigm);

  List<OperationSummary> summary();

  void clear();
}
