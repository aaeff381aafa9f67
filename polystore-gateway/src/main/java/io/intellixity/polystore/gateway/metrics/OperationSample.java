package io.intellixity.polystore.gateway.metrics;

import io.intellixity.polystore.op.Paradigm;

import java.time.Instant;

public record OperationSample(Paradigm paradigm, String kind, long latencyMs, boolean ok, Instant at) {}
