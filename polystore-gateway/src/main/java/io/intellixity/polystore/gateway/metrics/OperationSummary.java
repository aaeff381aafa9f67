package io.intellixity.polystore.gateway.metrics;

import io.intellixity.polystore.op.Paradigm;

/** Aggregate over the retained samples of one (paradigm, kind). */
public record OperationSummary(Paradigm paradigm,
                               String kind,
                               long count,
                               long failures,
                               double avgMs,
                               long minMs,
                               long maxMs) {}
