package io.intellixity.polystore.gateway.metrics;

import io.intellixity.polystore.op.Paradigm;

import java.util.*;

/** Keeps the most recent {@code capacity} samples; older ones are dropped. */
public final class InMemoryOperationMetrics implements OperationMetrics {
  public static final int DEFAULT_CAPACITY = 10_000;

  private final int capacity;
  private final ArrayDeque<OperationSample> ring;

  public InMemoryOperationMetrics() {
    this(DEFAULT_CAPACITY);
  }

  public InMemoryOperationMetrics(int capacity) {
    if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
    this.capacity = capacity;
    this.ring = new ArrayDeque<>(Math.min(capacity, 1024));
  }

  @Override
  public synchronized void record(OperationSample sample) {
    Objects.requireNonNull(sample, "sample");
    if (ring.size() == capacity) ring.pollFirst();
    ring.addLast(sample);
  }

  @Override
  public synchronized List<OperationSample> samples(Paradigm paradigm) {
    List<OperationSample> out = new ArrayList<>(ring.size());
    for (OperationSample s : ring) {
      if (paradigm == null || s.paradigm() == paradigm) out.add(s);
    }
    return out;
  }

  @Override
  public synchronized List<OperationSummary> summary() {
    Map<Key, Acc> byKey = new TreeMap<>(Comparator.comparing(Key::paradigm).thenComparing(Key::kind));
    for (OperationSample s : ring) {
      byKey.computeIfAbsent(new Key(s.paradigm(), s.kind()), k -> new Acc()).add(s);
    }
    List<OperationSummary> out = new ArrayList<>(byKey.size());
    for (var e : byKey.entrySet()) {
      Acc a = e.getValue();
      out.add(new OperationSummary(e.getKey().paradigm(), e.getKey().kind(), a.count, a.failures,
          (double) a.totalMs / a.count, a.minMs, a.maxMs));
    }
    return out;
  }

  @Override
  public synchronized void clear() {
    ring.clear();
  }

  private record Key(Paradigm paradigm, String kind) {}

  private static final class Acc {
    long count;
    long failures;
    long totalMs;
    long minMs = Long.MAX_VALUE;
    long maxMs = Long.MIN_VALUE;

    void add(OperationSample s) {
      count++;
      if (!s.ok()) failures++;
      totalMs += s.latencyMs();
      minMs = Math.min(minMs, s.latencyMs());
      maxMs = Math.max(maxMs, s.latencyMs());
    }
  }
}
