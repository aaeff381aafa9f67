package io.intellixity.polystore.gateway.metrics;

import io.intellixity.polystore.op.Paradigm;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryOperationMetricsTest {
  @Test
  void summarizesPerParadigmAndKind() {
    InMemoryOperationMetrics m = new InMemoryOperationMetrics();
    m.record(Paradigm.VECTOR, "query", 10, true);
    m.record(Paradigm.VECTOR, "query", 30, false);
    m.record(Paradigm.OBJECT, "put", 5, true);

    List<OperationSummary> s = m.summary();
    assertEquals(2, s.size());
    assertEquals(new OperationSummary(Paradigm.OBJECT, "put", 1, 0, 5.0, 5, 5), s.get(0));
    assertEquals(new OperationSummary(Paradigm.VECTOR, "query", 2, 1, 20.0, 10, 30), s.get(1));
    assertEquals(2, m.samples(Paradigm.VECTOR).size());
    assertEquals(3, m.samples(null).size());
  }

  @Test
  void keepsOnlyTheMostRecentSamples() {
    InMemoryOperationMetrics m = new InMemoryOperationMetrics(3);
    for (int i = 1; i <= 5; i++) m.record(Paradigm.GRAPH, "neighbors", i, true);
    List<OperationSample> samples = m.samples(null);
    assertEquals(3, samples.size());
    assertEquals(3, samples.get(0).latencyMs());
    assertEquals(5, samples.get(2).latencyMs());

    m.clear();
    assertTrue(m.summary().isEmpty());
  }
}
