package io.intellixity.polystore.adapter.vector;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exact (brute-force) nearest-neighbour index.\n
 *
 * Reports cosine and euclidean matches as distances and dot-product matches as similarities, so the
 * adapter's normalization is exercised for both kinds.\n
 */
public final class InMemoryVectorIndexBackend implements VectorIndexBackend {
  private final DistanceMetric metric;
  private final Map<String, VectorRecord> records = new ConcurrentHashMap<>();

  public InMemoryVectorIndexBackend(DistanceMetric metric) {
    this.metric = Objects.requireNonNull(metric, "metric");
  }

  @Override public void open() {}

  @Override public void close() {}

  @Override public void ping() {}

  @Override
  public void upsert(VectorRecord record) {
    records.put(record.id(), new VectorRecord(record.id(), record.embedding().clone(),
        Collections.unmodifiableMap(new LinkedHashMap<>(record.metadata())), record.text()));
  }

  @Override
  public List<VectorHit> search(float[] query, int topK, Map<String, Object> filter) {
    List<VectorHit> hits = new ArrayList<>();
    for (VectorRecord r : records.values()) {
      if (!MetadataFilter.matches(r.metadata(), filter)) continue;
      hits.add(switch (metric) {
        case COSINE -> new VectorHit(r.id(), VectorScores.cosineDistance(query, r.embedding()), ScoreKind.DISTANCE,
            r.metadata(), r.text());
        case EUCLIDEAN -> new VectorHit(r.id(), VectorScores.euclideanDistance(query, r.embedding()),
            ScoreKind.DISTANCE, r.metadata(), r.text());
        case DOT -> new VectorHit(r.id(), VectorScores.dot(query, r.embedding()), ScoreKind.SIMILARITY,
            r.metadata(), r.text());
      });
    }
    Comparator<VectorHit> closest = (metric == DistanceMetric.DOT)
        ? Comparator.comparingDouble(VectorHit::rawScore).reversed()
        : Comparator.comparingDouble(VectorHit::rawScore);
    hits.sort(closest.thenComparing(VectorHit::id));
    return hits.size() > topK ? new ArrayList<>(hits.subList(0, topK)) : hits;
  }

  @Override
  public long count() {
    return records.size();
  }
}
