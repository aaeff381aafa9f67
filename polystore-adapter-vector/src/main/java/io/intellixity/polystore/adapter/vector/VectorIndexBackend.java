package io.intellixity.polystore.adapter.vector;

import java.util.List;
import java.util.Map;

/**
 * Nearest-neighbour index consumed by {@link VectorStoreAdapter}.\n
 *
 * Embeddings arrive already checked against the collection dimension. {@code search} returns at most
 * {@code topK} hits that satisfy every {@code filter} entry by metadata equality, in any order.\n
 */
public interface VectorIndexBackend {
  void open();

  void close();

  void ping();

  /** Inserts or overwrites the record with the same id. */
  void upsert(VectorRecord record);

  List<VectorHit> search(float[] query, int topK, Map<String, Object> filter);

  long count();
}
