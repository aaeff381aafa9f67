package io.intellixity.polystore.adapter.vector;

import java.util.Map;
import java.util.Objects;

/** One indexed document. {@code text} may be null. */
public record VectorRecord(String id, float[] embedding, Map<String, Object> metadata, String text) {
  public VectorRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(embedding, "embedding");
    metadata = (metadata == null) ? Map.of() : metadata;
  }
}
