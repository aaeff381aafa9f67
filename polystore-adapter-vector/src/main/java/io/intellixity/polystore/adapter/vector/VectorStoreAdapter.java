package io.intellixity.polystore.adapter.vector;

import io.intellixity.polystore.adapter.AbstractStoreAdapter;
import io.intellixity.polystore.adapter.ConcurrencyMode;
import io.intellixity.polystore.op.Params;
import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Vector store adapter over one fixed-dimension collection.\n
 *
 * Kinds: {@code index}, {@code query}, {@code count}. Every returned {@code score} is a similarity
 * (larger is closer) regardless of what the backend reports.\n
 */
public final class VectorStoreAdapter extends AbstractStoreAdapter {
  private static final Logger log = LoggerFactory.getLogger(VectorStoreAdapter.class);

  private final VectorIndexBackend backend;
  private final Embedder embedder;
  private final int dimension;
  private final DistanceMetric metric;
  private final int maxTopK;

  public VectorStoreAdapter(VectorIndexBackend backend, Embedder embedder, int dimension, DistanceMetric metric,
                            int maxTopK) {
    super(VectorStoreAdapterFactory.SCHEMA, ConcurrencyMode.CONCURRENT);
    this.backend = Objects.requireNonNull(backend, "backend");
    this.embedder = Objects.requireNonNull(embedder, "embedder");
    this.metric = Objects.requireNonNull(metric, "metric");
    if (dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
    if (embedder.dimension() != dimension) {
      throw new IllegalArgumentException("Embedder dimension " + embedder.dimension() + " != collection dimension " + dimension);
    }
    if (maxTopK <= 0) throw new IllegalArgumentException("maxTopK must be positive");
    this.dimension = dimension;
    this.maxTopK = maxTopK;
    handle("index", this::index);
    handle("query", this::query);
    handle("count", p -> Map.of("count", backend.count()));
  }

  public int dimension() { return dimension; }

  @Override
  protected void doConnect() {
    backend.open();
  }

  @Override
  protected void doDisconnect() {
    backend.close();
  }

  @Override
  protected void doHealthCheck() {
    backend.ping();
  }

  private Object index(Params p) {
    String id = p.string("id");
    if (id.isBlank()) throw StoreException.invalidInput("Document id must not be empty");
    String text = p.optString("text");

    float[] embedding;
    if (p.has("embedding")) {
      embedding = checked(p.vector("embedding"));
    } else if (text != null && !text.isBlank()) {
      embedding = embedder.embed(text);
    } else {
      throw StoreException.invalidInput("index requires 'embedding' or non-empty 'text'");
    }

    backend.upsert(new VectorRecord(id, embedding, p.map("metadata"), text));
    if (log.isDebugEnabled()) log.debug("polystore.vector op=index dimension={} embedded={}", dimension, !p.has("embedding"));

    Map<String, Object> out = new LinkedHashMap<>();
    out.put("id", id);
    out.put("dimension", dimension);
    return out;
  }

  private Object query(Params p) {
    long topK = p.integer("topK");
    if (topK < 1 || topK > maxTopK) {
      throw StoreException.invalidInput("topK must be between 1 and " + maxTopK + ", got " + topK);
    }
    float[] q = p.isVector("embeddingOrText")
        ? checked(p.vector("embeddingOrText"))
        : embedder.embed(p.string("embeddingOrText"));

    List<VectorHit> hits = backend.search(q, (int) topK, p.map("filter"));

    List<Map<String, Object>> out = new ArrayList<>(hits.size());
    for (VectorHit h : hits) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put("id", h.id());
      m.put("score", VectorScores.similarity(h.rawScore(), h.kind(), metric));
      m.put("metadata", h.metadata() == null ? Map.of() : h.metadata());
      if (h.text() != null) m.put("text", h.text());
      out.add(m);
    }
    out.sort(VectorScores.BY_SCORE_DESC_THEN_ID);
    return out.size() > topK ? new ArrayList<>(out.subList(0, (int) topK)) : out;
  }

  private float[] checked(float[] v) {
    if (v.length != dimension) {
      throw new StoreException(ErrorCategory.INVALID_INPUT,
          "Embedding dimension " + v.length + " does not match collection dimension " + dimension, false,
          Map.of("expected", dimension, "actual", v.length));
    }
    for (float x : v) {
      if (!Float.isFinite(x)) throw StoreException.invalidInput("Embedding contains a non-finite value");
    }
    return v;
  }
}
