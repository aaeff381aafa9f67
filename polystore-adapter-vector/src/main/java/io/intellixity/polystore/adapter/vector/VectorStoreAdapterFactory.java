package io.intellixity.polystore.adapter.vector;

import io.intellixity.polystore.adapter.AdapterFactory;
import io.intellixity.polystore.adapter.ErrorMappingTable;
import io.intellixity.polystore.adapter.StoreAdapter;
import io.intellixity.polystore.config.AdapterSettings;
import io.intellixity.polystore.config.MissingSettingException;
import io.intellixity.polystore.op.OperationSchema;
import io.intellixity.polystore.op.ParamType;
import io.intellixity.polystore.op.Paradigm;

import static io.intellixity.polystore.op.ParamSpec.optional;
import static io.intellixity.polystore.op.ParamSpec.required;

/**
 * Settings: {@code dimension} (required), {@code backend=memory|mongo} (default memory),
 * {@code collection} (default documents), {@code metric=cosine|euclidean|dot} (default cosine),
 * {@code maxTopK} (default 100); for mongo {@code uri}, {@code database} (required),
 * {@code searchIndex} (default vector_index), {@code numCandidatesFactor} (default 10).
 */
public final class VectorStoreAdapterFactory implements AdapterFactory {
  public static final int DEFAULT_MAX_TOP_K = 100;

  static final OperationSchema SCHEMA = OperationSchema.builder(Paradigm.VECTOR)
      .kind("index", required("id", ParamType.STRING), optional("embedding", ParamType.VECTOR),
          optional("metadata", ParamType.MAP), optional("text", ParamType.STRING))
      .kind("query", required("embeddingOrText", ParamType.VECTOR_OR_TEXT), required("topK", ParamType.INTEGER),
          optional("filter", ParamType.MAP))
      .kind("count")
      .build();

  @Override
  public Paradigm paradigm() { return Paradigm.VECTOR; }

  @Override
  public OperationSchema operations() { return SCHEMA; }

  @Override
  public ErrorMappingTable errorMappings() { return VectorStoreErrors.TABLE; }

  @Override
  public StoreAdapter create(AdapterSettings settings) {
    int dimension = settings.requireInt("dimension");
    if (dimension <= 0) throw new MissingSettingException("Vector dimension must be positive: " + dimension);
    DistanceMetric metric = DistanceMetric.parse(settings.get("metric", "cosine"));
    int maxTopK = settings.getInt("maxTopK", DEFAULT_MAX_TOP_K);
    if (maxTopK <= 0) throw new MissingSettingException("maxTopK must be positive: " + maxTopK);
    String collection = settings.get("collection", "documents");

    String backend = settings.get("backend", "memory");
    VectorIndexBackend b = switch (backend) {
      case "memory" -> new InMemoryVectorIndexBackend(metric);
      case "mongo" -> new MongoVectorIndexBackend(new MongoVectorIndexBackend.Config(
          settings.require("uri"),
          settings.require("database"),
          collection,
          settings.get("searchIndex", "vector_index"),
          settings.getInt("numCandidatesFactor", 10)));
      default -> throw new MissingSettingException("Unsupported vector backend: " + backend);
    };
    return new VectorStoreAdapter(b, new HashingEmbedder(dimension), dimension, metric, maxTopK);
  }
}
