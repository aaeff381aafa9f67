package io.intellixity.polystore.adapter.graph;

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
 * Settings: {@code backend=memory|neo4j} (default memory), {@code maxHopsCeiling} (default 6);
 * for neo4j {@code uri} (required), {@code username}, {@code password}, {@code database}.
 */
public final class GraphStoreAdapterFactory implements AdapterFactory {
  public static final int DEFAULT_MAX_HOPS = 6;

  static final OperationSchema SCHEMA = OperationSchema.builder(Paradigm.GRAPH)
      .kind("createNode", required("label", ParamType.STRING), optional("properties", ParamType.MAP),
          optional("id", ParamType.STRING))
      .kind("createEdge", required("fromId", ParamType.STRING), required("toId", ParamType.STRING),
          required("relation", ParamType.STRING), optional("properties", ParamType.MAP))
      .kind("neighbors", required("nodeId", ParamType.STRING), optional("relation", ParamType.STRING),
          optional("maxHops", ParamType.INTEGER))
      .kind("shortestPath", required("fromId", ParamType.STRING), required("toId", ParamType.STRING),
          optional("relation", ParamType.STRING))
      .kind("clear")
      .build();

  @Override
  public Paradigm paradigm() { return Paradigm.GRAPH; }

  @Override
  public OperationSchema operations() { return SCHEMA; }

  @Override
  public ErrorMappingTable errorMappings() { return GraphStoreErrors.TABLE; }

  @Override
  public StoreAdapter create(AdapterSettings settings) {
    int ceiling = settings.getInt("maxHopsCeiling", DEFAULT_MAX_HOPS);
    if (ceiling < 1) throw new MissingSettingException("maxHopsCeiling must be >= 1: " + ceiling);
    String backend = settings.get("backend", "memory");
    GraphBackend b = switch (backend) {
      case "memory" -> new InMemoryGraphBackend();
      case "neo4j" -> new Neo4jGraphBackend(new Neo4jGraphBackend.Config(
          settings.require("uri"),
          settings.get("username").orElse(null),
          settings.get("password", ""),
          settings.get("database").orElse(null)));
      default -> throw new MissingSettingException("Unsupported graph backend: " + backend);
    };
    return new GraphStoreAdapter(b, ceiling);
  }
}
