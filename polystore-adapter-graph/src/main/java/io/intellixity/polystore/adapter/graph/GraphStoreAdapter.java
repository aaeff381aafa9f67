package io.intellixity.polystore.adapter.graph;

import io.intellixity.polystore.adapter.AbstractStoreAdapter;
import io.intellixity.polystore.adapter.ConcurrencyMode;
import io.intellixity.polystore.op.Params;
import io.intellixity.polystore.result.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Graph store adapter over directed, labelled edges.\n
 *
 * Kinds: {@code createNode}, {@code createEdge}, {@code neighbors}, {@code shortestPath}, {@code clear}.
 * {@code neighbors(n, maxHops=k)} returns the sorted set of nodes at shortest outgoing distance exactly k.\n
 */
public final class GraphStoreAdapter extends AbstractStoreAdapter {
  private static final Logger log = LoggerFactory.getLogger(GraphStoreAdapter.class);

  static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final GraphBackend backend;
  private final int maxHopsCeiling;

  public GraphStoreAdapter(GraphBackend backend, int maxHopsCeiling) {
    super(GraphStoreAdapterFactory.SCHEMA, ConcurrencyMode.CONCURRENT);
    this.backend = Objects.requireNonNull(backend, "backend");
    if (maxHopsCeiling < 1) throw new IllegalArgumentException("maxHopsCeiling must be >= 1");
    this.maxHopsCeiling = maxHopsCeiling;
    handle("createNode", this::createNode);
    handle("createEdge", this::createEdge);
    handle("neighbors", this::neighbors);
    handle("shortestPath", this::shortestPath);
    handle("clear", p -> {
      backend.clear();
      return null;
    });
  }

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

  private Object createNode(Params p) {
    String label = identifier("label", p.string("label"));
    Map<String, Object> props = properties(p);
    String id = p.optString("id");
    if (id == null) {
      id = UUID.randomUUID().toString();
    } else if (id.isBlank()) {
      throw StoreException.invalidInput("Node id must not be empty");
    }
    if (!backend.createNode(id, label, props)) {
      throw StoreException.conflict("Node '" + id + "' already exists");
    }
    return Map.of("nodeId", id);
  }

  private Object createEdge(Params p) {
    String from = p.string("fromId");
    String to = p.string("toId");
    String relation = identifier("relation", p.string("relation"));
    Map<String, Object> props = properties(p);
    requireNode(from);
    requireNode(to);
    if (!backend.createEdge(from, to, relation, props)) {
      // an endpoint vanished between the check and the write
      throw StoreException.notFound("Edge endpoint no longer exists");
    }
    return null;
  }

  private Object neighbors(Params p) {
    String nodeId = p.string("nodeId");
    String relation = optionalRelation(p);
    long hops = p.integer("maxHops", 1);
    if (hops < 1 || hops > maxHopsCeiling) {
      throw StoreException.invalidInput("maxHops must be between 1 and " + maxHopsCeiling + ", got " + hops);
    }
    requireNode(nodeId);
    List<String> out = HopTraversal.exactlyAt(backend, nodeId, (int) hops, relation);
    if (log.isDebugEnabled()) log.debug("polystore.graph op=neighbors hops={} results={}", hops, out.size());
    return out;
  }

  private Object shortestPath(Params p) {
    String from = p.string("fromId");
    String to = p.string("toId");
    String relation = optionalRelation(p);
    requireNode(from);
    requireNode(to);
    List<String> path = HopTraversal.shortestPath(backend, from, to, relation)
        .orElseThrow(() -> StoreException.notFound("No path between '" + from + "' and '" + to + "'"));
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("path", path);
    out.put("hops", path.size() - 1);
    return out;
  }

  private void requireNode(String id) {
    if (!backend.nodeExists(id)) throw StoreException.notFound("Node '" + id + "' does not exist");
  }

  private static String optionalRelation(Params p) {
    String r = p.optString("relation");
    return (r == null) ? null : identifier("relation", r);
  }

  static String identifier(String what, String v) {
    if (!IDENTIFIER.matcher(v).matches()) {
      throw StoreException.invalidInput(what + " must match " + IDENTIFIER.pattern());
    }
    return v;
  }

  /** Property values must be non-null scalars or lists of scalars, which every backend can store. */
  private static Map<String, Object> properties(Params p) {
    Map<String, Object> props = p.map("properties");
    for (var e : props.entrySet()) {
      if (!isScalar(e.getValue()) && !(e.getValue() instanceof List<?> l && l.stream().allMatch(GraphStoreAdapter::isScalar))) {
        throw StoreException.invalidInput("Property '" + e.getKey() + "' must be a scalar or a list of scalars");
      }
    }
    return props;
  }

  private static boolean isScalar(Object v) {
    return v instanceof String || v instanceof Number || v instanceof Boolean;
  }
}
