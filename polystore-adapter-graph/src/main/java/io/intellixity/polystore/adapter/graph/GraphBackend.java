package io.intellixity.polystore.adapter.graph;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Property graph consumed by {@link GraphStoreAdapter}.\n
 *
 * Labels and relation names arrive validated as identifiers. Multi-hop semantics live in the adapter;
 * backends only answer one-hop adjacency questions.\n
 */
public interface GraphBackend {
  void open();

  void close();

  void ping();

  /** @return false if a node with {@code id} already exists (nothing is written) */
  boolean createNode(String id, String label, Map<String, Object> properties);

  boolean nodeExists(String id);

  /** @return false if either endpoint does not exist (nothing is written) */
  boolean createEdge(String fromId, String toId, String relation, Map<String, Object> properties);

  /**
   * One-hop adjacency for every id in {@code ids}; ids without neighbours may be absent from the map.
   *
   * @param relation null for any relation type
   */
  Map<String, Set<String>> adjacency(Collection<String> ids, String relation, Direction direction);

  /** Removes every node and edge. */
  void clear();
}
