package io.intellixity.polystore.adapter.graph;

import java.util.*;

/** Embedded graph: adjacency lists guarded by the instance monitor. */
public final class InMemoryGraphBackend implements GraphBackend {
  private record Node(String label, Map<String, Object> properties) {}

  private record Edge(String from, String to, String relation, Map<String, Object> properties) {}

  private final Map<String, Node> nodes = new HashMap<>();
  private final Map<String, List<Edge>> out = new HashMap<>();
  private final Map<String, List<Edge>> in = new HashMap<>();

  @Override public void open() {}

  @Override public void close() {}

  @Override public void ping() {}

  @Override
  public synchronized boolean createNode(String id, String label, Map<String, Object> properties) {
    if (nodes.containsKey(id)) return false;
    nodes.put(id, new Node(label, Map.copyOf(properties)));
    return true;
  }

  @Override
  public synchronized boolean nodeExists(String id) {
    return nodes.containsKey(id);
  }

  @Override
  public synchronized boolean createEdge(String fromId, String toId, String relation, Map<String, Object> properties) {
    if (!nodes.containsKey(fromId) || !nodes.containsKey(toId)) return false;
    Edge e = new Edge(fromId, toId, relation, Map.copyOf(properties));
    out.computeIfAbsent(fromId, k -> new ArrayList<>()).add(e);
    in.computeIfAbsent(toId, k -> new ArrayList<>()).add(e);
    return true;
  }

  @Override
  public synchronized Map<String, Set<String>> adjacency(Collection<String> ids, String relation, Direction direction) {
    Map<String, Set<String>> result = new HashMap<>();
    for (String id : ids) {
      Set<String> ns = new HashSet<>();
      for (Edge e : out.getOrDefault(id, List.of())) {
        if (relation == null || relation.equals(e.relation())) ns.add(e.to());
      }
      if (direction == Direction.BOTH) {
        for (Edge e : in.getOrDefault(id, List.of())) {
          if (relation == null || relation.equals(e.relation())) ns.add(e.from());
        }
      }
      if (!ns.isEmpty()) result.put(id, ns);
    }
    return result;
  }

  @Override
  public synchronized void clear() {
    nodes.clear();
    out.clear();
    in.clear();
  }
}
