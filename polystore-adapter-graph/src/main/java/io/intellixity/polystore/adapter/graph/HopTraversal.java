package io.intellixity.polystore.adapter.graph;

import java.util.*;

/**
 * Level-order traversal over a backend's one-hop adjacency.\n
 *
 * {@link #exactlyAt} yields the nodes whose shortest distance from the origin is exactly {@code hops}:
 * the origin and anything reachable in fewer hops are excluded, whatever the backend's own
 * variable-length path semantics would be.\n
 */
final class HopTraversal {
  private HopTraversal() {}

  static List<String> exactlyAt(GraphBackend g, String origin, int hops, String relation) {
    Set<String> visited = new HashSet<>();
    visited.add(origin);
    Set<String> frontier = Set.of(origin);
    for (int level = 1; level <= hops && !frontier.isEmpty(); level++) {
      Map<String, Set<String>> adj = g.adjacency(frontier, relation, Direction.OUTGOING);
      Set<String> next = new HashSet<>();
      for (String n : frontier) {
        for (String m : adj.getOrDefault(n, Set.of())) {
          if (visited.add(m)) next.add(m);
        }
      }
      frontier = next;
    }
    List<String> out = new ArrayList<>(frontier);
    Collections.sort(out);
    return out;
  }

  /** Undirected BFS. Neighbour expansion is sorted so the returned path is deterministic. */
  static Optional<List<String>> shortestPath(GraphBackend g, String from, String to, String relation) {
    if (from.equals(to)) return Optional.of(List.of(from));
    Map<String, String> parent = new HashMap<>();
    parent.put(from, null);
    List<String> frontier = List.of(from);
    while (!frontier.isEmpty()) {
      Map<String, Set<String>> adj = g.adjacency(frontier, relation, Direction.BOTH);
      List<String> next = new ArrayList<>();
      for (String n : frontier) {
        List<String> ms = new ArrayList<>(adj.getOrDefault(n, Set.of()));
        Collections.sort(ms);
        for (String m : ms) {
          if (parent.containsKey(m)) continue;
          parent.put(m, n);
          if (m.equals(to)) return Optional.of(walkBack(parent, to));
          next.add(m);
        }
      }
      frontier = next;
    }
    return Optional.empty();
  }

  private static List<String> walkBack(Map<String, String> parent, String to) {
    LinkedList<String> path = new LinkedList<>();
    for (String cur = to; cur != null; cur = parent.get(cur)) path.addFirst(cur);
    return List.copyOf(path);
  }
}
