package io.intellixity.polystore.adapter.graph;

/** Which edges count as adjacency. */
public enum Direction {
  OUTGOING,
  /** Either direction; used for undirected path search. */
  BOTH
}
