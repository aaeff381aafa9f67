package io.intellixity.polystore.adapter.vector;

/** How a backend reports closeness. */
public enum ScoreKind {
  /** Lower is closer. */
  DISTANCE,
  /** Higher is closer. */
  SIMILARITY
}
