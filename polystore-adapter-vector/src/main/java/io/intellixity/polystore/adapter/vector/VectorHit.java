package io.intellixity.polystore.adapter.vector;

import java.util.Map;

/** A raw backend match, before score normalization. */
public record VectorHit(String id, double rawScore, ScoreKind kind, Map<String, Object> metadata, String text) {}
