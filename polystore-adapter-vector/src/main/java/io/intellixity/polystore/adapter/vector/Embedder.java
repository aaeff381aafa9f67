package io.intellixity.polystore.adapter.vector;

/** Turns document or query text into a fixed-dimension embedding. */
public interface Embedder {
  int dimension();

  float[] embed(String text);
}
