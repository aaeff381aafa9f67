package io.intellixity.polystore.adapter.vector;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Deterministic bag-of-words embedder using signed feature hashing.\n
 *
 * Tokens are lower-cased alphanumeric runs; each token adds +/-1 to one bucket and the result is
 * L2-normalized, so texts sharing words score a high cosine similarity.\n
 */
public final class HashingEmbedder implements Embedder {
  private final int dimension;

  public HashingEmbedder(int dimension) {
    if (dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
    this.dimension = dimension;
  }

  @Override
  public int dimension() { return dimension; }

  @Override
  public float[] embed(String text) {
    float[] v = new float[dimension];
    for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
      if (token.isEmpty()) continue;
      int h = fnv1a(token);
      int bucket = Math.floorMod(h, dimension);
      v[bucket] += ((h >>> 31) == 0) ? 1f : -1f;
    }
    double norm = 0;
    for (float x : v) norm += x * x;
    if (norm > 0) {
      float inv = (float) (1.0 / Math.sqrt(norm));
      for (int i = 0; i < v.length; i++) v[i] *= inv;
    }
    return v;
  }

  private static int fnv1a(String s) {
    int h = 0x811c9dc5;
    for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
      h ^= (b & 0xff);
      h *= 0x01000193;
    }
    return h;
  }
}
