package io.intellixity.polystore.adapter.vector;

import java.util.Comparator;
import java.util.Map;

/** Score normalization: every score leaving the adapter is a similarity where larger means closer. */
final class VectorScores {
  private VectorScores() {}

  static final Comparator<Map<String, Object>> BY_SCORE_DESC_THEN_ID =
      Comparator.<Map<String, Object>>comparingDouble(m -> (Double) m.get("score")).reversed()
          .thenComparing(m -> (String) m.get("id"));

  static double similarity(double raw, ScoreKind kind, DistanceMetric metric) {
    if (kind == ScoreKind.SIMILARITY) return raw;
    if (metric == DistanceMetric.COSINE) return 1.0 - raw;
    return 1.0 / (1.0 + raw);
  }

  static double cosineDistance(float[] a, float[] b) {
    double dot = 0, na = 0, nb = 0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      na += (double) a[i] * a[i];
      nb += (double) b[i] * b[i];
    }
    if (na == 0 || nb == 0) return 1.0;
    return 1.0 - dot / (Math.sqrt(na) * Math.sqrt(nb));
  }

  static double euclideanDistance(float[] a, float[] b) {
    double s = 0;
    for (int i = 0; i < a.length; i++) {
      double d = (double) a[i] - b[i];
      s += d * d;
    }
    return Math.sqrt(s);
  }

  static double dot(float[] a, float[] b) {
    double s = 0;
    for (int i = 0; i < a.length; i++) s += (double) a[i] * b[i];
    return s;
  }
}
