package io.intellixity.polystore.adapter.vector;

import io.intellixity.polystore.config.MissingSettingException;

import java.util.Locale;

/** Similarity function of a collection, fixed at creation. */
public enum DistanceMetric {
  COSINE,
  EUCLIDEAN,
  DOT;

  public static DistanceMetric parse(String s) {
    try {
      return valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new MissingSettingException("Unsupported vector metric: " + s);
    }
  }
}
