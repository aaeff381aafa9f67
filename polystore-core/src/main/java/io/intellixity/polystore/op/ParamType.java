package io.intellixity.polystore.op;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/** Declared shape of an operation parameter. */
public enum ParamType {
  STRING,
  /** {@code byte[]} or a base64 string (JSON transport). */
  BYTES,
  INTEGER,
  NUMBER,
  BOOLEAN,
  /** {@code float[]}, {@code double[]} or a non-empty list of numbers. */
  VECTOR,
  MAP,
  LIST,
  /** Either a {@link #VECTOR} or a non-blank string to be embedded. */
  VECTOR_OR_TEXT;

  public boolean accepts(Object v) {
    if (v == null) return false;
    return switch (this) {
      case STRING -> v instanceof String;
      case BYTES -> v instanceof byte[] || (v instanceof String s && isBase64(s));
      case INTEGER -> isIntegral(v);
      case NUMBER -> v instanceof Number;
      case BOOLEAN -> v instanceof Boolean;
      case VECTOR -> isVector(v);
      case MAP -> v instanceof Map<?, ?>;
      case LIST -> v instanceof List<?>;
      case VECTOR_OR_TEXT -> isVector(v) || (v instanceof String s && !s.isBlank());
    };
  }

  static boolean isIntegral(Object v) {
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte
        || v instanceof BigInteger) {
      return true;
    }
    if (v instanceof BigDecimal bd) {
      return bd.stripTrailingZeros().scale() <= 0;
    }
    if (v instanceof Double || v instanceof Float) {
      double d = ((Number) v).doubleValue();
      return !Double.isInfinite(d) && d == Math.rint(d);
    }
    return false;
  }

  static boolean isVector(Object v) {
    if (v instanceof float[] f) return f.length > 0;
    if (v instanceof double[] d) return d.length > 0;
    if (v instanceof List<?> l) {
      if (l.isEmpty()) return false;
      for (Object x : l) if (!(x instanceof Number)) return false;
      return true;
    }
    return false;
  }

  private static boolean isBase64(String s) {
    try {
      Base64.getDecoder().decode(s);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }
}
