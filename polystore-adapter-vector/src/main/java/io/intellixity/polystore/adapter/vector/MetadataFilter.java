package io.intellixity.polystore.adapter.vector;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/** Metadata equality filter; numbers compare by value so 3 matches 3L and 3.0. */
final class MetadataFilter {
  private MetadataFilter() {}

  static boolean matches(Map<String, Object> metadata, Map<String, Object> filter) {
    if (filter == null || filter.isEmpty()) return true;
    for (var e : filter.entrySet()) {
      if (!metadata.containsKey(e.getKey())) return false;
      if (!valueEquals(metadata.get(e.getKey()), e.getValue())) return false;
    }
    return true;
  }

  static boolean valueEquals(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y && finite(x) && finite(y)) {
      return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString())) == 0;
    }
    return Objects.equals(a, b);
  }

  private static boolean finite(Number n) {
    return !(n instanceof Double || n instanceof Float) || Double.isFinite(n.doubleValue());
  }
}
