package io.intellixity.polystore.op;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * A single paradigm-specific request: {@code {paradigm, kind, parameters}}.\n
 *
 * Immutable once constructed: parameter maps and lists are deep-copied into unmodifiable
 * collections and arrays are cloned. Use {@link #params()} for typed access.\n
 */
@JsonSerialize(using = OperationJsonSerializer.class)
@JsonDeserialize(using = OperationJsonDeserializer.class)
public final class Operation {
  private final Paradigm paradigm;
  private final String kind;
  private final Map<String, Object> parameters;

  public Operation(Paradigm paradigm, String kind, Map<String, ?> parameters) {
    this.paradigm = Objects.requireNonNull(paradigm, "paradigm");
    if (kind == null || kind.isBlank()) throw new OperationValidationException("kind is required");
    this.kind = kind.trim();
    this.parameters = copyMap(parameters == null ? Map.of() : parameters);
  }

  public static Operation of(Paradigm paradigm, String kind) {
    return new Operation(paradigm, kind, Map.of());
  }

  public static Operation of(Paradigm paradigm, String kind, Map<String, ?> parameters) {
    return new Operation(paradigm, kind, parameters);
  }

  public Paradigm paradigm() { return paradigm; }
  public String kind() { return kind; }
  public Map<String, Object> parameters() { return parameters; }

  public Params params() {
    return new Params(this);
  }

  @Override
  public String toString() {
    // parameter values may be large or sensitive
    return "Operation{" + paradigm.id() + "." + kind + ", params=" + parameters.keySet() + "}";
  }

  private static Map<String, Object> copyMap(Map<?, ?> in) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : in.entrySet()) {
      if (!(e.getKey() instanceof String k)) {
        throw new OperationValidationException("Parameter names must be strings");
      }
      out.put(k, copyValue(e.getValue()));
    }
    return Collections.unmodifiableMap(out);
  }

  private static Object copyValue(Object v) {
    if (v == null || v instanceof String || v instanceof Number || v instanceof Boolean) return v;
    if (v instanceof byte[] b) return b.clone();
    if (v instanceof float[] f) return f.clone();
    if (v instanceof double[] d) return d.clone();
    if (v instanceof Map<?, ?> m) return copyMap(m);
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object x : c) out.add(copyValue(x));
      return Collections.unmodifiableList(out);
    }
    throw new OperationValidationException("Unsupported parameter value type: " + v.getClass().getSimpleName());
  }
}
