package io.intellixity.polystore.op;

import java.util.*;

/**
 * Typed read access to an {@link Operation}'s parameters.\n
 *
 * Accessors assume the operation passed schema validation but still fail with
 * {@link OperationValidationException} rather than a ClassCastException when a value has the wrong shape.\n
 */
public final class Params {
  private final Operation op;

  Params(Operation op) {
    this.op = op;
  }

  public boolean has(String name) {
    return op.parameters().get(name) != null;
  }

  public Object raw(String name) {
    return op.parameters().get(name);
  }

  public String string(String name) {
    Object v = require(name);
    if (v instanceof String s) return s;
    throw wrongType(name, "string");
  }

  public String optString(String name) {
    return has(name) ? string(name) : null;
  }

  public byte[] bytes(String name) {
    Object v = require(name);
    if (v instanceof byte[] b) return b.clone();
    if (v instanceof String s) {
      try {
        return Base64.getDecoder().decode(s);
      } catch (IllegalArgumentException e) {
        throw new OperationValidationException("Parameter '" + name + "' is not valid base64", e);
      }
    }
    throw wrongType(name, "bytes");
  }

  public long integer(String name) {
    Object v = require(name);
    if (!ParamType.isIntegral(v)) throw wrongType(name, "integer");
    return ((Number) v).longValue();
  }

  public long integer(String name, long def) {
    return has(name) ? integer(name) : def;
  }

  public double number(String name) {
    Object v = require(name);
    if (v instanceof Number n) return n.doubleValue();
    throw wrongType(name, "number");
  }

  public boolean bool(String name, boolean def) {
    if (!has(name)) return def;
    Object v = raw(name);
    if (v instanceof Boolean b) return b;
    throw wrongType(name, "boolean");
  }

  public boolean isVector(String name) {
    return ParamType.isVector(raw(name));
  }

  public float[] vector(String name) {
    Object v = require(name);
    if (v instanceof float[] f) return f.clone();
    if (v instanceof double[] d) {
      float[] out = new float[d.length];
      for (int i = 0; i < d.length; i++) out[i] = (float) d[i];
      return out;
    }
    if (v instanceof List<?> l && ParamType.isVector(l)) {
      float[] out = new float[l.size()];
      for (int i = 0; i < out.length; i++) out[i] = ((Number) l.get(i)).floatValue();
      return out;
    }
    throw wrongType(name, "vector");
  }

  @SuppressWarnings("unchecked")
  public Map<String, Object> map(String name) {
    if (!has(name)) return Map.of();
    Object v = raw(name);
    if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
    throw wrongType(name, "map");
  }

  public List<Object> list(String name) {
    if (!has(name)) return List.of();
    Object v = raw(name);
    if (v instanceof List<?> l) return Collections.unmodifiableList(l);
    throw wrongType(name, "list");
  }

  private Object require(String name) {
    Object v = op.parameters().get(name);
    if (v == null) {
      throw new OperationValidationException("Missing required parameter '" + name + "' for "
          + op.paradigm().id() + "." + op.kind());
    }
    return v;
  }

  private OperationValidationException wrongType(String name, String expected) {
    return new OperationValidationException("Parameter '" + name + "' must be " + expected);
  }
}
