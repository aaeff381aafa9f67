package io.intellixity.polystore.adapter.columnar;

import io.intellixity.polystore.op.OperationValidationException;
import io.intellixity.polystore.op.ParamSpec;

import java.util.*;
import java.util.function.Consumer;

/**
 * A pre-registered analytical query. Named queries are trusted: their SQL is fixed at registration and
 * callers can only supply declared parameters, which are bound, never interpolated.
 *
 * @param constraints extra checks on the effective parameters (after defaults); throw to reject
 */
public record NamedQuery(String name, String sql, List<ParamSpec> params, Map<String, Object> defaults,
                         Consumer<Map<String, Object>> constraints) {
  public NamedQuery {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(sql, "sql");
    params = (params == null) ? List.of() : List.copyOf(params);
    defaults = (defaults == null) ? Map.of() : Map.copyOf(defaults);
    constraints = (constraints == null) ? p -> {} : constraints;
  }

  public static NamedQuery of(String name, String sql) {
    return new NamedQuery(name, sql, List.of(), Map.of(), null);
  }

  /** Validates caller parameters against the declared shape and returns them merged over the defaults. */
  Map<String, Object> bind(Map<String, Object> supplied) {
    Map<String, ParamSpec> byName = new LinkedHashMap<>();
    for (ParamSpec p : params) byName.put(p.name(), p);
    for (String k : supplied.keySet()) {
      if (!byName.containsKey(k)) throw new OperationValidationException("Unknown parameter '" + k + "' for query " + name);
    }
    Map<String, Object> effective = new LinkedHashMap<>(defaults);
    for (var e : supplied.entrySet()) {
      if (e.getValue() != null) effective.put(e.getKey(), e.getValue());
    }
    for (ParamSpec p : params) {
      Object v = effective.get(p.name());
      if (v == null) {
        if (p.required()) throw new OperationValidationException("Missing parameter '" + p.name() + "' for query " + name);
        continue;
      }
      if (!p.type().accepts(v)) {
        throw new OperationValidationException("Parameter '" + p.name() + "' of query " + name + " must be " + p.type());
      }
    }
    constraints.accept(effective);
    return effective;
  }
}
