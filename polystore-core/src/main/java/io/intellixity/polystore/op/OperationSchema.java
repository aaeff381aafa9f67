package io.intellixity.polystore.op;

import java.util.*;

/**
 * Registered operation kinds of one paradigm and the parameters each kind declares.\n
 *
 * Validation is strict: unknown kinds, unknown parameter names, missing required parameters and
 * values of the wrong shape all fail with {@link OperationValidationException}. A {@code null} value
 * for an optional parameter is treated as absent.\n
 */
public final class OperationSchema {
  private final Paradigm paradigm;
  private final Map<String, Map<String, ParamSpec>> kinds;

  private OperationSchema(Paradigm paradigm, Map<String, Map<String, ParamSpec>> kinds) {
    this.paradigm = paradigm;
    this.kinds = kinds;
  }

  public static Builder builder(Paradigm paradigm) {
    return new Builder(paradigm);
  }

  public Paradigm paradigm() { return paradigm; }

  public Set<String> kinds() { return kinds.keySet(); }

  public boolean supports(String kind) {
    return kind != null && kinds.containsKey(kind);
  }

  public Collection<ParamSpec> params(String kind) {
    Map<String, ParamSpec> p = kinds.get(kind);
    if (p == null) throw new OperationValidationException("Unknown " + paradigm.id() + " operation kind: " + kind);
    return p.values();
  }

  public void validate(Operation op) {
    Objects.requireNonNull(op, "op");
    if (op.paradigm() != paradigm) {
      throw new OperationValidationException("Operation paradigm " + op.paradigm().id()
          + " does not match schema " + paradigm.id());
    }
    Map<String, ParamSpec> specs = kinds.get(op.kind());
    if (specs == null) {
      throw new OperationValidationException("Unknown " + paradigm.id() + " operation kind: " + op.kind());
    }

    for (String name : op.parameters().keySet()) {
      if (!specs.containsKey(name)) {
        throw new OperationValidationException("Unknown parameter '" + name + "' for " + paradigm.id() + "." + op.kind());
      }
    }
    for (ParamSpec spec : specs.values()) {
      Object v = op.parameters().get(spec.name());
      if (v == null) {
        if (spec.required()) {
          throw new OperationValidationException("Missing required parameter '" + spec.name() + "' for "
              + paradigm.id() + "." + op.kind());
        }
        continue;
      }
      if (!spec.type().accepts(v)) {
        throw new OperationValidationException("Parameter '" + spec.name() + "' of " + paradigm.id() + "." + op.kind()
            + " must be " + spec.type());
      }
    }
  }

  public static final class Builder {
    private final Paradigm paradigm;
    private final Map<String, Map<String, ParamSpec>> kinds = new LinkedHashMap<>();

    private Builder(Paradigm paradigm) {
      this.paradigm = Objects.requireNonNull(paradigm, "paradigm");
    }

    public Builder kind(String kind, ParamSpec... params) {
      Objects.requireNonNull(kind, "kind");
      if (kinds.containsKey(kind)) throw new IllegalArgumentException("Duplicate kind: " + kind);
      Map<String, ParamSpec> m = new LinkedHashMap<>();
      for (ParamSpec p : params) {
        if (m.putIfAbsent(p.name(), p) != null) {
          throw new IllegalArgumentException("Duplicate param " + p.name() + " in kind " + kind);
        }
      }
      kinds.put(kind, Collections.unmodifiableMap(m));
      return this;
    }

    public OperationSchema build() {
      return new OperationSchema(paradigm, Collections.unmodifiableMap(new LinkedHashMap<>(kinds)));
    }
  }
}
