package io.intellixity.polystore.op;

import java.util.Objects;

/** One declared parameter of an operation kind. */
public record ParamSpec(String name, ParamType type, boolean required) {
  public ParamSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) throw new IllegalArgumentException("param name is blank");
  }

  public static ParamSpec required(String name, ParamType type) {
    return new ParamSpec(name, type, true);
  }

  public static ParamSpec optional(String name, ParamType type) {
    return new ParamSpec(name, type, false);
  }
}
