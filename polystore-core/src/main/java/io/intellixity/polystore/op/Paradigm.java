package io.intellixity.polystore.op;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** The four storage models exposed behind the gateway. */
public enum Paradigm {
  OBJECT("object"),
  VECTOR("vector"),
  GRAPH("graph"),
  COLUMNAR("columnar");

  private final String id;

  Paradigm(String id) {
    this.id = id;
  }

  /** Stable lower-case id used in JSON, settings keys and log lines. */
  @JsonValue
  public String id() { return id; }

  /**
   * Case-insensitive lookup by id or enum name.\n
   *
   * @throws OperationValidationException if the name is blank or unknown
   */
  @JsonCreator
  public static Paradigm parse(String name) {
    if (name == null || name.isBlank()) throw new OperationValidationException("paradigm is required");
    String n = name.trim().toLowerCase(Locale.ROOT);
    for (Paradigm p : values()) {
      if (p.id.equals(n)) return p;
    }
    throw new OperationValidationException("Unknown paradigm: " + name.trim());
  }
}
