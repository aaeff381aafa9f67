package io.intellixity.polystore.adapter.columnar;

import io.intellixity.polystore.result.StoreException;

import java.util.*;

/**
 * Parsed {@code createTable} schema: {@code {table, columns: [{name, type, nullable?, precision?, scale?}], ifNotExists?}}.
 */
public record TableSchema(String table, List<Column> columns, boolean ifNotExists) {
  public record Column(String name, ColumnType type, boolean nullable, int precision, int scale) {
    String ddl() {
      String t = (type == ColumnType.DECIMAL) ? "DECIMAL(" + precision + "," + scale + ")" : type.name();
      return name + " " + t + (nullable ? "" : " NOT NULL");
    }
  }

  static final int DEFAULT_PRECISION = 18;
  static final int DEFAULT_SCALE = 2;

  public static TableSchema parse(Map<String, Object> m) {
    String table = Identifiers.require("table", asString(m.get("table"), "schema.table"));
    Object raw = m.get("columns");
    if (!(raw instanceof List<?> cols) || cols.isEmpty()) {
      throw StoreException.invalidInput("schema.columns must be a non-empty list");
    }
    List<Column> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (Object c : cols) {
      if (!(c instanceof Map<?, ?> cm)) throw StoreException.invalidInput("schema.columns entries must be objects");
      String name = Identifiers.require("column", asString(cm.get("name"), "column.name"));
      if (!seen.add(name.toLowerCase(Locale.ROOT))) throw StoreException.invalidInput("Duplicate column: " + name);
      ColumnType type = ColumnType.parse(asString(cm.get("type"), "column.type"));
      boolean nullable = !(cm.get("nullable") instanceof Boolean b) || b;
      int precision = asInt(cm.get("precision"), DEFAULT_PRECISION);
      int scale = asInt(cm.get("scale"), DEFAULT_SCALE);
      if (precision < 1 || scale < 0 || scale > precision) {
        throw StoreException.invalidInput("Invalid precision/scale for column " + name);
      }
      out.add(new Column(name, type, nullable, precision, scale));
    }
    return new TableSchema(table, List.copyOf(out), Boolean.TRUE.equals(m.get("ifNotExists")));
  }

  String ddl() {
    StringJoiner j = new StringJoiner(", ", "CREATE TABLE " + table + " (", ")");
    for (Column c : columns) j.add(c.ddl());
    return j.toString();
  }

  private static String asString(Object v, String what) {
    if (v instanceof String s) return s;
    throw StoreException.invalidInput(what + " must be a string");
  }

  private static int asInt(Object v, int def) {
    if (v == null) return def;
    if (v instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) return n.intValue();
    throw StoreException.invalidInput("precision/scale must be integers");
  }
}
