package io.intellixity.polystore.adapter.columnar;

import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.StoreException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.*;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Columns of an existing table as seen through JDBC metadata, and conversion of JSON row values into
 * JDBC bind values for them.\n
 *
 * Row keys match column labels case-insensitively. A row is rejected (nothing is written) when it names
 * an unknown column, omits or nulls a NOT NULL column, or carries a value that does not fit the column type.\n
 */
final class TableColumns {
  record Col(String label, int sqlType, ColumnType family, boolean nullable) {}

  private final String table;
  private final List<Col> cols;
  private final Map<String, Integer> index;

  private TableColumns(String table, List<Col> cols) {
    this.table = table;
    this.cols = cols;
    Map<String, Integer> idx = new HashMap<>();
    for (int i = 0; i < cols.size(); i++) idx.put(cols.get(i).label(), i);
    this.index = idx;
  }

  static TableColumns read(Connection c, String table) throws SQLException {
    try (Statement st = c.createStatement();
         ResultSet rs = st.executeQuery("SELECT * FROM " + table + " WHERE 1=0")) {
      ResultSetMetaData md = rs.getMetaData();
      List<Col> cols = new ArrayList<>(md.getColumnCount());
      for (int i = 1; i <= md.getColumnCount(); i++) {
        int t = md.getColumnType(i);
        cols.add(new Col(md.getColumnLabel(i).toLowerCase(Locale.ROOT), t, ColumnType.fromJdbc(t),
            md.isNullable(i) != ResultSetMetaData.columnNoNulls));
      }
      return new TableColumns(table, List.copyOf(cols));
    }
  }

  List<Col> columns() { return cols; }

  String insertSql() {
    StringJoiner names = new StringJoiner(", ", "INSERT INTO " + table + " (", ")");
    StringJoiner marks = new StringJoiner(", ", " VALUES (", ")");
    for (Col c : cols) {
      names.add(c.label());
      marks.add("?");
    }
    return names + marks.toString();
  }

  /** Converts every row up front so that a malformed row rejects the batch before any write. */
  List<Object[]> convert(List<Object> rows) {
    List<Object[]> out = new ArrayList<>(rows.size());
    for (int r = 0; r < rows.size(); r++) {
      if (!(rows.get(r) instanceof Map<?, ?> row)) throw rejected(r, "row is not an object");
      Object[] values = new Object[cols.size()];
      for (var e : row.entrySet()) {
        String key = String.valueOf(e.getKey()).toLowerCase(Locale.ROOT);
        Integer i = index.get(key);
        if (i == null) throw rejected(r, "unknown column '" + e.getKey() + "'");
        values[i] = e.getValue();
      }
      for (int i = 0; i < cols.size(); i++) {
        Col c = cols.get(i);
        if (values[i] == null) {
          if (!c.nullable()) throw rejected(r, "column '" + c.label() + "' is NOT NULL");
          continue;
        }
        values[i] = coerce(r, c, values[i]);
      }
      out.add(values);
    }
    return out;
  }

  void bind(PreparedStatement ps, Object[] values) throws SQLException {
    for (int i = 0; i < values.length; i++) {
      if (values[i] == null) ps.setNull(i + 1, cols.get(i).sqlType());
      else ps.setObject(i + 1, values[i]);
    }
  }

  private static Object coerce(int row, Col c, Object v) {
    if (c.family() == null) return v;
    switch (c.family()) {
      case VARCHAR -> {
        if (v instanceof String) return v;
      }
      case INTEGER -> {
        if (integral(v) && fitsInt(v)) return ((Number) v).intValue();
      }
      case BIGINT -> {
        if (integral(v) && fitsLong(v)) return ((Number) v).longValue();
      }
      case DOUBLE -> {
        if (v instanceof Number n) return n.doubleValue();
      }
      case DECIMAL -> {
        if (v instanceof Number n) {
          try {
            return new BigDecimal(n.toString());
          } catch (NumberFormatException e) {
            throw rejected(row, "column '" + c.label() + "' expects a finite decimal");
          }
        }
        if (v instanceof String s) {
          try {
            return new BigDecimal(s.trim());
          } catch (NumberFormatException e) {
            throw rejected(row, "column '" + c.label() + "' expects a decimal");
          }
        }
      }
      case BOOLEAN -> {
        if (v instanceof Boolean) return v;
      }
      case DATE -> {
        if (v instanceof String s) {
          try {
            return java.sql.Date.valueOf(LocalDate.parse(s.trim()));
          } catch (DateTimeParseException e) {
            throw rejected(row, "column '" + c.label() + "' expects an ISO date");
          }
        }
      }
      case TIMESTAMP -> {
        if (v instanceof String s) return timestamp(row, c, s.trim());
      }
    }
    throw rejected(row, "column '" + c.label() + "' expects " + c.family() + " but got "
        + v.getClass().getSimpleName());
  }

  private static Timestamp timestamp(int row, Col c, String s) {
    try {
      return Timestamp.valueOf(LocalDateTime.parse(s));
    } catch (DateTimeParseException e) {
      try {
        return Timestamp.from(OffsetDateTime.parse(s).toInstant());
      } catch (DateTimeParseException e2) {
        throw rejected(row, "column '" + c.label() + "' expects an ISO timestamp");
      }
    }
  }

  private static boolean integral(Object v) {
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte || v instanceof BigInteger) {
      return true;
    }
    if (v instanceof Double || v instanceof Float || v instanceof BigDecimal) {
      double d = ((Number) v).doubleValue();
      return Double.isFinite(d) && d == Math.rint(d);
    }
    return false;
  }

  private static boolean fitsInt(Object v) {
    double d = ((Number) v).doubleValue();
    return d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE;
  }

  private static boolean fitsLong(Object v) {
    if (v instanceof BigInteger b) return b.bitLength() < 64;
    double d = ((Number) v).doubleValue();
    return d >= Long.MIN_VALUE && d <= Long.MAX_VALUE;
  }

  private static StoreException rejected(int rowIndex, String why) {
    return new StoreException(ErrorCategory.INVALID_INPUT, "Row " + rowIndex + " rejected: " + why, false,
        Map.of("rowIndex", rowIndex));
  }
}
