package io.intellixity.polystore.adapter.columnar;

import io.intellixity.polystore.result.StoreException;

import java.sql.Types;
import java.util.Locale;

/** Column types accepted by {@code createTable}, and the JDBC type families used for row validation. */
public enum ColumnType {
  VARCHAR,
  INTEGER,
  BIGINT,
  DOUBLE,
  DECIMAL,
  DATE,
  BOOLEAN,
  TIMESTAMP;

  public static ColumnType parse(String s) {
    try {
      return valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw StoreException.invalidInput("Unsupported column type: " + s);
    }
  }

  /** Best-effort family of a JDBC type code; null when the type is not one we validate. */
  public static ColumnType fromJdbc(int sqlType) {
    return switch (sqlType) {
      case Types.VARCHAR, Types.CHAR, Types.LONGVARCHAR, Types.NVARCHAR, Types.NCHAR, Types.LONGNVARCHAR, Types.CLOB ->
          VARCHAR;
      case Types.INTEGER, Types.SMALLINT, Types.TINYINT -> INTEGER;
      case Types.BIGINT -> BIGINT;
      case Types.DOUBLE, Types.FLOAT, Types.REAL -> DOUBLE;
      case Types.DECIMAL, Types.NUMERIC -> DECIMAL;
      case Types.DATE -> DATE;
      case Types.BOOLEAN, Types.BIT -> BOOLEAN;
      case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> TIMESTAMP;
      default -> null;
    };
  }
}
