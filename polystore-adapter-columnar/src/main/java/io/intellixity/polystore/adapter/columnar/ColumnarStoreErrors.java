package io.intellixity.polystore.adapter.columnar;

import com.zaxxer.hikari.pool.HikariPool;
import io.intellixity.polystore.adapter.ErrorMappingTable;
import io.intellixity.polystore.result.ErrorCategory;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/**
 * JDBC exception classification. SQLState classes come first; DuckDB often reports a null SQLState,
 * so its message prefixes are matched after them.
 */
final class ColumnarStoreErrors {
  private ColumnarStoreErrors() {}

  static final ErrorMappingTable TABLE = ErrorMappingTable.builder()
      .on(SQLTimeoutException.class, ErrorCategory.TIMEOUT, true)
      .on(SQLTransientConnectionException.class, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .when("sqlstate.08", SQLException.class, e -> stateClass(e, "08"), ErrorCategory.BACKEND_UNAVAILABLE, true)
      .when("sqlstate.23", SQLException.class, e -> stateClass(e, "23"), ErrorCategory.CONFLICT, false)
      .when("sqlstate.42", SQLException.class, e -> stateClass(e, "42"), ErrorCategory.INVALID_INPUT, false)
      .when("sqlstate.22", SQLException.class, e -> stateClass(e, "22"), ErrorCategory.INVALID_INPUT, false)
      .when("duckdb.invalid", SQLException.class,
          e -> messageStarts(e, "Catalog Error", "Parser Error", "Binder Error", "Conversion Error"),
          ErrorCategory.INVALID_INPUT, false)
      .when("duckdb.constraint", SQLException.class, e -> messageStarts(e, "Constraint Error"),
          ErrorCategory.CONFLICT, false)
      .when("duckdb.io", SQLException.class, e -> messageStarts(e, "IO Error"),
          ErrorCategory.BACKEND_UNAVAILABLE, true)
      .on(HikariPool.PoolInitializationException.class, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .build();

  private static boolean stateClass(SQLException e, String cls) {
    String s = e.getSQLState();
    return s != null && s.startsWith(cls);
  }

  private static boolean messageStarts(SQLException e, String... prefixes) {
    String m = e.getMessage();
    if (m == null) return false;
    for (String p : prefixes) {
      if (m.startsWith(p)) return true;
    }
    return false;
  }
}
