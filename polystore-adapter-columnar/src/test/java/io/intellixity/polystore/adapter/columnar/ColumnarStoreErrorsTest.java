package io.intellixity.polystore.adapter.columnar;

import io.intellixity.polystore.adapter.ErrorMappingTable;
import io.intellixity.polystore.result.ErrorCategory;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnarStoreErrorsTest {
  private static ErrorMappingTable.Match classify(Throwable t) {
    return ColumnarStoreErrors.TABLE.classify(t).orElseThrow();
  }

  @Test
  void sqlStateClasses() {
    assertEquals(ErrorCategory.BACKEND_UNAVAILABLE, classify(new SQLException("refused", "08001")).category());
    assertTrue(classify(new SQLException("refused", "08001")).retryable());
    assertEquals(ErrorCategory.CONFLICT, classify(new SQLException("dup", "23505")).category());
    assertEquals(ErrorCategory.INVALID_INPUT, classify(new SQLException("no table", "42S02")).category());
    assertEquals(ErrorCategory.INVALID_INPUT, classify(new SQLException("overflow", "22003")).category());
  }

  @Test
  void driverExceptionTypes() {
    assertEquals(ErrorCategory.TIMEOUT, classify(new SQLTimeoutException("slow")).category());
    ErrorMappingTable.Match m = classify(new SQLTransientConnectionException("pool exhausted"));
    assertEquals(ErrorCategory.BACKEND_UNAVAILABLE, m.category());
    assertTrue(m.retryable());
  }

  @Test
  void duckDbMessagesWithoutSqlState() {
    assertEquals(ErrorCategory.INVALID_INPUT,
        classify(new SQLException("Catalog Error: Table with name nope does not exist!")).category());
    assertEquals(ErrorCategory.INVALID_INPUT, classify(new SQLException("Parser Error: syntax error")).category());
    assertEquals(ErrorCategory.CONFLICT,
        classify(new SQLException("Constraint Error: Duplicate key \"id: 1\"")).category());
    assertEquals(ErrorCategory.BACKEND_UNAVAILABLE,
        classify(new SQLException("IO Error: Could not set lock on file")).category());
  }

  @Test
  void wrappedCauseIsClassified() {
    assertEquals(ErrorCategory.CONFLICT,
        classify(new RuntimeException("wrapper", new SQLException("dup", "23000"))).category());
  }

  @Test
  void unknownFailuresAreLeftUnclassified() {
    assertTrue(ColumnarStoreErrors.TABLE.classify(new SQLException("something else")).isEmpty());
    assertTrue(ColumnarStoreErrors.TABLE.classify(new IllegalStateException("bug")).isEmpty());
  }
}
