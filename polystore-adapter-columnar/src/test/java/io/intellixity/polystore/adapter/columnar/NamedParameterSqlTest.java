package io.intellixity.polystore.adapter.columnar;

import io.intellixity.polystore.op.OperationValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class NamedParameterSqlTest {
  @Test
  void replacesNamedParamsInOrder() {
    NamedParameterSql.Compiled c = NamedParameterSql.compile(
        "SELECT * FROM t WHERE a = :a AND b > :b OR a = :a", Map.of("a", 1, "b", "x"));
    assertEquals("SELECT * FROM t WHERE a = ? AND b > ? OR a = ?", c.sql());
    assertEquals(List.of(1, "x", 1), c.values());
  }

  @Test
  void leavesCastsAndQuotedTextAlone() {
    NamedParameterSql.Compiled c = NamedParameterSql.compile(
        "SELECT ':skip', 'it''s :x', v::INTEGER FROM t LIMIT :limit", Map.of("limit", 5));
    assertEquals("SELECT ':skip', 'it''s :x', v::INTEGER FROM t LIMIT ?", c.sql());
    assertEquals(List.of(5), c.values());
  }

  @Test
  void missingParamFails() {
    assertThrows(OperationValidationException.class, () -> NamedParameterSql.compile("SELECT :x", Map.of()));
  }

  @Test
  void singleStatementDetection() {
    assertTrue(NamedParameterSql.isSingleStatement("SELECT 1"));
    assertTrue(NamedParameterSql.isSingleStatement("SELECT 1;  ;\n -- trailing comment"));
    assertTrue(NamedParameterSql.isSingleStatement("SELECT 'a;b', \"c;d\" FROM t /* ; */"));
    assertFalse(NamedParameterSql.isSingleStatement("SELECT 1; SELECT 2"));
    assertFalse(NamedParameterSql.isSingleStatement("SELECT 1;/* x */DROP TABLE t"));
  }

  @Test
  void statementBodyDropsTerminatorsAndTrailingComments() {
    assertEquals("SELECT 1", NamedParameterSql.statementBody("SELECT 1;"));
    assertEquals("SELECT 1", NamedParameterSql.statementBody("SELECT 1 ; -- note"));
    assertEquals("SELECT 1", NamedParameterSql.statementBody("SELECT 1; /* a */ ;\n"));
    assertEquals("SELECT '-- kept;'", NamedParameterSql.statementBody("SELECT '-- kept;' -- dropped"));
    assertEquals("SELECT a -- inline\nFROM t", NamedParameterSql.statementBody("SELECT a -- inline\nFROM t;"));
    assertEquals("", NamedParameterSql.statementBody(" ; -- only a comment"));
  }
}
