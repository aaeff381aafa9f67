package io.intellixity.polystore.adapter.columnar;

import io.intellixity.polystore.config.AdapterSettings;
import io.intellixity.polystore.config.MissingSettingException;
import io.intellixity.polystore.op.Operation;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnarStoreAdapterTest {
  private ColumnarStoreAdapter columnar;

  @BeforeEach
  void setUp() throws Exception {
    String url = "jdbc:h2:mem:columnar_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
    columnar = (ColumnarStoreAdapter) new ColumnarStoreAdapterFactory().create(AdapterSettings.of(Paradigm.COLUMNAR,
        Map.of("jdbcUrl", url, "createSampleData", "true")));
    columnar.connect();
  }

  @AfterEach
  void tearDown() throws Exception {
    columnar.disconnect();
  }

  private Object run(String kind, Map<String, ?> params) throws Exception {
    return columnar.execute(Operation.of(Paradigm.COLUMNAR, kind, params));
  }

  private ColumnarResultSet named(String name, Map<String, ?> params) throws Exception {
    return (ColumnarResultSet) run("query", Map.of("name", name, "params", params));
  }

  private long rowCount(String table) throws Exception {
    @SuppressWarnings("unchecked")
    Map<String, Object> stats = (Map<String, Object>) run("tableStats", Map.of("table", table));
    return ((Number) stats.get("rowCount")).longValue();
  }

  private static StoreException failure(Executable e) {
    return assertThrows(StoreException.class, e::run);
  }

  @FunctionalInterface
  private interface Executable {
    void run() throws Exception;
  }

  private static void assertDecimal(String expected, Object actual) {
    assertEquals(0, new BigDecimal(expected).compareTo(new BigDecimal(actual.toString())), "was " + actual);
  }

  @Test
  void topProductsIsTrustedAndRanksLaptopFirst() throws Exception {
    ColumnarResultSet rs = named("top-products", Map.of());
    assertTrue(rs.trusted());
    assertEquals("top-products", rs.source());
    assertEquals(List.of("product_name", "total_sold", "revenue"), rs.columns());
    assertEquals(5, rs.rowCount());
    assertEquals("Laptop", rs.vectors().get("product_name").get(0));
    assertDecimal("3600", rs.vectors().get("revenue").get(0));
    assertEquals(3L, ((Number) rs.vectors().get("total_sold").get(0)).longValue());

    assertEquals(2, named("top-products", Map.of("limit", 2)).rowCount());
  }

  @Test
  void revenueByCategory() throws Exception {
    ColumnarResultSet rs = named("total-by-category", Map.of());
    assertEquals(List.of("Electronics", "Furniture"), rs.vectors().get("category"));
    assertDecimal("5375", rs.vectors().get("total_revenue").get(0));
    assertDecimal("1450", rs.vectors().get("total_revenue").get(1));
    assertEquals(5L, ((Number) rs.vectors().get("order_count").get(0)).longValue());
  }

  @Test
  void revenueByRegionHasEveryRegion() throws Exception {
    ColumnarResultSet rs = named("total-by-region", Map.of());
    assertEquals(Set.of("North", "South", "East", "West"), new HashSet<>(rs.vectors().get("region")));
    assertEquals(4, rs.rowCount());
  }

  @Test
  void namedQueryParameterChecks() {
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> named("top-products", Map.of("limit", 0))).category());
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> named("top-products", Map.of("limit", 5000))).category());
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> named("top-products", Map.of("region", "x"))).category());
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> named("no-such-query", Map.of())).category());
  }

  @Test
  void rawStatementIsUntrusted() throws Exception {
    ColumnarResultSet rs = (ColumnarResultSet) run("query", Map.of("statement", "SELECT COUNT(*) AS n FROM sales;"));
    assertFalse(rs.trusted());
    assertEquals("statement", rs.source());
    assertEquals(8L, ((Number) rs.vectors().get("n").get(0)).longValue());
  }

  @Test
  void trailingCommentAfterTerminatorIsDropped() throws Exception {
    ColumnarResultSet rs = (ColumnarResultSet) run("query",
        Map.of("statement", "SELECT COUNT(*) AS n FROM sales; -- every order"));
    assertEquals(8L, ((Number) rs.vectors().get("n").get(0)).longValue());

    rs = (ColumnarResultSet) run("query", Map.of("statement", "SELECT 'a;b' AS s ; /* done */ ;"));
    assertEquals(List.of("a;b"), rs.vectors().get("s"));

    assertEquals(ErrorCategory.INVALID_INPUT,
        failure(() -> run("query", Map.of("statement", "; -- nothing"))).category());
  }

  @Test
  void joinedColumnsWithTheSameLabelStayApart() throws Exception {
    ColumnarResultSet rs = (ColumnarResultSet) run("query", Map.of("statement",
        "SELECT a.order_id, b.order_id, a.region FROM sales a JOIN sales b ON b.order_id = a.order_id + 1 "
            + "WHERE a.order_id <= 2 ORDER BY a.order_id"));
    assertEquals(List.of("order_id", "order_id_2", "region"), rs.columns());
    assertEquals(rs.columns().size(), rs.vectors().size());
    assertEquals(rs.columns().size(), rs.types().size());
    assertEquals(2, rs.rowCount());
    for (List<Object> column : rs.vectors().values()) assertEquals(2, column.size());
    assertEquals(2, ((Number) rs.vectors().get("order_id_2").get(0)).intValue());
  }

  @Test
  void rawQueryFormatsDatesAsIsoStrings() throws Exception {
    ColumnarResultSet rs = (ColumnarResultSet) run("query",
        Map.of("statement", "SELECT order_date FROM sales WHERE order_id = 1"));
    assertEquals("2024-01-15", rs.vectors().get("order_date").get(0));
  }

  @Test
  void multipleStatementsAreRejectedBeforeExecution() throws Exception {
    StoreException e = failure(() -> run("query", Map.of("statement", "SELECT 1; DROP TABLE sales")));
    assertEquals(ErrorCategory.INVALID_INPUT, e.category());
    assertEquals(8, rowCount("sales"));
  }

  @Test
  void queryNeedsExactlyOneOfNameOrStatement() {
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> run("query", Map.of())).category());
    assertEquals(ErrorCategory.INVALID_INPUT,
        failure(() -> run("query", Map.of("name", "top-products", "statement", "SELECT 1"))).category());
    assertEquals(ErrorCategory.INVALID_INPUT,
        failure(() -> run("query", Map.of("statement", "SELECT 1", "params", Map.of("a", 1)))).category());
  }

  @Test
  void rawSqlErrorsSurfaceAsDriverExceptions() {
    SQLException e = assertThrows(SQLException.class, () -> run("query", Map.of("statement", "SELECT * FROM nope")));
    assertEquals(ErrorCategory.INVALID_INPUT, ColumnarStoreErrors.TABLE.classify(e).orElseThrow().category());
  }

  @Test
  void createTableConflictsUnlessIfNotExists() throws Exception {
    Map<String, Object> schema = Map.of("table", "sales",
        "columns", List.of(Map.of("name", "order_id", "type", "INTEGER")));
    assertEquals(ErrorCategory.CONFLICT, failure(() -> run("createTable", Map.of("schema", schema))).category());

    Map<String, Object> lenient = new HashMap<>(schema);
    lenient.put("ifNotExists", true);
    assertNull(run("createTable", Map.of("schema", lenient)));
  }

  @Test
  void createTableRejectsBadIdentifiers() {
    Map<String, Object> schema = Map.of("table", "t; DROP TABLE sales",
        "columns", List.of(Map.of("name", "a", "type", "INTEGER")));
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> run("createTable", Map.of("schema", schema))).category());
    Map<String, Object> badType = Map.of("table", "t",
        "columns", List.of(Map.of("name", "a", "type", "BLOB")));
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> run("createTable", Map.of("schema", badType))).category());
  }

  private void createEvents() throws Exception {
    run("createTable", Map.of("schema", Map.of("table", "events", "columns", List.of(
        Map.of("name", "id", "type", "BIGINT", "nullable", false),
        Map.of("name", "name", "type", "VARCHAR"),
        Map.of("name", "amount", "type", "DECIMAL", "precision", 12, "scale", 2),
        Map.of("name", "day", "type", "DATE")))));
  }

  private static List<Object> events(int n) {
    List<Object> rows = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      rows.add(Map.of("id", i, "name", "e" + i, "amount", i * 1.5, "day", "2024-02-01"));
    }
    return rows;
  }

  @Test
  void bulkInsertIsAllOrNothing() throws Exception {
    createEvents();
    List<Object> rows = events(100);
    rows.add(57, Map.of("id", 999, "amount", "not-a-number"));

    StoreException e = failure(() -> run("bulkInsert", Map.of("table", "events", "rows", rows)));
    assertEquals(ErrorCategory.INVALID_INPUT, e.category());
    assertEquals(57, e.details().get("rowIndex"));
    assertTrue(e.getMessage().startsWith("Row 57 rejected"));
    assertEquals(0, rowCount("events"));

    assertEquals(Map.of("inserted", 100), run("bulkInsert", Map.of("table", "EVENTS", "rows", events(100))));
    assertEquals(100, rowCount("events"));
  }

  @Test
  void bulkInsertRowRules() throws Exception {
    createEvents();
    Map<String, Object> missingId = new HashMap<>();
    missingId.put("name", "x");
    assertEquals(ErrorCategory.INVALID_INPUT,
        failure(() -> run("bulkInsert", Map.of("table", "events", "rows", List.of(missingId)))).category());
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> run("bulkInsert",
        Map.of("table", "events", "rows", List.of(Map.of("id", 1, "color", "red"))))).category());
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> run("bulkInsert",
        Map.of("table", "events", "rows", List.of(Map.of("id", 1.5))))).category());
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> run("bulkInsert",
        Map.of("table", "events", "rows", List.of("not a row")))).category());

    assertEquals(Map.of("inserted", 1), run("bulkInsert",
        Map.of("table", "events", "rows", List.of(Map.of("ID", 7, "Name", "mixed case")))));
    assertEquals(Map.of("inserted", 0), run("bulkInsert", Map.of("table", "events", "rows", List.of())));
  }

  @Test
  void nonFiniteDecimalIsRejectedWithItsRow() throws Exception {
    createEvents();
    List<Object> rows = new ArrayList<>(events(3));
    rows.add(Map.of("id", 3, "amount", Double.NaN));
    StoreException e = failure(() -> run("bulkInsert", Map.of("table", "events", "rows", rows)));
    assertEquals(ErrorCategory.INVALID_INPUT, e.category());
    assertEquals(3, e.details().get("rowIndex"));

    StoreException inf = failure(() -> run("bulkInsert", Map.of("table", "events",
        "rows", List.of(Map.of("id", 1, "amount", Double.POSITIVE_INFINITY)))));
    assertEquals(0, inf.details().get("rowIndex"));
    assertEquals(0, rowCount("events"));
  }

  @Test
  void missingTableIsNotFound() {
    assertEquals(ErrorCategory.NOT_FOUND,
        failure(() -> run("bulkInsert", Map.of("table", "ghost", "rows", List.of()))).category());
    assertEquals(ErrorCategory.NOT_FOUND, failure(() -> run("tableStats", Map.of("table", "ghost"))).category());
  }

  @Test
  void tableStatsListsColumns() throws Exception {
    @SuppressWarnings("unchecked")
    Map<String, Object> stats = (Map<String, Object>) run("tableStats", Map.of("table", "sales"));
    assertEquals(8L, ((Number) stats.get("rowCount")).longValue());
    assertEquals(List.of("order_id", "product_name", "category", "quantity", "price", "order_date", "region"),
        stats.get("columns"));
  }

  @Test
  void sampleDataIsSeededOnce() throws Exception {
    columnar.disconnect();
    columnar.connect();
    assertEquals(8, rowCount("sales"));
  }

  @Test
  void disconnectedAdapterIsUnavailable() throws Exception {
    columnar.disconnect();
    StoreException e = failure(() -> run("tableStats", Map.of("table", "sales")));
    assertEquals(ErrorCategory.BACKEND_UNAVAILABLE, e.category());
    assertTrue(e.retryable());
  }

  @Test
  void jdbcUrlIsRequired() {
    assertThrows(MissingSettingException.class,
        () -> new ColumnarStoreAdapterFactory().create(AdapterSettings.empty(Paradigm.COLUMNAR)));
  }
}
