package io.intellixity.polystore.adapter.columnar;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.polystore.adapter.AbstractStoreAdapter;
import io.intellixity.polystore.adapter.ConcurrencyMode;
import io.intellixity.polystore.op.Params;
import io.intellixity.polystore.result.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.*;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * Columnar store adapter over a JDBC database (DuckDB in production, any JDBC database with standard SQL
 * in tests) behind a HikariCP pool.\n
 *
 * Kinds: {@code createTable}, {@code bulkInsert}, {@code query}, {@code tableStats}.
 * Calls are serialized by the gateway; {@code bulkInsert} is all-or-nothing.\n
 */
public final class ColumnarStoreAdapter extends AbstractStoreAdapter {
  private static final Logger log = LoggerFactory.getLogger(ColumnarStoreAdapter.class);

  static final String RAW_SOURCE = "statement";
  static final int BATCH_SIZE = 1000;

  /** Pool settings; {@code maxPoolSize} 1 suits single-writer engines. */
  public record Config(String jdbcUrl, String username, String password, int maxPoolSize, long connectionTimeoutMs,
                       boolean createSampleData) {
    public Config {
      Objects.requireNonNull(jdbcUrl, "jdbcUrl");
      if (maxPoolSize < 1) maxPoolSize = 1;
    }
  }

  private final Config config;
  private final NamedQueryRegistry namedQueries;
  private volatile HikariDataSource ds;

  public ColumnarStoreAdapter(Config config, NamedQueryRegistry namedQueries) {
    super(ColumnarStoreAdapterFactory.SCHEMA, ConcurrencyMode.SERIALIZED);
    this.config = Objects.requireNonNull(config, "config");
    this.namedQueries = Objects.requireNonNull(namedQueries, "namedQueries");
    handle("createTable", this::createTable);
    handle("bulkInsert", this::bulkInsert);
    handle("query", this::query);
    handle("tableStats", this::tableStats);
  }

  @Override
  protected void doConnect() throws SQLException {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(config.jdbcUrl());
    if (config.username() != null) hc.setUsername(config.username());
    if (config.password() != null) hc.setPassword(config.password());
    hc.setMaximumPoolSize(config.maxPoolSize());
    hc.setMinimumIdle(Math.min(1, config.maxPoolSize()));
    hc.setConnectionTimeout(Math.max(250L, config.connectionTimeoutMs()));
    hc.setPoolName("polystore-columnar");
    HikariDataSource pool = new HikariDataSource(hc);
    try {
      if (config.createSampleData()) SalesSampleData.ensure(pool);
    } catch (SQLException | RuntimeException e) {
      pool.close();
      throw e;
    }
    this.ds = pool;
  }

  @Override
  protected void doDisconnect() {
    HikariDataSource pool = ds;
    ds = null;
    if (pool != null) pool.close();
  }

  @Override
  protected void doHealthCheck() throws SQLException {
    try (Connection c = pool().getConnection()) {
      if (!c.isValid(5)) throw new SQLTransientConnectionException("Connection is not valid", "08006");
    }
  }

  private Object createTable(Params p) throws SQLException {
    TableSchema schema = TableSchema.parse(p.map("schema"));
    try (Connection c = pool().getConnection()) {
      if (tableExists(c, schema.table())) {
        if (schema.ifNotExists()) return null;
        throw StoreException.conflict("Table '" + schema.table() + "' already exists");
      }
      String ddl = schema.ddl();
      debugSql("CREATE_TABLE", ddl, 0);
      try (Statement st = c.createStatement()) {
        st.execute(ddl);
      }
    }
    return null;
  }

  private Object bulkInsert(Params p) throws SQLException {
    String table = Identifiers.require("table", p.string("table"));
    List<Object> rows = p.list("rows");
    try (Connection c = pool().getConnection()) {
      if (!tableExists(c, table)) throw StoreException.notFound("Table '" + table + "' does not exist");
      TableColumns cols = TableColumns.read(c, table);
      List<Object[]> values = cols.convert(rows);
      if (values.isEmpty()) return Map.of("inserted", 0);

      String sql = cols.insertSql();
      debugSql("BULK_INSERT", sql, values.size());
      long start = System.nanoTime();
      boolean auto = c.getAutoCommit();
      c.setAutoCommit(false);
      try (PreparedStatement ps = c.prepareStatement(sql)) {
        int pending = 0;
        for (Object[] row : values) {
          cols.bind(ps, row);
          ps.addBatch();
          if (++pending == BATCH_SIZE) {
            ps.executeBatch();
            pending = 0;
          }
        }
        if (pending > 0) ps.executeBatch();
        c.commit();
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(c, e);
        throw e;
      } finally {
        c.setAutoCommit(auto);
      }
      debugDone("BULK_INSERT", values.size(), System.nanoTime() - start);
      return Map.of("inserted", values.size());
    }
  }

  private Object query(Params p) throws SQLException {
    boolean named = p.has("name");
    boolean raw = p.has("statement");
    if (named == raw) throw StoreException.invalidInput("query requires exactly one of 'name' or 'statement'");

    if (named) {
      NamedQuery q = namedQueries.require(p.string("name"));
      Map<String, Object> effective = q.bind(p.map("params"));
      NamedParameterSql.Compiled compiled = NamedParameterSql.compile(q.sql(), effective);
      return run(q.name(), true, compiled.sql(), compiled.values());
    }

    if (p.has("params")) throw StoreException.invalidInput("'params' only applies to named queries");
    String sql = p.string("statement").trim();
    if (sql.isEmpty()) throw StoreException.invalidInput("statement must not be empty");
    if (!NamedParameterSql.isSingleStatement(sql)) throw StoreException.invalidInput("Only a single statement is allowed");
    String body = NamedParameterSql.statementBody(sql);
    if (body.isEmpty()) throw StoreException.invalidInput("statement must not be empty");
    return run(RAW_SOURCE, false, body, List.of());
  }

  private Object tableStats(Params p) throws SQLException {
    String table = Identifiers.require("table", p.string("table"));
    try (Connection c = pool().getConnection()) {
      if (!tableExists(c, table)) throw StoreException.notFound("Table '" + table + "' does not exist");
      List<String> columns = new ArrayList<>();
      for (TableColumns.Col col : TableColumns.read(c, table).columns()) columns.add(col.label());
      long rows;
      try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
        rs.next();
        rows = rs.getLong(1);
      }
      Map<String, Object> out = new LinkedHashMap<>();
      out.put("table", table);
      out.put("rowCount", rows);
      out.put("columns", columns);
      return out;
    }
  }

  private ColumnarResultSet run(String source, boolean trusted, String sql, List<Object> binds) throws SQLException {
    debugSql(trusted ? "NAMED_QUERY" : "RAW_QUERY", sql, binds.size());
    long start = System.nanoTime();
    try (Connection c = pool().getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      for (int i = 0; i < binds.size(); i++) ps.setObject(i + 1, binds.get(i));
      if (!ps.execute()) {
        long n = Math.max(0, ps.getUpdateCount());
        debugDone("UPDATE", n, System.nanoTime() - start);
        return new ColumnarResultSet(source, trusted, List.of(), List.of(), Map.of(), n);
      }
      try (ResultSet rs = ps.getResultSet()) {
        ColumnarResultSet out = toColumnar(source, trusted, rs);
        debugDone(trusted ? "NAMED_QUERY" : "RAW_QUERY", out.rowCount(), System.nanoTime() - start);
        return out;
      }
    }
  }

  private static ColumnarResultSet toColumnar(String source, boolean trusted, ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<String> columns = new ArrayList<>(n);
    List<String> types = new ArrayList<>(n);
    Map<String, List<Object>> vectors = new LinkedHashMap<>();
    Set<String> taken = new HashSet<>();
    for (int i = 1; i <= n; i++) {
      String label = uniqueLabel(md.getColumnLabel(i).toLowerCase(Locale.ROOT), taken);
      columns.add(label);
      types.add(md.getColumnTypeName(i));
      vectors.put(label, new ArrayList<>());
    }
    long rows = 0;
    while (rs.next()) {
      for (int i = 1; i <= n; i++) vectors.get(columns.get(i - 1)).add(jsonValue(rs.getObject(i)));
      rows++;
    }
    return new ColumnarResultSet(source, trusted, List.copyOf(columns), List.copyOf(types), vectors, rows);
  }

  /** Repeated labels (joins selecting {@code a.id, b.id}) become {@code id}, {@code id_2}, ... */
  static String uniqueLabel(String label, Set<String> taken) {
    String candidate = label;
    for (int k = 2; !taken.add(candidate); k++) candidate = label + "_" + k;
    return candidate;
  }

  /** JDBC values become JSON-friendly: temporal values as ISO strings, CLOBs as text. */
  private static Object jsonValue(Object v) throws SQLException {
    if (v == null || v instanceof String || v instanceof Boolean || v instanceof BigDecimal) return v;
    if (v instanceof Number) return v;
    if (v instanceof java.sql.Date d) return d.toLocalDate().toString();
    if (v instanceof Timestamp t) return t.toLocalDateTime().toString();
    if (v instanceof TemporalAccessor) return v.toString();
    if (v instanceof Clob clob) return clob.getSubString(1, (int) Math.min(Integer.MAX_VALUE, clob.length()));
    return v.toString();
  }

  static boolean tableExists(Connection c, String table) throws SQLException {
    DatabaseMetaData md = c.getMetaData();
    for (String candidate : new LinkedHashSet<>(List.of(table, table.toUpperCase(Locale.ROOT), table.toLowerCase(Locale.ROOT)))) {
      try (ResultSet rs = md.getTables(null, null, candidate, new String[]{"TABLE", "BASE TABLE"})) {
        if (rs.next()) return true;
      }
    }
    return false;
  }

  private static void rollbackQuietly(Connection c, Exception cause) {
    try {
      c.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private HikariDataSource pool() {
    HikariDataSource pool = ds;
    if (pool == null) throw StoreException.unavailable("columnar pool is closed", true);
    return pool;
  }

  private void debugSql(String op, String sql, int bindCount) {
    if (!log.isDebugEnabled()) return;
    log.debug("polystore.jdbc op={} bindCount={} pool={} sql={}", op, bindCount, "polystore-columnar", sql);
  }

  private void debugDone(String op, long rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("polystore.jdbc_done op={} durationMs={} rows={}", op, durationNanos / 1_000_000.0, rows);
  }
}
