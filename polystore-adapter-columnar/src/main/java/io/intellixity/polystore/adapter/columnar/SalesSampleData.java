package io.intellixity.polystore.adapter.columnar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.*;
import java.time.LocalDate;

/** The {@code sales} table the named analytics run against, with its eight demo orders. */
final class SalesSampleData {
  private static final Logger log = LoggerFactory.getLogger(SalesSampleData.class);

  private SalesSampleData() {}

  static final String DDL = """
      CREATE TABLE IF NOT EXISTS sales (
        order_id INTEGER,
        product_name VARCHAR,
        category VARCHAR,
        quantity INTEGER,
        price DECIMAL(10,2),
        order_date DATE,
        region VARCHAR
      )""";

  private static final Object[][] ROWS = {
      {1, "Laptop", "Electronics", 2, "1200.00", "2024-01-15", "North"},
      {2, "Mouse", "Electronics", 5, "25.00", "2024-01-16", "South"},
      {3, "Desk", "Furniture", 1, "450.00", "2024-01-17", "East"},
      {4, "Chair", "Furniture", 4, "150.00", "2024-01-18", "West"},
      {5, "Monitor", "Electronics", 3, "300.00", "2024-01-19", "North"},
      {6, "Keyboard", "Electronics", 10, "75.00", "2024-01-20", "South"},
      {7, "Bookshelf", "Furniture", 2, "200.00", "2024-01-21", "East"},
      {8, "Laptop", "Electronics", 1, "1200.00", "2024-01-22", "West"},
  };

  /** Creates the table when missing and seeds it when empty; an already populated table is left alone. */
  static void ensure(DataSource ds) throws SQLException {
    try (Connection c = ds.getConnection()) {
      try (Statement st = c.createStatement()) {
        st.execute(DDL);
        try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM sales")) {
          rs.next();
          if (rs.getLong(1) > 0) return;
        }
      }
      boolean auto = c.getAutoCommit();
      c.setAutoCommit(false);
      try (PreparedStatement ps = c.prepareStatement(
          "INSERT INTO sales (order_id, product_name, category, quantity, price, order_date, region) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
        for (Object[] r : ROWS) {
          ps.setInt(1, (Integer) r[0]);
          ps.setString(2, (String) r[1]);
          ps.setString(3, (String) r[2]);
          ps.setInt(4, (Integer) r[3]);
          ps.setBigDecimal(5, new BigDecimal((String) r[4]));
          ps.setDate(6, Date.valueOf(LocalDate.parse((String) r[5])));
          ps.setString(7, (String) r[6]);
          ps.addBatch();
        }
        ps.executeBatch();
        c.commit();
      } catch (SQLException e) {
        try {
          c.rollback();
        } catch (SQLException re) {
          e.addSuppressed(re);
        }
        throw e;
      } finally {
        c.setAutoCommit(auto);
      }
      if (log.isDebugEnabled()) log.debug("polystore.columnar op=seed table=sales rows={}", ROWS.length);
    }
  }
}
