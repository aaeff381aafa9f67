package io.intellixity.polystore.adapter.columnar;

import io.intellixity.polystore.op.OperationValidationException;
import io.intellixity.polystore.op.ParamSpec;
import io.intellixity.polystore.op.ParamType;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** Named analytical queries by name. The default registry holds the sales analytics. */
public final class NamedQueryRegistry {
  private final Map<String, NamedQuery> queries = new ConcurrentHashMap<>();

  public static NamedQueryRegistry salesAnalytics() {
    NamedQueryRegistry r = new NamedQueryRegistry();
    r.register(NamedQuery.of("total-by-category", """
        SELECT category,
               SUM(quantity * price) AS total_revenue,
               COUNT(*) AS order_count,
               AVG(price) AS avg_price
        FROM sales
        GROUP BY category
        ORDER BY total_revenue DESC, category
        """));
    r.register(NamedQuery.of("total-by-region", """
        SELECT region,
               SUM(quantity * price) AS total_revenue,
               SUM(quantity) AS total_quantity
        FROM sales
        GROUP BY region
        ORDER BY total_revenue DESC, region
        """));
    r.register(new NamedQuery("top-products", """
        SELECT product_name,
               SUM(quantity) AS total_sold,
               SUM(quantity * price) AS revenue
        FROM sales
        GROUP BY product_name
        ORDER BY revenue DESC, product_name
        LIMIT :limit
        """,
        List.of(ParamSpec.optional("limit", ParamType.INTEGER)),
        Map.of("limit", 5),
        p -> {
          long limit = ((Number) p.get("limit")).longValue();
          if (limit < 1 || limit > 1000) throw new OperationValidationException("limit must be between 1 and 1000");
          p.put("limit", (int) limit);
        }));
    return r;
  }

  public NamedQueryRegistry register(NamedQuery q) {
    Objects.requireNonNull(q, "q");
    if (queries.putIfAbsent(q.name(), q) != null) throw new IllegalArgumentException("Duplicate named query: " + q.name());
    return this;
  }

  public NamedQuery require(String name) {
    NamedQuery q = queries.get(name);
    if (q == null) throw new OperationValidationException("Unknown named query: " + name);
    return q;
  }

  public Set<String> names() {
    return new TreeSet<>(queries.keySet());
  }
}
