package io.intellixity.polystore.examples.service;

import io.intellixity.polystore.gateway.GatewayRouter;
import io.intellixity.polystore.op.Operation;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.result.ResultEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Walks an e-commerce flow across all four paradigms: product images in the object store, product
 * descriptions in the vector index, customers and friendships in the graph, and sales analytics in the
 * columnar store.\n
 *
 * Every step goes through {@link GatewayRouter}; the report keeps each envelope as returned.
 */
@Service
public final class EcommerceScenarioService {
  private static final Logger log = LoggerFactory.getLogger(EcommerceScenarioService.class);

  public record Step(String name, ResultEnvelope result) {}

  public record ScenarioReport(String runId, List<Step> steps, boolean ok) {}

  private record Product(String id, String name, String category, double price, String description) {}

  private static final List<Product> PRODUCTS = List.of(
      new Product("prod_001", "Wireless Headphones", "Electronics", 99.99,
          "Premium wireless headphones with noise cancellation"),
      new Product("prod_002", "Smart Watch", "Electronics", 249.99,
          "Fitness tracking smartwatch with heart rate monitor"),
      new Product("prod_003", "Bluetooth Speaker", "Electronics", 79.99,
          "Portable bluetooth speaker with rich bass"));

  private final GatewayRouter router;

  public EcommerceScenarioService(GatewayRouter router) {
    this.router = Objects.requireNonNull(router, "router");
  }

  public ScenarioReport run() {
    String runId = UUID.randomUUID().toString().substring(0, 8);
    List<Step> steps = new ArrayList<>();

    for (Product p : PRODUCTS) {
      byte[] image = ("image:" + p.id()).getBytes(StandardCharsets.UTF_8);
      steps.add(step("object.put " + p.id(), Operation.of(Paradigm.OBJECT, "put", Map.of(
          "key", "products/" + p.id() + ".jpg", "data", image, "contentType", "image/jpeg"))));
    }
    steps.add(step("object.list", Operation.of(Paradigm.OBJECT, "list", Map.of("prefix", "products/"))));

    for (Product p : PRODUCTS) {
      steps.add(step("vector.index " + p.id(), Operation.of(Paradigm.VECTOR, "index", Map.of(
          "id", p.id(),
          "text", p.name() + " " + p.description(),
          "metadata", Map.of("name", p.name(), "category", p.category(), "price", p.price())))));
    }
    steps.add(step("vector.query similar", Operation.of(Paradigm.VECTOR, "query", Map.of(
        "embeddingOrText", "wireless audio device", "topK", 2))));

    List<String> customers = List.of("alice", "bob", "carol");
    for (String c : customers) {
      steps.add(step("graph.createNode " + c, Operation.of(Paradigm.GRAPH, "createNode", Map.of(
          "label", "Customer", "id", customerId(runId, c), "properties", Map.of("name", c)))));
    }
    steps.add(step("graph.createEdge alice-bob", friends(runId, "alice", "bob")));
    steps.add(step("graph.createEdge bob-carol", friends(runId, "bob", "carol")));
    steps.add(step("graph.neighbors friends", Operation.of(Paradigm.GRAPH, "neighbors", Map.of(
        "nodeId", customerId(runId, "alice"), "relation", "FRIEND", "maxHops", 1))));
    steps.add(step("graph.neighbors friends-of-friends", Operation.of(Paradigm.GRAPH, "neighbors", Map.of(
        "nodeId", customerId(runId, "alice"), "relation", "FRIEND", "maxHops", 2))));

    steps.add(step("columnar.createTable sales", Operation.of(Paradigm.COLUMNAR, "createTable", Map.of(
        "schema", salesSchema()))));
    steps.add(step("columnar.bulkInsert sales", Operation.of(Paradigm.COLUMNAR, "bulkInsert", Map.of(
        "table", "sales", "rows", salesRows()))));
    for (String q : List.of("total-by-category", "total-by-region", "top-products")) {
      steps.add(step("columnar.query " + q, Operation.of(Paradigm.COLUMNAR, "query", Map.of("name", q))));
    }

    boolean ok = steps.stream().allMatch(s -> s.result().ok());
    log.info("polystore.scenario name=ecommerce runId={} steps={} ok={}", runId, steps.size(), ok);
    return new ScenarioReport(runId, List.copyOf(steps), ok);
  }

  private Step step(String name, Operation op) {
    ResultEnvelope r = router.route(op);
    if (!r.ok() && log.isDebugEnabled()) {
      log.debug("polystore.scenario step={} category={}", name, r.category());
    }
    return new Step(name, r);
  }

  private static String customerId(String runId, String name) {
    return "cust_" + runId + "_" + name;
  }

  private static Operation friends(String runId, String a, String b) {
    return Operation.of(Paradigm.GRAPH, "createEdge", Map.of(
        "fromId", customerId(runId, a), "toId", customerId(runId, b), "relation", "FRIEND"));
  }

  private static Map<String, Object> salesSchema() {
    return Map.of(
        "table", "sales",
        "ifNotExists", true,
        "columns", List.of(
            column("order_id", "INTEGER"),
            column("product_name", "VARCHAR"),
            column("category", "VARCHAR"),
            column("quantity", "INTEGER"),
            Map.of("name", "price", "type", "DECIMAL", "precision", 10, "scale", 2),
            column("order_date", "DATE"),
            column("region", "VARCHAR")));
  }

  private static Map<String, Object> column(String name, String type) {
    return Map.of("name", name, "type", type);
  }

  private static List<Object> salesRows() {
    List<Object> rows = new ArrayList<>();
    int orderId = 1000;
    for (Product p : PRODUCTS) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("order_id", orderId++);
      row.put("product_name", p.name());
      row.put("category", p.category());
      row.put("quantity", 1);
      row.put("price", p.price());
      row.put("order_date", "2024-02-01");
      row.put("region", "North");
      rows.add(row);
    }
    return rows;
  }
}
