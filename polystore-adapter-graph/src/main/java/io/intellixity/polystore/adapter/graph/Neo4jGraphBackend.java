package io.intellixity.polystore.adapter.graph;

import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Neo4j backend using the official Java driver; one session per call.\n
 *
 * Every node carries the {@code PolyNode} label plus its own label, and its id in the {@code id} property.
 * Labels and relation types are interpolated into Cypher only after identifier validation by the adapter;
 * all values travel as parameters.\n
 */
public final class Neo4jGraphBackend implements GraphBackend {
  private static final Logger log = LoggerFactory.getLogger(Neo4jGraphBackend.class);

  static final String NODE_LABEL = "PolyNode";

  /** Makes the id check in {@link #createNode} race-free; a violation maps to Conflict. */
  static final String UNIQUE_ID_CONSTRAINT =
      "CREATE CONSTRAINT poly_node_id_unique IF NOT EXISTS FOR (n:" + NODE_LABEL + ") REQUIRE n.id IS UNIQUE";

  public record Config(String uri, String username, String password, String database) {
    public Config {
      Objects.requireNonNull(uri, "uri");
    }
  }

  private final Config config;
  private volatile Driver driver;

  public Neo4jGraphBackend(Config config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  @Override
  public void open() {
    Driver d = (config.username() == null)
        ? GraphDatabase.driver(config.uri(), AuthTokens.none())
        : GraphDatabase.driver(config.uri(), AuthTokens.basic(config.username(), config.password()));
    try {
      d.verifyConnectivity();
      try (Session s = session(d)) {
        // a plain index on the same property blocks the constraint
        s.run("DROP INDEX poly_node_id IF EXISTS").consume();
        s.run(UNIQUE_ID_CONSTRAINT).consume();
      }
    } catch (RuntimeException e) {
      d.close();
      throw e;
    }
    this.driver = d;
  }

  @Override
  public void close() {
    Driver d = driver;
    driver = null;
    if (d != null) d.close();
  }

  @Override
  public void ping() {
    live().verifyConnectivity();
  }

  @Override
  public boolean createNode(String id, String label, Map<String, Object> properties) {
    try (Session s = session(live())) {
      return s.executeWrite(tx -> {
        long existing = tx.run("MATCH (n:" + NODE_LABEL + " {id: $id}) RETURN count(n) AS c", Map.of("id", id))
            .single().get("c").asLong();
        if (existing > 0) return false;
        // a concurrent create of the same id fails here with ConstraintValidationFailed
        tx.run("CREATE (n:" + NODE_LABEL + ":`" + label + "` {id: $id}) SET n += $props",
            Map.of("id", id, "props", properties)).consume();
        return true;
      });
    }
  }

  @Override
  public boolean nodeExists(String id) {
    try (Session s = session(live())) {
      return s.executeRead(tx -> tx.run("MATCH (n:" + NODE_LABEL + " {id: $id}) RETURN count(n) AS c", Map.of("id", id))
          .single().get("c").asLong() > 0);
    }
  }

  @Override
  public boolean createEdge(String fromId, String toId, String relation, Map<String, Object> properties) {
    String cypher = "MATCH (a:" + NODE_LABEL + " {id: $from}), (b:" + NODE_LABEL + " {id: $to}) "
        + "CREATE (a)-[r:`" + relation + "`]->(b) SET r += $props RETURN count(r) AS c";
    try (Session s = session(live())) {
      return s.executeWrite(tx -> tx.run(cypher, Map.of("from", fromId, "to", toId, "props", properties))
          .single().get("c").asLong() > 0);
    }
  }

  @Override
  public Map<String, Set<String>> adjacency(Collection<String> ids, String relation, Direction direction) {
    String pattern = (direction == Direction.BOTH) ? "-[r]-" : "-[r]->";
    String cypher = "UNWIND $ids AS src MATCH (a:" + NODE_LABEL + " {id: src})" + pattern + "(b:" + NODE_LABEL + ") "
        + "WHERE $rel IS NULL OR type(r) = $rel RETURN src, collect(DISTINCT b.id) AS dst";
    Map<String, Object> params = new HashMap<>();
    params.put("ids", List.copyOf(ids));
    params.put("rel", relation);

    if (log.isTraceEnabled()) log.trace("polystore.graph op=adjacency ids={} direction={}", ids.size(), direction);

    try (Session s = session(live())) {
      return s.executeRead(tx -> {
        Map<String, Set<String>> out = new HashMap<>();
        for (Record r : tx.run(cypher, params).list()) {
          out.put(r.get("src").asString(), new HashSet<>(r.get("dst").asList(v -> v.asString())));
        }
        return out;
      });
    }
  }

  @Override
  public void clear() {
    try (Session s = session(live())) {
      s.executeWrite(tx -> tx.run("MATCH (n:" + NODE_LABEL + ") DETACH DELETE n").consume());
    }
    log.info("polystore.graph op=clear");
  }

  private Session session(Driver d) {
    return (config.database() == null)
        ? d.session()
        : d.session(SessionConfig.forDatabase(config.database()));
  }

  private Driver live() {
    Driver d = driver;
    if (d == null) throw new IllegalStateException("Neo4j backend is not open");
    return d;
  }
}
