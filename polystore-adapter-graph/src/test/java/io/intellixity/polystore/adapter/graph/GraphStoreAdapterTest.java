package io.intellixity.polystore.adapter.graph;

import io.intellixity.polystore.adapter.ErrorMappingTable;
import io.intellixity.polystore.config.AdapterSettings;
import io.intellixity.polystore.op.Operation;
import io.intellixity.polystore.op.Paradigm;
import io.intellixity.polystore.result.ErrorCategory;
import io.intellixity.polystore.result.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.exceptions.ClientException;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class GraphStoreAdapterTest {
  private GraphStoreAdapter graph;

  @BeforeEach
  void setUp() throws Exception {
    graph = (GraphStoreAdapter) new GraphStoreAdapterFactory().create(AdapterSettings.empty(Paradigm.GRAPH));
    graph.connect();
  }

  private Object run(String kind, Map<String, ?> params) throws Exception {
    return graph.execute(Operation.of(Paradigm.GRAPH, kind, params));
  }

  private void node(String id) throws Exception {
    run("createNode", Map.of("label", "User", "id", id, "properties", Map.of("name", id)));
  }

  private void edge(String from, String to) throws Exception {
    run("createEdge", Map.of("fromId", from, "toId", to, "relation", "FRIEND"));
  }

  private Object neighbors(String id, int hops) throws Exception {
    return run("neighbors", Map.of("nodeId", id, "maxHops", hops));
  }

  private static ErrorCategory failure(Executable e) {
    return assertThrows(StoreException.class, e::run).category();
  }

  @FunctionalInterface
  private interface Executable {
    void run() throws Exception;
  }

  @Test
  void exactHopExcludesNodesReachableSooner() throws Exception {
    for (String id : List.of("A", "B", "C")) node(id);
    edge("A", "B");
    edge("B", "C");
    assertEquals(List.of("C"), neighbors("A", 2));

    edge("A", "C");
    assertEquals(List.of(), neighbors("A", 2));
    assertEquals(List.of("B", "C"), neighbors("A", 1));
  }

  @Test
  void originIsNeverItsOwnNeighbour() throws Exception {
    node("A");
    node("B");
    edge("A", "B");
    edge("B", "A");
    assertEquals(List.of(), neighbors("A", 2));
  }

  @Test
  void followsOutgoingEdgesOnly_andFiltersByRelation() throws Exception {
    for (String id : List.of("A", "B", "C")) node(id);
    edge("B", "A");
    run("createEdge", Map.of("fromId", "A", "toId", "C", "relation", "BLOCKS"));
    assertEquals(List.of("C"), run("neighbors", Map.of("nodeId", "A")));
    assertEquals(List.of(), run("neighbors", Map.of("nodeId", "A", "relation", "FRIEND")));
  }

  @Test
  void friendsOfFriendsExcludeDirectFriendsAndSelf() throws Exception {
    for (String id : List.of("alice", "bob", "carol", "dave", "erin")) node(id);
    edge("alice", "bob");
    edge("alice", "carol");
    edge("bob", "carol");
    edge("bob", "dave");
    edge("carol", "erin");
    edge("dave", "alice");
    assertEquals(List.of("dave", "erin"), neighbors("alice", 2));
  }

  @Test
  void maxHopsOutsideBoundsIsInvalidInput() throws Exception {
    node("A");
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> neighbors("A", 0)));
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> neighbors("A", GraphStoreAdapterFactory.DEFAULT_MAX_HOPS + 1)));
  }

  @Test
  void missingNodesAreNotFound() throws Exception {
    node("A");
    assertEquals(ErrorCategory.NOT_FOUND, failure(() -> neighbors("ghost", 1)));
    assertEquals(ErrorCategory.NOT_FOUND, failure(() -> edge("A", "ghost")));
    assertEquals(ErrorCategory.NOT_FOUND, failure(() -> edge("ghost", "A")));
  }

  @Test
  void duplicateExplicitIdIsConflict_generatedIdsAreUnique() throws Exception {
    node("A");
    assertEquals(ErrorCategory.CONFLICT, failure(() -> node("A")));

    Object a = ((Map<?, ?>) run("createNode", Map.of("label", "User"))).get("nodeId");
    Object b = ((Map<?, ?>) run("createNode", Map.of("label", "User"))).get("nodeId");
    assertNotEquals(a, b);
  }

  @Test
  void labelsRelationsAndPropertiesAreValidated() throws Exception {
    node("A");
    node("B");
    assertEquals(ErrorCategory.INVALID_INPUT, failure(() -> run("createNode", Map.of("label", "Bad-Label"))));
    assertEquals(ErrorCategory.INVALID_INPUT,
        failure(() -> run("createEdge", Map.of("fromId", "A", "toId", "B", "relation", "x`) DETACH DELETE n //"))));
    assertEquals(ErrorCategory.INVALID_INPUT,
        failure(() -> run("createNode", Map.of("label", "User", "properties", Map.of("nested", Map.of("a", 1))))));
    Map<String, Object> withNull = new HashMap<>();
    withNull.put("age", null);
    assertEquals(ErrorCategory.INVALID_INPUT,
        failure(() -> run("createNode", Map.of("label", "User", "properties", withNull))));
  }

  @Test
  void shortestPathIsUndirected() throws Exception {
    for (String id : List.of("A", "B", "C", "D")) node(id);
    edge("A", "B");
    edge("C", "B");
    @SuppressWarnings("unchecked")
    Map<String, Object> r = (Map<String, Object>) run("shortestPath", Map.of("fromId", "A", "toId", "C"));
    assertEquals(List.of("A", "B", "C"), r.get("path"));
    assertEquals(2, r.get("hops"));

    assertEquals(ErrorCategory.NOT_FOUND, failure(() -> run("shortestPath", Map.of("fromId", "A", "toId", "D"))));
    assertEquals(Map.of("path", List.of("D"), "hops", 0), run("shortestPath", Map.of("fromId", "D", "toId", "D")));
  }

  @Test
  void clearRemovesEverything() throws Exception {
    node("A");
    assertNull(run("clear", Map.of()));
    assertEquals(ErrorCategory.NOT_FOUND, failure(() -> neighbors("A", 1)));
    node("A");
  }

  @Test
  void concurrentDuplicateRejectedByTheBackendIsConflict() throws Exception {
    GraphStoreAdapter racing = new GraphStoreAdapter(new LostRaceBackend(), 4);
    racing.connect();
    ClientException e = assertThrows(ClientException.class, () -> racing.execute(
        Operation.of(Paradigm.GRAPH, "createNode", Map.of("label", "User", "id", "A"))));

    ErrorMappingTable.Match m = GraphStoreErrors.TABLE.classify(e).orElseThrow();
    assertEquals(ErrorCategory.CONFLICT, m.category());
    assertFalse(m.retryable());
    assertTrue(Neo4jGraphBackend.UNIQUE_ID_CONSTRAINT.endsWith("REQUIRE n.id IS UNIQUE"));
  }

  /** Passes the existence check, then loses to a concurrent writer at commit. */
  private static final class LostRaceBackend implements GraphBackend {
    @Override public void open() {}
    @Override public void close() {}
    @Override public void ping() {}
    @Override public boolean nodeExists(String id) { return false; }
    @Override public boolean createEdge(String fromId, String toId, String relation, Map<String, Object> properties) {
      return false;
    }
    @Override public Map<String, Set<String>> adjacency(Collection<String> ids, String relation, Direction direction) {
      return Map.of();
    }
    @Override public void clear() {}

    @Override
    public boolean createNode(String id, String label, Map<String, Object> properties) {
      throw new ClientException("Neo.ClientError.Schema.ConstraintValidationFailed",
          "Node(12) already exists with label `PolyNode` and property `id` = '" + id + "'");
    }
  }
}
