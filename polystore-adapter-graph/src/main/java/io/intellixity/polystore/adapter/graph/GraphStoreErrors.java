package io.intellixity.polystore.adapter.graph;

import io.intellixity.polystore.adapter.ErrorMappingTable;
import io.intellixity.polystore.result.ErrorCategory;
import org.neo4j.driver.exceptions.AuthenticationException;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.DatabaseException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;

/** Neo4j driver exception classification by type and status code. */
final class GraphStoreErrors {
  private GraphStoreErrors() {}

  static final ErrorMappingTable TABLE = ErrorMappingTable.builder()
      .on(ServiceUnavailableException.class, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .on(SessionExpiredException.class, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .on(TransientException.class, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .on(AuthenticationException.class, ErrorCategory.BACKEND_UNAVAILABLE, false)
      .when("neo4j.constraint", ClientException.class, e -> codeContains(e, "ConstraintValidationFailed"),
          ErrorCategory.CONFLICT, false)
      .when("neo4j.statement", ClientException.class, e -> codeContains(e, "Neo.ClientError.Statement"),
          ErrorCategory.INVALID_INPUT, false)
      .on(DatabaseException.class, ErrorCategory.INTERNAL, false)
      .build();

  private static boolean codeContains(ClientException e, String fragment) {
    return e.code() != null && e.code().contains(fragment);
  }
}
