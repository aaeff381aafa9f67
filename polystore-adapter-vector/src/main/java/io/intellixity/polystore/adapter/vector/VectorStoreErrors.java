package io.intellixity.polystore.adapter.vector;

import com.mongodb.MongoCommandException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoNodeIsRecoveringException;
import com.mongodb.MongoNotPrimaryException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoServerException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.MongoTimeoutException;
import io.intellixity.polystore.adapter.ErrorMappingTable;
import io.intellixity.polystore.result.ErrorCategory;

/** MongoDB driver exception classification. Specific subclasses precede their parents. */
final class VectorStoreErrors {
  private VectorStoreErrors() {}

  static final int DUPLICATE_KEY = 11000;

  static final ErrorMappingTable TABLE = ErrorMappingTable.builder()
      .on(MongoTimeoutException.class, ErrorCategory.TIMEOUT, true)
      .on(MongoExecutionTimeoutException.class, ErrorCategory.TIMEOUT, true)
      .on(MongoSocketReadTimeoutException.class, ErrorCategory.TIMEOUT, true)
      .on(MongoSocketException.class, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .on(MongoSecurityException.class, ErrorCategory.BACKEND_UNAVAILABLE, false)
      .on(MongoNotPrimaryException.class, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .on(MongoNodeIsRecoveringException.class, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .when("mongo.duplicateKey", MongoServerException.class, e -> e.getCode() == DUPLICATE_KEY,
          ErrorCategory.CONFLICT, false)
      .on(MongoCommandException.class, ErrorCategory.INTERNAL, false)
      .build();
}
