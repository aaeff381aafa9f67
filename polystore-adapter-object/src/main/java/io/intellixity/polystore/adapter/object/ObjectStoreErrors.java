package io.intellixity.polystore.adapter.object;

import io.intellixity.polystore.adapter.ErrorMappingTable;
import io.intellixity.polystore.result.ErrorCategory;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/** S3 SDK exception classification. Order matters: the timeout exceptions are also SdkClientExceptions. */
final class ObjectStoreErrors {
  private ObjectStoreErrors() {}

  static final ErrorMappingTable TABLE = ErrorMappingTable.builder()
      .on(ApiCallTimeoutException.class, ErrorCategory.TIMEOUT, true)
      .on(ApiCallAttemptTimeoutException.class, ErrorCategory.TIMEOUT, true)
      .on(NoSuchBucketException.class, ErrorCategory.BACKEND_UNAVAILABLE, false)
      .when("s3.noSuchBucket", S3Exception.class, e -> "NoSuchBucket".equals(errorCode(e)),
          ErrorCategory.BACKEND_UNAVAILABLE, false)
      .when("s3.404", S3Exception.class, e -> e.statusCode() == 404, ErrorCategory.NOT_FOUND, false)
      .when("s3.409", S3Exception.class, e -> e.statusCode() == 409, ErrorCategory.CONFLICT, false)
      .when("s3.400", S3Exception.class, e -> e.statusCode() == 400, ErrorCategory.INVALID_INPUT, false)
      .when("s3.auth", S3Exception.class, e -> e.statusCode() == 401 || e.statusCode() == 403,
          ErrorCategory.BACKEND_UNAVAILABLE, false)
      .when("s3.5xx", S3Exception.class, e -> e.statusCode() >= 500, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .on(SdkClientException.class, ErrorCategory.BACKEND_UNAVAILABLE, true)
      .build();

  private static String errorCode(S3Exception e) {
    return (e.awsErrorDetails() == null) ? null : e.awsErrorDetails().errorCode();
  }
}
