package io.intellixity.polystore.adapter.object;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * S3-compatible backend (AWS S3, MinIO with path-style addressing).\n
 *
 * The bucket is created on {@link #open()} when missing. 404 responses on object reads become absence;
 * every other {@link S3Exception} and all {@code SdkClientException}s propagate for the error table.\n
 */
public final class S3ObjectStoreBackend implements ObjectStoreBackend {
  private static final Logger log = LoggerFactory.getLogger(S3ObjectStoreBackend.class);

  /** Connection settings; {@code endpoint} null means the regional AWS endpoint. */
  public record Config(String endpoint, String region, String accessKey, String secretKey, String bucket,
                       boolean pathStyle) {
    public Config {
      Objects.requireNonNull(region, "region");
      Objects.requireNonNull(bucket, "bucket");
    }
  }

  private final Config config;
  private volatile S3Client s3;

  public S3ObjectStoreBackend(Config config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  @Override
  public void open() {
    var b = S3Client.builder()
        .region(Region.of(config.region()))
        .credentialsProvider(credentials())
        .forcePathStyle(config.pathStyle());
    if (config.endpoint() != null) b.endpointOverride(URI.create(config.endpoint()));
    S3Client client = b.build();
    try {
      ensureBucket(client);
    } catch (RuntimeException e) {
      client.close();
      throw e;
    }
    this.s3 = client;
  }

  @Override
  public void close() {
    S3Client c = s3;
    s3 = null;
    if (c != null) c.close();
  }

  @Override
  public void ping() {
    client().headBucket(HeadBucketRequest.builder().bucket(config.bucket()).build());
  }

  @Override
  public ObjectInfo put(String key, byte[] data, String contentType) {
    PutObjectRequest.Builder b = PutObjectRequest.builder().bucket(config.bucket()).key(key);
    if (contentType != null && !contentType.isBlank()) b = b.contentType(contentType);
    client().putObject(b.build(), RequestBody.fromBytes(data));
    return new ObjectInfo(key, data.length, null);
  }

  @Override
  public Optional<byte[]> get(String key) {
    try {
      return Optional.of(client().getObject(
              GetObjectRequest.builder().bucket(config.bucket()).key(key).build(),
              ResponseTransformer.toBytes())
          .asByteArray());
    } catch (S3Exception e) {
      if (isMissingKey(e)) return Optional.empty();
      throw e;
    }
  }

  @Override
  public List<String> list(String prefix) {
    List<String> keys = new ArrayList<>();
    ListObjectsV2Request req = ListObjectsV2Request.builder().bucket(config.bucket()).prefix(prefix).build();
    for (ListObjectsV2Response page : client().listObjectsV2Paginator(req)) {
      for (S3Object o : page.contents()) keys.add(o.key());
    }
    // S3 lists in UTF-8 binary order; MinIO does not promise it
    Collections.sort(keys);
    return keys;
  }

  @Override
  public boolean delete(String key) {
    // DeleteObject succeeds for absent keys, so existence is checked first
    if (stat(key).isEmpty()) return false;
    client().deleteObject(DeleteObjectRequest.builder().bucket(config.bucket()).key(key).build());
    return true;
  }

  @Override
  public Optional<ObjectInfo> stat(String key) {
    try {
      HeadObjectResponse r = client().headObject(HeadObjectRequest.builder().bucket(config.bucket()).key(key).build());
      long size = (r.contentLength() == null) ? 0L : r.contentLength();
      return Optional.of(new ObjectInfo(key, size, r.lastModified()));
    } catch (S3Exception e) {
      if (isMissingKey(e)) return Optional.empty();
      throw e;
    }
  }

  private void ensureBucket(S3Client client) {
    try {
      client.headBucket(HeadBucketRequest.builder().bucket(config.bucket()).build());
    } catch (NoSuchBucketException e) {
      createBucket(client);
    } catch (S3Exception e) {
      if (e.statusCode() != 404) throw e;
      createBucket(client);
    }
  }

  private void createBucket(S3Client client) {
    client.createBucket(CreateBucketRequest.builder().bucket(config.bucket()).build());
    log.info("polystore.object op=createBucket bucket={}", config.bucket());
  }

  private AwsCredentialsProvider credentials() {
    if (config.accessKey() != null && config.secretKey() != null) {
      return StaticCredentialsProvider.create(AwsBasicCredentials.create(config.accessKey(), config.secretKey()));
    }
    return DefaultCredentialsProvider.create();
  }

  private S3Client client() {
    S3Client c = s3;
    if (c == null) throw new IllegalStateException("S3 backend is not open");
    return c;
  }

  private static boolean isMissingKey(S3Exception e) {
    if (e instanceof NoSuchBucketException) return false;
    String code = (e.awsErrorDetails() == null) ? null : e.awsErrorDetails().errorCode();
    return !"NoSuchBucket".equals(code) && e.statusCode() == 404;
  }
}
