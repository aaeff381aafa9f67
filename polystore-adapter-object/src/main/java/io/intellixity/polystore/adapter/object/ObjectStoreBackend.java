package io.intellixity.polystore.adapter.object;

import java.util.List;
import java.util.Optional;

/**
 * Key to bytes store consumed by {@link ObjectStoreAdapter}.\n
 *
 * Keys arrive validated (non-empty). Absence is reported through {@code Optional}/{@code false};
 * backend failures are thrown as the vendor's own exceptions.\n
 */
public interface ObjectStoreBackend {
  void open();

  void close();

  void ping();

  /** Stores {@code data} under {@code key}, replacing any previous object. */
  ObjectInfo put(String key, byte[] data, String contentType);

  Optional<byte[]> get(String key);

  /** Keys starting with {@code prefix} (empty prefix = all), lexicographically ordered. */
  List<String> list(String prefix);

  /** @return false when no object existed under {@code key} */
  boolean delete(String key);

  Optional<ObjectInfo> stat(String key);
}
