package io.intellixity.polystore.adapter.object;

import java.time.Instant;
import java.util.Objects;

/** Metadata of one stored object. */
public record ObjectInfo(String key, long size, Instant lastModified) {
  public ObjectInfo {
    Objects.requireNonNull(key, "key");
  }
}
