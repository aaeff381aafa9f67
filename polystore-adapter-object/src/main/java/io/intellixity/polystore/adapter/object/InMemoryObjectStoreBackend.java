package io.intellixity.polystore.adapter.object;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/** Embedded object store: a sorted concurrent map of key to immutable blob. */
public final class InMemoryObjectStoreBackend implements ObjectStoreBackend {
  private record Blob(byte[] data, Instant lastModified) {}

  private final ConcurrentSkipListMap<String, Blob> objects = new ConcurrentSkipListMap<>();
  private final Clock clock;

  public InMemoryObjectStoreBackend() {
    this(Clock.systemUTC());
  }

  public InMemoryObjectStoreBackend(Clock clock) {
    this.clock = clock;
  }

  @Override public void open() {}

  @Override public void close() {}

  @Override public void ping() {}

  @Override
  public ObjectInfo put(String key, byte[] data, String contentType) {
    Blob b = new Blob(data.clone(), clock.instant());
    objects.put(key, b);
    return new ObjectInfo(key, data.length, b.lastModified());
  }

  @Override
  public Optional<byte[]> get(String key) {
    Blob b = objects.get(key);
    return (b == null) ? Optional.empty() : Optional.of(b.data().clone());
  }

  @Override
  public List<String> list(String prefix) {
    List<String> out = new ArrayList<>();
    for (Map.Entry<String, Blob> e : objects.tailMap(prefix, true).entrySet()) {
      if (!e.getKey().startsWith(prefix)) break;
      out.add(e.getKey());
    }
    return out;
  }

  @Override
  public boolean delete(String key) {
    return objects.remove(key) != null;
  }

  @Override
  public Optional<ObjectInfo> stat(String key) {
    Blob b = objects.get(key);
    return (b == null) ? Optional.empty() : Optional.of(new ObjectInfo(key, b.data().length, b.lastModified()));
  }
}
