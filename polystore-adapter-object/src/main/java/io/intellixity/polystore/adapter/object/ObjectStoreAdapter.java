package io.intellixity.polystore.adapter.object;

import io.intellixity.polystore.adapter.AbstractStoreAdapter;
import io.intellixity.polystore.adapter.ConcurrencyMode;
import io.intellixity.polystore.op.Params;
import io.intellixity.polystore.result.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Object store adapter: opaque keys to byte payloads, last write wins.\n
 *
 * Kinds: {@code put}, {@code get}, {@code list}, {@code delete}, {@code stat}.\n
 */
public final class ObjectStoreAdapter extends AbstractStoreAdapter {
  private static final Logger log = LoggerFactory.getLogger(ObjectStoreAdapter.class);

  /** S3's limit on UTF-8 key length. */
  static final int MAX_KEY_BYTES = 1024;

  private final ObjectStoreBackend backend;

  public ObjectStoreAdapter(ObjectStoreBackend backend) {
    super(ObjectStoreAdapterFactory.SCHEMA, ConcurrencyMode.CONCURRENT);
    this.backend = Objects.requireNonNull(backend, "backend");
    handle("put", this::put);
    handle("get", this::get);
    handle("list", this::list);
    handle("delete", this::delete);
    handle("stat", this::stat);
  }

  ObjectStoreBackend backend() { return backend; }

  @Override
  protected void doConnect() {
    backend.open();
  }

  @Override
  protected void doDisconnect() {
    backend.close();
  }

  @Override
  protected void doHealthCheck() {
    backend.ping();
  }

  private Object put(Params p) {
    String key = key(p);
    byte[] data = p.bytes("data");
    ObjectInfo info = backend.put(key, data, p.optString("contentType"));
    if (log.isDebugEnabled()) log.debug("polystore.object op=put size={}", info.size());
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("key", info.key());
    out.put("size", info.size());
    return out;
  }

  private Object get(Params p) {
    String key = key(p);
    return backend.get(key).orElseThrow(() -> missing(key));
  }

  private Object list(Params p) {
    String prefix = p.has("prefix") ? p.string("prefix") : "";
    List<String> keys = backend.list(prefix);
    return List.copyOf(keys);
  }

  private Object delete(Params p) {
    String key = key(p);
    if (!backend.delete(key)) throw missing(key);
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("key", key);
    out.put("deleted", true);
    return out;
  }

  private Object stat(Params p) {
    String key = key(p);
    ObjectInfo info = backend.stat(key).orElseThrow(() -> missing(key));
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("key", info.key());
    out.put("size", info.size());
    out.put("lastModified", info.lastModified() == null ? null : info.lastModified().toString());
    return out;
  }

  private static String key(Params p) {
    String key = p.string("key");
    // keys are opaque: only the empty string is malformed
    if (key.isEmpty()) throw StoreException.invalidInput("Object key must not be empty");
    if (key.getBytes(StandardCharsets.UTF_8).length > MAX_KEY_BYTES) {
      throw StoreException.invalidInput("Object key exceeds " + MAX_KEY_BYTES + " bytes");
    }
    return key;
  }

  private static StoreException missing(String key) {
    return StoreException.notFound("No object under key '" + key + "'");
  }
}
