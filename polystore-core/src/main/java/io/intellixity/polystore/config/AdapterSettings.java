package io.intellixity.polystore.config;

import io.intellixity.polystore.op.Paradigm;

import java.time.Duration;
import java.util.*;

/**
 * Immutable string settings for one paradigm's adapter.\n
 *
 * Adapters read these lazily at connect time, so a missing value surfaces as
 * {@link MissingSettingException} on first use of that paradigm and never at startup.\n
 */
public final class AdapterSettings {
  private final Paradigm paradigm;
  private final Map<String, String> values;

  public AdapterSettings(Paradigm paradigm, Map<String, String> values) {
    this.paradigm = Objects.requireNonNull(paradigm, "paradigm");
    Map<String, String> m = new LinkedHashMap<>();
    if (values != null) {
      for (var e : values.entrySet()) {
        if (e.getKey() == null || e.getValue() == null) continue;
        m.put(e.getKey(), e.getValue());
      }
    }
    this.values = Collections.unmodifiableMap(m);
  }

  public static AdapterSettings empty(Paradigm paradigm) {
    return new AdapterSettings(paradigm, Map.of());
  }

  public static AdapterSettings of(Paradigm paradigm, Map<String, String> values) {
    return new AdapterSettings(paradigm, values);
  }

  public Paradigm paradigm() { return paradigm; }

  public Map<String, String> asMap() { return values; }

  public boolean has(String key) {
    String v = values.get(key);
    return v != null && !v.isBlank();
  }

  public Optional<String> get(String key) {
    return has(key) ? Optional.of(values.get(key).trim()) : Optional.empty();
  }

  public String get(String key, String def) {
    return get(key).orElse(def);
  }

  public String require(String key) {
    return get(key).orElseThrow(() ->
        new MissingSettingException("Missing setting '" + key + "' for " + paradigm.id() + " adapter"));
  }

  public int getInt(String key, int def) {
    return get(key).map(v -> parseInt(key, v)).orElse(def);
  }

  public int requireInt(String key) {
    return parseInt(key, require(key));
  }

  public boolean getBoolean(String key, boolean def) {
    return get(key).map(Boolean::parseBoolean).orElse(def);
  }

  /** Accepts ISO-8601 ({@code PT5S}) or plain milliseconds. */
  public Duration getDuration(String key, Duration def) {
    Optional<String> v = get(key);
    if (v.isEmpty()) return def;
    String s = v.get();
    try {
      if (s.startsWith("P") || s.startsWith("p")) return Duration.parse(s);
      return Duration.ofMillis(Long.parseLong(s));
    } catch (RuntimeException e) {
      throw new MissingSettingException("Setting '" + key + "' for " + paradigm.id() + " is not a duration: " + s);
    }
  }

  private int parseInt(String key, String v) {
    try {
      return Integer.parseInt(v);
    } catch (NumberFormatException e) {
      throw new MissingSettingException("Setting '" + key + "' for " + paradigm.id() + " is not an integer: " + v);
    }
  }

  @Override
  public String toString() {
    // values may hold credentials
    return "AdapterSettings{" + paradigm.id() + ", keys=" + values.keySet() + "}";
  }
}
