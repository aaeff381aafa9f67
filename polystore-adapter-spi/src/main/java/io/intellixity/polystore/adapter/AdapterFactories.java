package io.intellixity.polystore.adapter;

import io.intellixity.polystore.op.OperationSchema;
import io.intellixity.polystore.op.Paradigm;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Finds the adapter factories shipped on the classpath.\n
 *
 * Every adapter jar carries a {@code META-INF/polystore.factories} properties file naming its factory:\n
 *
 * <pre>\n
 * io.intellixity.polystore.adapter.AdapterFactory=io.intellixity.polystore.adapter.object.ObjectStoreAdapterFactory\n
 * </pre>\n
 *
 * Values may list several comma-separated classes. A class listed twice is loaded once; two different
 * classes claiming the same paradigm are rejected, naming both listings.\n
 */
public final class AdapterFactories {
  public static final String RESOURCE = "META-INF/polystore.factories";
  static final String KEY = AdapterFactory.class.getName();

  private AdapterFactories() {}

  /** Factories visible to the context class loader, keyed (and ordered) by paradigm. */
  public static Map<Paradigm, AdapterFactory> discover() {
    return discover(Thread.currentThread().getContextClassLoader());
  }

  public static Map<Paradigm, AdapterFactory> discover(ClassLoader cl) {
    if (cl == null) cl = AdapterFactories.class.getClassLoader();
    Map<String, URL> listed = listedClasses(cl);

    EnumMap<Paradigm, AdapterFactory> out = new EnumMap<>(Paradigm.class);
    Map<Paradigm, URL> origin = new EnumMap<>(Paradigm.class);
    for (Map.Entry<String, URL> e : listed.entrySet()) {
      AdapterFactory f = instantiate(e.getKey(), e.getValue(), cl);
      Paradigm p = checkedParadigm(f, e.getValue());
      AdapterFactory prior = out.putIfAbsent(p, f);
      if (prior != null) {
        throw new IllegalStateException(p.id() + " paradigm is served by both " + prior.getClass().getName()
            + " (" + origin.get(p) + ") and " + e.getKey() + " (" + e.getValue() + ")");
      }
      origin.put(p, e.getValue());
    }
    return Collections.unmodifiableMap(out);
  }

  /** Class name to the first listing that named it, in classpath order. */
  private static Map<String, URL> listedClasses(ClassLoader cl) {
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot enumerate " + RESOURCE, e);
    }
    Map<String, URL> listed = new LinkedHashMap<>();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties props = new Properties();
      try (InputStream in = url.openStream()) {
        props.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Cannot read adapter listing " + url, e);
      }
      String value = props.getProperty(KEY, "");
      for (String part : value.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) listed.putIfAbsent(name, url);
      }
    }
    return listed;
  }

  private static AdapterFactory instantiate(String className, URL listing, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(className, true, cl);
    } catch (ClassNotFoundException | LinkageError e) {
      throw new IllegalStateException("Adapter factory " + className + " listed in " + listing + " cannot be loaded", e);
    }
    if (!AdapterFactory.class.isAssignableFrom(raw)) {
      throw new IllegalStateException(className + " listed in " + listing + " is not an " + KEY);
    }
    try {
      return (AdapterFactory) raw.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Adapter factory " + className + " listed in " + listing
          + " needs a public no-arg constructor", e);
    }
  }

  private static Paradigm checkedParadigm(AdapterFactory f, URL listing) {
    String name = f.getClass().getName();
    Paradigm p = f.paradigm();
    if (p == null) throw new IllegalStateException(name + " listed in " + listing + " declares no paradigm");
    OperationSchema ops = f.operations();
    if (ops == null || ops.paradigm() != p) {
      throw new IllegalStateException(name + " listed in " + listing + " serves " + p.id()
          + " but its operations belong to " + (ops == null ? null : ops.paradigm().id()));
    }
    return p;
  }
}
