package io.intellixity.quill.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style extension loader.
 * <p>
 * Looks up all {@code META-INF/quill.factories} resources on the classpath. Each resource is a Java
 * Properties file keyed by SPI interface name:
 *
 * <pre>
 * io.intellixity.quill.dialect.DialectProvider=com.acme.OracleDialects
 * io.intellixity.quill.spi.bind.BinderProvider=com.acme.MyBinders,com.acme.OtherBinders
 * </pre>
 *
 * Values may be comma-separated; whitespace is ignored and duplicates are dropped, preserving order.
 */
public final class QuillFactoriesLoader {
  public static final String RESOURCE = "META-INF/quill.factories";

  private QuillFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = QuillFactoriesLoader.class.getClassLoader();

    String key = spiType.getName();
    Set<String> implNames = new LinkedHashSet<>();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }

    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }

      String v = p.getProperty(key);
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Class " + implName + " listed for SPI " + spiType.getName() + " not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
