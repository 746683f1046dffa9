package io.intellixity.sift.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Loads SPI implementations listed in {@code META-INF/sift.factories} resources.
 * <p>
 * Each resource is a properties file keyed by SPI interface name; values are comma-separated
 * implementation class names with public no-arg constructors:
 * <pre>
 * io.intellixity.sift.spi.sql.Dialect=io.intellixity.sift.clickhouse.ClickHouseDialect
 * </pre>
 */
public final class SiftFactoriesLoader {
  public static final String RESOURCE = "META-INF/sift.factories";

  private SiftFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    return load(spiType, cl == null ? SiftFactoriesLoader.class.getClassLoader() : cl);
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    Objects.requireNonNull(cl, "cl");
    List<T> out = new ArrayList<>();
    for (String implName : implementationNames(spiType.getName(), cl)) {
      out.add(instantiate(implName, spiType, cl));
    }
    return out;
  }

  static Set<String> implementationNames(String key, ClassLoader cl) {
    Set<String> names = new LinkedHashSet<>();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      String value = read(url).getProperty(key);
      if (value == null) continue;
      for (String part : value.split(",")) {
        if (!part.isBlank()) names.add(part.trim());
      }
    }
    return names;
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + url, e);
    }
    return p;
  }

  private static <T> T instantiate(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Factory class not found: " + implName, e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalStateException(implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for " + spiType.getName(), e);
    }
  }
}
