package io.intellixity.vigil.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Loads pluggable implementations listed in {@code META-INF/vigil.factories} resources.\n
 *
 * Each resource is a Java Properties file mapping an interface name to implementation classes:\n
 *\n
 * <pre>\n
 * io.intellixity.vigil.jdbc.dialect.IndexDialect=io.intellixity.vigil.jdbc.postgres.PostgresIndexDialect\n
 * </pre>\n
 *
 * Values may be comma-separated; duplicates across resources are loaded once.\n
 */
public final class VigilFactoriesLoader {
  public static final String RESOURCE = "META-INF/vigil.factories";

  private VigilFactoriesLoader() {}

  public static <T> List<T> load(Class<T> type) {
    return load(type, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> type, ClassLoader cl) {
    Objects.requireNonNull(type, "type");
    if (cl == null) cl = VigilFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Cannot read " + url, e);
      }
      String v = p.getProperty(type.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) out.add(instantiate(implName, type, cl));
    return out;
  }

  private static <T> T instantiate(String implName, Class<T> type, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(implName, true, cl);
      if (!type.isAssignableFrom(raw)) {
        throw new IllegalArgumentException(implName + " does not implement " + type.getName());
      }
      return type.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot instantiate " + implName + " for " + type.getName(), e);
    }
  }
}
