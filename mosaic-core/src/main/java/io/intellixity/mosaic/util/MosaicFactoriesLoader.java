package io.intellixity.mosaic.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style loader for mosaic extension points.
 * <p>
 * Reads every {@code META-INF/mosaic.factories} resource on the classpath. Each resource is a Java Properties file
 * keyed by SPI interface name, with comma-separated implementation class names:
 *
 * <pre>
 * io.intellixity.mosaic.spi.BackendKind=io.intellixity.mosaic.memory.InMemoryBackendKind
 * </pre>
 *
 * Implementations need a public no-arg constructor. Duplicates across resources are instantiated once.
 */
public final class MosaicFactoriesLoader {
  public static final String RESOURCE = "META-INF/mosaic.factories";

  private MosaicFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = MosaicFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String v = properties(url).getProperty(spiType.getName());
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

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties properties(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return p;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Class " + implName + " listed in " + RESOURCE + " not found", e);
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
