package io.intellixity.tessera.persistence.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Instantiates the implementations listed for an SPI type in every {@code META-INF/tessera.factories}
 * on the context classpath, e.g. {@code ...jdbc.dialect.JdbcDialect=com.acme.MyDialect}.\n
 * Duplicate registrations load once.
 */
public final class TesseraFactoriesLoader {
  public static final String RESOURCE = "META-INF/tessera.factories";
  private static final Logger log = LoggerFactory.getLogger(TesseraFactoriesLoader.class);

  private TesseraFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = TesseraFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    try {
      for (URL url : Collections.list(cl.getResources(RESOURCE))) {
        Properties p = new Properties();
        try (InputStream in = url.openStream()) {
          p.load(in);
        }
        for (String name : p.getProperty(spiType.getName(), "").split(",")) {
          if (!name.isBlank()) implNames.add(name.trim());
        }
      }
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + RESOURCE, e);
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      try {
        out.add(spiType.cast(Class.forName(implName, true, cl).getDeclaredConstructor().newInstance()));
      } catch (ReflectiveOperationException | ClassCastException e) {
        throw new IllegalStateException("Cannot load " + implName + " as " + spiType.getSimpleName(), e);
      }
    }
    log.debug("tessera.factories spi={} impls={}", spiType.getSimpleName(), implNames);
    return out;
  }
}
