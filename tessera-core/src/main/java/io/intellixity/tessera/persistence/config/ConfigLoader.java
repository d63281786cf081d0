package io.intellixity.tessera.persistence.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** Loads a YAML application config into a {@link DatabaseConfig}. */
public final class ConfigLoader {
  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

  private ConfigLoader() {}

  public static DatabaseConfig load(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read config " + path, e);
    }
  }

  /** Loads from a classpath resource, e.g. {@code "tessera.yml"}. */
  public static DatabaseConfig loadResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = ConfigLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalStateException("Config resource not found: " + resource);
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read config resource " + resource, e);
    }
  }

  public static DatabaseConfig load(InputStream in) throws IOException {
    @SuppressWarnings("unchecked")
    Map<String, Object> root = YAML.readValue(in, LinkedHashMap.class);
    if (root == null) throw new IllegalStateException("Config is empty");
    return DatabaseConfig.fromMap(root);
  }
}
