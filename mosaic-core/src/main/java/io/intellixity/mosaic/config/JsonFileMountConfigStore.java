package io.intellixity.mosaic.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.intellixity.mosaic.path.Path;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Durable {@link MountConfigStore} keeping every mount in one JSON file:
 * <pre>
 * {"mountings": {"/data/": {"backend": {...}}, "/views/big.json": {"view": {...}}}}
 * </pre>
 * Each change rewrites the file through a temporary sibling and an atomic rename, so a crash leaves either the old
 * or the new table on disk.
 */
public final class JsonFileMountConfigStore implements MountConfigStore {
  private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  private static final TypeReference<Map<String, Map<String, MountConfig>>> FILE_TYPE = new TypeReference<>() {};
  private static final String MOUNTINGS = "mountings";

  private final java.nio.file.Path file;

  public JsonFileMountConfigStore(java.nio.file.Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  public java.nio.file.Path file() {
    return file;
  }

  @Override
  public synchronized Map<Path, MountConfig> load() {
    Map<Path, MountConfig> out = new LinkedHashMap<>();
    for (Map.Entry<String, MountConfig> e : read().entrySet()) out.put(Path.parse(e.getKey()), e.getValue());
    return out;
  }

  @Override
  public synchronized void save(Path path, MountConfig config) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(config, "config");
    Map<String, MountConfig> m = read();
    m.put(path.toString(), config);
    write(m);
  }

  @Override
  public synchronized void delete(Path path) {
    Objects.requireNonNull(path, "path");
    Map<String, MountConfig> m = read();
    if (m.remove(path.toString()) != null) write(m);
  }

  private Map<String, MountConfig> read() {
    if (!Files.exists(file)) return new LinkedHashMap<>();
    try {
      Map<String, Map<String, MountConfig>> root = JSON.readValue(file.toFile(), FILE_TYPE);
      Map<String, MountConfig> m = (root == null) ? null : root.get(MOUNTINGS);
      return (m == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(m);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read mount configs from " + file, e);
    }
  }

  private void write(Map<String, MountConfig> m) {
    java.nio.file.Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      if (file.getParent() != null) Files.createDirectories(file.getParent());
      JSON.writeValue(tmp.toFile(), Map.of(MOUNTINGS, m));
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write mount configs to " + file, e);
    }
  }
}
