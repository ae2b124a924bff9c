package io.intellixity.mosaic.config;

import io.intellixity.mosaic.path.Path;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ephemeral {@link MountConfigStore}: keeps mounts for the lifetime of the process only.
 * <p>
 * Useful for tests, demos, and deployments whose mounts all come from configuration.
 */
public final class InMemoryMountConfigStore implements MountConfigStore {
  private final Map<Path, MountConfig> configs = new LinkedHashMap<>();

  public InMemoryMountConfigStore() {}

  public InMemoryMountConfigStore(Map<Path, MountConfig> initial) {
    if (initial != null) configs.putAll(initial);
  }

  @Override
  public synchronized Map<Path, MountConfig> load() {
    return new LinkedHashMap<>(configs);
  }

  @Override
  public synchronized void save(Path path, MountConfig config) {
    configs.put(Objects.requireNonNull(path, "path"), Objects.requireNonNull(config, "config"));
  }

  @Override
  public synchronized void delete(Path path) {
    configs.remove(Objects.requireNonNull(path, "path"));
  }
}
