package io.intellixity.mosaic.config;

import io.intellixity.mosaic.path.Path;

import java.util.Map;

/**
 * Persistence of the mount table itself. Loaded once at startup and written through on every successful
 * mount or unmount.
 */
public interface MountConfigStore {

  /** All persisted mounts, in mount order. */
  Map<Path, MountConfig> load();

  void save(Path path, MountConfig config);

  void delete(Path path);
}
