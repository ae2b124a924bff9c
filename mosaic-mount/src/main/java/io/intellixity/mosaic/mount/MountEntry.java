package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.config.BackendConfig;
import io.intellixity.mosaic.config.MountConfig;
import io.intellixity.mosaic.config.ViewConfig;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.path.Path;

import java.util.Objects;

/**
 * One mount: where it lives, what it is, and for backends the live connection the table owns.
 *
 * @param live present exactly for backend mounts
 */
public record MountEntry(Path path, MountConfig config, LiveHandle live) {
  public MountEntry {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(config, "config");
    if (config instanceof ViewConfig) {
      if (!(path instanceof FilePath)) throw new IllegalArgumentException("views mount at file paths: " + path);
      if (live != null) throw new IllegalArgumentException("views hold no live connection: " + path);
    } else {
      if (!(path instanceof DirPath)) throw new IllegalArgumentException("backends mount at directory paths: " + path);
      Objects.requireNonNull(live, "live");
    }
  }

  public static MountEntry view(FilePath path, ViewConfig config) {
    return new MountEntry(path, config, null);
  }

  public static MountEntry backend(DirPath path, BackendConfig config, LiveHandle live) {
    return new MountEntry(path, config, live);
  }

  public boolean isView() {
    return config instanceof ViewConfig;
  }

  public boolean isBackend() {
    return config instanceof BackendConfig;
  }

  /** Mount directory of a backend entry. */
  public DirPath dir() {
    if (!(path instanceof DirPath d)) throw new IllegalStateException("not a backend mount: " + path);
    return d;
  }
}
