package io.intellixity.mosaic.fs;

import io.intellixity.mosaic.config.MountConfig;
import io.intellixity.mosaic.path.Path;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successful unmount.
 *
 * @param warnings best-effort release failures; the mount is gone regardless
 */
public record UnmountResult(Path path, MountConfig config, List<String> warnings) {
  public UnmountResult {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(config, "config");
    warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
  }

  public boolean clean() {
    return warnings.isEmpty();
  }
}
