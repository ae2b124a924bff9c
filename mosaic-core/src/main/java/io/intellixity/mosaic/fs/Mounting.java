package io.intellixity.mosaic.fs;

import io.intellixity.mosaic.config.MountConfig;
import io.intellixity.mosaic.path.Path;

import java.util.Map;
import java.util.Optional;

/** Caller-facing mount management. */
public interface Mounting {

  /**
   * Mount {@code config} at {@code path}. Backends mount at directories, views at files.
   *
   * @throws FileSystemException {@link FsError#MOUNT_EXISTS}, {@link FsError#PATH_TYPE_MISMATCH},
   *     {@link FsError#UNKNOWN_BACKEND_KIND}, {@link FsError#BACKEND_CONNECT_ERROR} or {@link FsError#QUERY_ERROR}
   */
  void mount(Path path, MountConfig config);

  /** @throws FileSystemException {@link FsError#MOUNT_NOT_FOUND} */
  UnmountResult unmount(Path path);

  /** Move an existing mount to a new path; the original mount is restored if the move fails. */
  void remount(Path from, Path to);

  Optional<MountConfig> lookupMountConfig(Path path);

  /** Every current mount, ordered by path. */
  Map<Path, MountConfig> mounts();
}
