package io.intellixity.mosaic.fs;

import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.path.Path;
import io.intellixity.mosaic.query.Variables;

import java.util.List;
import java.util.Set;

/**
 * Caller-facing filesystem primitives over the whole mounted namespace.
 * <p>
 * All paths are global. Failures are raised as {@link FileSystemException}.
 */
public interface FileSystem {

  /** Contents of a file; a view runs its saved query with {@code vars} laid over its defaults. */
  RowCursor read(FilePath file, Variables vars);

  default RowCursor read(FilePath file) {
    return read(file, Variables.EMPTY);
  }

  WriteResult write(FilePath file, List<Row> rows);

  WriteResult append(FilePath file, List<Row> rows);

  void delete(Path path);

  /**
   * Entries of a directory, merged across nested mounts. Listing a file yields that file alone, so a view lists
   * as a single virtual file.
   */
  Set<Node> list(Path path);

  /** Move within one mount. Fails with {@link FsError#CROSS_MOUNT_OPERATION} otherwise. */
  void move(Path src, Path dst);

  /** Compile {@code query} relative to {@code dir} and run it. */
  RowCursor query(DirPath dir, String query, Variables vars);

  /** True if the path resolves to an existing file, directory, or mount point. */
  boolean exists(Path path);
}
