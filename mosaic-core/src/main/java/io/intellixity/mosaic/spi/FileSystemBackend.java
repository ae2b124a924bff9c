package io.intellixity.mosaic.spi;

import io.intellixity.mosaic.fs.Node;
import io.intellixity.mosaic.fs.Row;
import io.intellixity.mosaic.fs.RowCursor;
import io.intellixity.mosaic.fs.WriteResult;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.path.Path;
import io.intellixity.mosaic.query.QueryPlan;
import io.intellixity.mosaic.query.Variables;

import java.util.List;
import java.util.Set;

/**
 * Capability set a connected physical data source exposes to the core.
 * <p>
 * Every path a backend sees or returns is anchored at its own root; the core translates to and from the global
 * namespace. Failures are reported as {@link io.intellixity.mosaic.fs.FileSystemException} with backend-relative
 * paths; any other runtime exception is treated as an opaque backend error.
 * <p>
 * Every call may block.
 */
public interface FileSystemBackend extends AutoCloseable {

  RowCursor read(FilePath file);

  /** Replace the file's contents with {@code rows}. */
  WriteResult write(FilePath file, List<Row> rows);

  WriteResult append(FilePath file, List<Row> rows);

  void delete(Path path);

  Set<Node> list(DirPath dir);

  /** Move within this backend; {@code src} and {@code dst} are the same kind of path. */
  void move(Path src, Path dst);

  /**
   * Run a plan whose sources all live in this backend (already relocated into its namespace).
   * <p>
   * Backends without a native execution engine inherit this default, which reads the sources back through
   * {@link #read(FilePath)}.
   */
  default RowCursor query(QueryPlan plan, Variables vars) {
    return plan.execute(vars, this::read);
  }

  @Override
  void close();
}
