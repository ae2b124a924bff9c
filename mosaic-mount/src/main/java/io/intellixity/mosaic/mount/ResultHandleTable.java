package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.fs.FileSystem;
import io.intellixity.mosaic.fs.FileSystemException;
import io.intellixity.mosaic.fs.Row;
import io.intellixity.mosaic.fs.RowCursor;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.query.Variables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Open query results addressed by {@link ResultHandle}, for callers that page through a result across requests.
 * <p>
 * A handle is dropped once its cursor is exhausted or it is closed; closing is idempotent.
 */
public final class ResultHandleTable {
  private static final Logger log = LoggerFactory.getLogger(ResultHandleTable.class);

  private record OpenResult(DirPath dir, RowCursor cursor) {}

  private final Supplier<? extends FileSystem> fs;
  private final MonotonicSequence ids;
  private final ConcurrentHashMap<Long, OpenResult> open = new ConcurrentHashMap<>();

  public ResultHandleTable(Supplier<? extends FileSystem> fs, MonotonicSequence ids) {
    this.fs = Objects.requireNonNull(fs, "fs");
    this.ids = Objects.requireNonNull(ids, "ids");
  }

  public ResultHandle openQuery(DirPath dir, String query, Variables vars) {
    RowCursor cursor = fs.get().query(dir, query, vars);
    long id = ids.next();
    if (open.putIfAbsent(id, new OpenResult(dir, cursor)) != null) {
      cursor.close();
      throw new IllegalStateException("Duplicate result handle " + id);
    }
    log.debug("mosaic.results op=open handle={} dir={}", id, dir);
    return new ResultHandle(id);
  }

  /**
   * Up to {@code max} further rows. An empty list means the result is exhausted; the handle is closed then.
   *
   * @throws FileSystemException {@code UNKNOWN_HANDLE} for a closed or never-issued handle
   */
  public List<Row> more(ResultHandle handle, int max) {
    if (max <= 0) throw new IllegalArgumentException("max must be > 0");
    OpenResult r = open.get(handle.id());
    if (r == null) throw FileSystemException.unknownHandle(handle.id());
    List<Row> rows = r.cursor().next(max);
    if (rows.isEmpty()) close(handle);
    return rows;
  }

  public void close(ResultHandle handle) {
    OpenResult r = open.remove(handle.id());
    if (r == null) return;
    r.cursor().close();
    log.debug("mosaic.results op=close handle={}", handle.id());
  }

  /** Directory the query behind {@code handle} was issued against. */
  public Optional<DirPath> dir(ResultHandle handle) {
    return Optional.ofNullable(open.get(handle.id())).map(OpenResult::dir);
  }

  public int size() {
    return open.size();
  }

  public void closeAll() {
    RuntimeException first = null;
    for (Long id : new ArrayList<>(open.keySet())) {
      try {
        close(new ResultHandle(id));
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
