package io.intellixity.mosaic.memory;

import io.intellixity.mosaic.fs.FileSystemException;
import io.intellixity.mosaic.fs.FsError;
import io.intellixity.mosaic.fs.Node;
import io.intellixity.mosaic.fs.Row;
import io.intellixity.mosaic.fs.RowCursor;
import io.intellixity.mosaic.fs.WriteResult;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.path.Path;
import io.intellixity.mosaic.spi.FileSystemBackend;

import java.util.*;

/**
 * Backend keeping files as row lists in memory.
 * <p>
 * Directories are implied by the files below them; a directory with no files does not exist (except the root).
 * All operations are serialized on the instance, which gives read-your-writes within one connection.
 */
public final class InMemoryBackend implements FileSystemBackend {
  private final TreeMap<FilePath, List<Row>> files = new TreeMap<>();
  private boolean closed;

  /** Seed a file; returns {@code this} for chaining. */
  public InMemoryBackend put(FilePath file, List<Row> rows) {
    write(file, rows);
    return this;
  }

  /** Snapshot of every file path currently stored. */
  public synchronized Set<FilePath> files() {
    return new TreeSet<>(files.keySet());
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  @Override
  public synchronized RowCursor read(FilePath file) {
    ensureOpen();
    List<Row> rows = files.get(file);
    if (rows == null) throw FileSystemException.pathNotFound(file);
    return RowCursor.of(rows);
  }

  @Override
  public synchronized WriteResult write(FilePath file, List<Row> rows) {
    ensureOpen();
    List<Row> accepted = new ArrayList<>();
    List<FileSystemException> errors = accept(file, rows, accepted);
    files.put(file, accepted);
    return new WriteResult(accepted.size(), errors);
  }

  @Override
  public synchronized WriteResult append(FilePath file, List<Row> rows) {
    ensureOpen();
    List<Row> accepted = new ArrayList<>();
    List<FileSystemException> errors = accept(file, rows, accepted);
    files.computeIfAbsent(file, __ -> new ArrayList<>()).addAll(accepted);
    return new WriteResult(accepted.size(), errors);
  }

  @Override
  public synchronized void delete(Path path) {
    ensureOpen();
    if (path instanceof FilePath f) {
      if (files.remove(f) == null) throw FileSystemException.pathNotFound(f);
      return;
    }
    DirPath dir = (DirPath) path;
    List<FilePath> doomed = filesUnder(dir);
    if (doomed.isEmpty() && !dir.isRoot()) throw FileSystemException.pathNotFound(dir);
    for (FilePath f : doomed) files.remove(f);
  }

  @Override
  public synchronized Set<Node> list(DirPath dir) {
    ensureOpen();
    Map<String, Node> out = new TreeMap<>();
    for (FilePath f : files.keySet()) {
      if (!dir.strictlyContains(f)) continue;
      if (f.dir().equals(dir)) {
        out.put(f.name(), Node.file(f.name()));
      } else {
        String child = f.segments().get(dir.depth());
        out.putIfAbsent(child, Node.dir(child));
      }
    }
    if (out.isEmpty() && !dir.isRoot()) throw FileSystemException.pathNotFound(dir);
    return new LinkedHashSet<>(out.values());
  }

  @Override
  public synchronized void move(Path src, Path dst) {
    ensureOpen();
    if (src.isFile() != dst.isFile()) throw FileSystemException.pathTypeMismatch(dst, src.isFile() ? "file" : "directory");
    if (src instanceof FilePath f) {
      List<Row> rows = files.remove(f);
      if (rows == null) throw FileSystemException.pathNotFound(f);
      files.put((FilePath) dst, rows);
      return;
    }
    DirPath from = (DirPath) src;
    DirPath to = (DirPath) dst;
    if (from.contains(to)) throw new IllegalArgumentException("Cannot move " + from + " into itself: " + to);
    List<FilePath> moving = filesUnder(from);
    if (moving.isEmpty()) throw FileSystemException.pathNotFound(from);
    for (FilePath f : moving) {
      files.put(f.relativeTo(from).under(to), files.remove(f));
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
  }

  private List<FilePath> filesUnder(DirPath dir) {
    List<FilePath> out = new ArrayList<>();
    for (FilePath f : files.keySet()) {
      if (dir.contains(f)) out.add(f);
    }
    return out;
  }

  private static List<FileSystemException> accept(FilePath file, List<Row> rows, List<Row> accepted) {
    Objects.requireNonNull(rows, "rows");
    List<FileSystemException> errors = new ArrayList<>();
    for (int i = 0; i < rows.size(); i++) {
      Row r = rows.get(i);
      if (r == null) {
        errors.add(new FileSystemException(FsError.BACKEND_ERROR, "Null record at index " + i + " for " + file, file));
      } else {
        accepted.add(r);
      }
    }
    return errors;
  }

  private void ensureOpen() {
    if (closed) throw new IllegalStateException("In-memory backend is closed");
  }
}
