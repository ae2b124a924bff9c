package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.fs.*;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.path.Path;
import io.intellixity.mosaic.query.QueryCompileException;
import io.intellixity.mosaic.query.QueryCompiler;
import io.intellixity.mosaic.query.QueryPlan;
import io.intellixity.mosaic.query.Variables;
import io.intellixity.mosaic.spi.FileSystemBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link FileSystem} over one immutable {@link MountTable}.
 * <p>
 * Every operation resolves its path to the deepest enclosing mount, strips the mount prefix, and delegates;
 * paths in backend failures are re-anchored into the global namespace on the way out. A query runs natively on a
 * backend when all of its sources live in that one backend, otherwise it is executed here, reading each source
 * through this evaluator.
 * <p>
 * An evaluator never changes; a mount change produces a new one.
 */
public final class Evaluator implements FileSystem {
  private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

  private final MountTable table;
  private final QueryCompiler compiler;
  private final ViewOverlay views;

  public Evaluator(MountTable table, QueryCompiler compiler) {
    this.table = Objects.requireNonNull(table, "table");
    this.compiler = Objects.requireNonNull(compiler, "compiler");
    this.views = new ViewOverlay(compiler);
  }

  public MountTable table() {
    return table;
  }

  @Override
  public RowCursor read(FilePath file, Variables vars) {
    Objects.requireNonNull(vars, "vars");
    return read(file, vars, ViewStack.EMPTY);
  }

  RowCursor read(FilePath file, Variables vars, ViewStack stack) {
    MountEntry e = resolve(file);
    if (e.isView()) return views.read(e, vars, stack, this);
    FilePath rel = file.relativeTo(e.dir());
    return new LeasedCursor(e, onBackend(e, b -> b.read(rel)));
  }

  @Override
  public WriteResult write(FilePath file, List<Row> rows) {
    Objects.requireNonNull(rows, "rows");
    MountEntry e = writable(file);
    FilePath rel = file.relativeTo(e.dir());
    DirPath m = e.dir();
    return onBackend(e, b -> b.write(rel, rows)).mapErrors(x -> x.relocateUnder(m));
  }

  @Override
  public WriteResult append(FilePath file, List<Row> rows) {
    Objects.requireNonNull(rows, "rows");
    MountEntry e = writable(file);
    FilePath rel = file.relativeTo(e.dir());
    DirPath m = e.dir();
    return onBackend(e, b -> b.append(rel, rows)).mapErrors(x -> x.relocateUnder(m));
  }

  @Override
  public void delete(Path path) {
    MountEntry e = writable(path);
    if (path instanceof DirPath dir) {
      List<MountEntry> nested = table.mountsBelow(dir);
      if (!nested.isEmpty()) throw FileSystemException.crossMount(path, nested.get(0).path());
    }
    Path rel = path.relativeTo(e.dir());
    onBackend(e, b -> {
      b.delete(rel);
      return null;
    });
    log.debug("mosaic.eval op=delete path={} mount={}", path, e.path());
  }

  @Override
  public Set<Node> list(Path path) {
    if (path instanceof FilePath file) return listFile(file);
    DirPath dir = (DirPath) path;
    Map<String, Node> mounted = HierarchicalMerge.mountNodes(table, dir);
    Optional<MountEntry> owner = table.deepestEnclosingMount(dir);
    if (owner.isEmpty()) {
      if (mounted.isEmpty() && !dir.isRoot()) throw FileSystemException.pathNotFound(dir);
      return HierarchicalMerge.merge(Set.of(), mounted);
    }

    MountEntry e = owner.get();
    DirPath rel = dir.relativeTo(e.dir());
    Set<Node> nativeNodes;
    try {
      nativeNodes = onBackend(e, b -> b.list(rel));
    } catch (FileSystemException x) {
      // a directory that exists only because something is mounted below it
      if (!x.is(FsError.PATH_NOT_FOUND) || mounted.isEmpty()) throw x;
      nativeNodes = Set.of();
    }
    return HierarchicalMerge.merge(nativeNodes, mounted);
  }

  private Set<Node> listFile(FilePath file) {
    MountEntry e = resolve(file);
    if (e.isView()) return views.list(e);
    FilePath rel = file.relativeTo(e.dir());
    Set<Node> siblings = onBackend(e, b -> b.list(rel.dir()));
    for (Node n : siblings) {
      if (n.name().equals(file.name()) && !n.isDirectory()) return Set.of(n);
    }
    throw FileSystemException.pathNotFound(file);
  }

  @Override
  public void move(Path src, Path dst) {
    Objects.requireNonNull(src, "src");
    Objects.requireNonNull(dst, "dst");
    if (src.isFile() != dst.isFile()) throw FileSystemException.pathTypeMismatch(dst, src.isFile() ? "file" : "directory");
    MountEntry s = writable(src);
    MountEntry d = writable(dst);
    if (!s.path().equals(d.path())) throw FileSystemException.crossMount(src, dst);
    for (Path p : List.of(src, dst)) {
      if (p instanceof DirPath dir && !table.mountsBelow(dir).isEmpty()) throw FileSystemException.crossMount(src, dst);
    }
    Path relSrc = src.relativeTo(s.dir());
    Path relDst = dst.relativeTo(s.dir());
    onBackend(s, b -> {
      b.move(relSrc, relDst);
      return null;
    });
    log.debug("mosaic.eval op=move src={} dst={} mount={}", src, dst, s.path());
  }

  @Override
  public RowCursor query(DirPath dir, String query, Variables vars) {
    Objects.requireNonNull(dir, "dir");
    Objects.requireNonNull(vars, "vars");
    QueryPlan plan;
    try {
      plan = compiler.compile(query, dir);
    } catch (QueryCompileException e) {
      throw FileSystemException.queryError(dir, e);
    }
    if (plan == null) throw new IllegalStateException("QueryCompiler returned null plan for " + dir);
    return run(dir, plan, vars, ViewStack.EMPTY);
  }

  @Override
  public boolean exists(Path path) {
    if (path instanceof DirPath d && d.isRoot()) return true;
    try {
      list(path);
      return true;
    } catch (FileSystemException e) {
      if (e.is(FsError.PATH_NOT_FOUND)) return false;
      throw e;
    }
  }

  /**
   * Run {@code plan}, natively on a backend if every source lives in that backend. {@code at} is the directory
   * or view the plan was compiled for; plan failures in the core are reported against it.
   */
  RowCursor run(Path at, QueryPlan plan, Variables vars, ViewStack stack) {
    MountEntry single = null;
    boolean oneBackend = !plan.sources().isEmpty();
    for (FilePath source : plan.sources()) {
      MountEntry e = resolve(source);
      if (e.isView() || (single != null && !single.path().equals(e.path()))) oneBackend = false;
      single = e;
    }

    if (oneBackend) {
      MountEntry owner = single;
      DirPath m = owner.dir();
      QueryPlan local = plan.relocate(f -> f.relativeTo(m));
      if (log.isDebugEnabled()) log.debug("mosaic.eval op=query route=native mount={} sources={}", m, plan.sources());
      return new LeasedCursor(owner, onBackend(owner, b -> b.query(local, vars)));
    }
    if (log.isDebugEnabled()) log.debug("mosaic.eval op=query route=core sources={}", plan.sources());
    RowCursor rows = inQuery(at, () -> plan.execute(vars, f -> read(f, vars, stack)));
    if (rows == null) throw new IllegalStateException("QueryPlan returned null cursor for " + at);
    return new QueryCursor(at, rows);
  }

  /** Plan failures other than namespace failures become {@code QUERY_ERROR} at {@code at}. */
  private static <T> T inQuery(Path at, Supplier<T> op) {
    try {
      return op.get();
    } catch (FileSystemException x) {
      throw x;
    } catch (RuntimeException x) {
      throw FileSystemException.queryError(at, x);
    }
  }

  private MountEntry resolve(Path p) {
    Objects.requireNonNull(p, "path");
    return table.deepestEnclosingMount(p).orElseThrow(() -> FileSystemException.pathNotFound(p));
  }

  private MountEntry writable(Path p) {
    MountEntry e = resolve(p);
    if (e.isView()) throw FileSystemException.readOnlyMount(p);
    return e;
  }

  private static <T> T onBackend(MountEntry e, Function<FileSystemBackend, T> op) {
    DirPath m = e.dir();
    return e.live().call(b -> {
      try {
        return op.apply(b);
      } catch (FileSystemException x) {
        throw x.relocateUnder(m);
      } catch (QueryCompileException x) {
        throw FileSystemException.queryError(m, m, x);
      } catch (RuntimeException x) {
        throw FileSystemException.backendError(m, x);
      }
    });
  }

  /** Cursor of a plan executed in the core; pulls may still evaluate the plan lazily. */
  private static final class QueryCursor implements RowCursor {
    private final Path at;
    private final RowCursor delegate;

    QueryCursor(Path at, RowCursor delegate) {
      this.at = at;
      this.delegate = delegate;
    }

    @Override
    public List<Row> next(int max) {
      if (max <= 0) throw new IllegalArgumentException("max must be > 0");
      return inQuery(at, () -> delegate.next(max));
    }

    @Override
    public void close() {
      delegate.close();
    }
  }

  /** Backend cursor whose every pull holds a lease on the owning connection. */
  private static final class LeasedCursor implements RowCursor {
    private final MountEntry owner;
    private final RowCursor delegate;
    private volatile boolean closed;

    LeasedCursor(MountEntry owner, RowCursor delegate) {
      this.owner = owner;
      this.delegate = Objects.requireNonNull(delegate, "backend returned null cursor");
    }

    @Override
    public List<Row> next(int max) {
      if (max <= 0) throw new IllegalArgumentException("max must be > 0");
      if (closed) return List.of();
      return onBackend(owner, b -> delegate.next(max));
    }

    @Override
    public void close() {
      if (closed) return;
      closed = true;
      try {
        onBackend(owner, b -> {
          delegate.close();
          return null;
        });
      } catch (FileSystemException e) {
        // once unmounted, the released connection took the cursor with it
        if (!e.is(FsError.BACKEND_UNAVAILABLE)) throw e;
      }
    }
  }
}
