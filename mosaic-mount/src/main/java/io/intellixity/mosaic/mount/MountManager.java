package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.config.BackendConfig;
import io.intellixity.mosaic.config.InMemoryMountConfigStore;
import io.intellixity.mosaic.config.MountConfig;
import io.intellixity.mosaic.config.MountConfigStore;
import io.intellixity.mosaic.config.ViewConfig;
import io.intellixity.mosaic.fs.*;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.path.Path;
import io.intellixity.mosaic.query.QueryCompiler;
import io.intellixity.mosaic.query.Variables;
import io.intellixity.mosaic.spi.BackendConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the mount table and serializes changes to it.
 * <p>
 * Readers never block: they take the current {@link Snapshot} and work against it. Writers run one at a time;
 * each change validates, opens whatever the new mount needs, persists to the {@link MountConfigStore} and then
 * publishes a fresh snapshot. A change that fails leaves the published snapshot and the store as they were, and
 * releases anything it opened.
 */
public final class MountManager implements Mounting, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MountManager.class);

  /** A mount table together with the evaluator built for it. */
  public record Snapshot(MountTable table, Evaluator evaluator) {}

  private final BackendRegistry registry;
  private final QueryCompiler compiler;
  private final MountConfigStore store;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicReference<Snapshot> current;
  private final ResultHandleTable results;
  private final FileSystem fileSystem = new CurrentFileSystem();

  public MountManager(BackendRegistry registry, QueryCompiler compiler) {
    this(registry, compiler, new InMemoryMountConfigStore(), MonotonicSequence.randomStart());
  }

  public MountManager(BackendRegistry registry, QueryCompiler compiler, MountConfigStore store, MonotonicSequence ids) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.compiler = Objects.requireNonNull(compiler, "compiler");
    this.store = Objects.requireNonNull(store, "store");
    this.current = new AtomicReference<>(new Snapshot(MountTable.empty(), new Evaluator(MountTable.empty(), compiler)));
    this.results = new ResultHandleTable(() -> fileSystem, ids);
  }

  /**
   * Manager with every mount persisted in {@code store} re-established. Stops at the first mount that fails;
   * whatever was already mounted is released again before the failure propagates.
   */
  public static MountManager start(BackendRegistry registry, QueryCompiler compiler, MountConfigStore store) {
    MountManager m = new MountManager(registry, compiler, store, MonotonicSequence.randomStart());
    Map<Path, MountConfig> persisted = store.load();
    m.lock.lock();
    try {
      for (Map.Entry<Path, MountConfig> e : persisted.entrySet()) m.mountLocked(e.getKey(), e.getValue(), false);
    } catch (RuntimeException e) {
      m.close();
      throw e;
    } finally {
      m.lock.unlock();
    }
    log.info("mosaic.mount started mounts={}", persisted.size());
    return m;
  }

  public Snapshot snapshot() {
    return current.get();
  }

  /** Filesystem view that always evaluates against the latest published snapshot. */
  public FileSystem fileSystem() {
    return fileSystem;
  }

  public ResultHandleTable results() {
    return results;
  }

  public BackendRegistry registry() {
    return registry;
  }

  @Override
  public void mount(Path path, MountConfig config) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(config, "config");
    lock.lock();
    try {
      mountLocked(path, config, true);
    } finally {
      lock.unlock();
    }
  }

  /** Mount each entry in order, stopping at the first failure. Earlier entries stay mounted. */
  public void mountAll(Map<? extends Path, ? extends MountConfig> configs) {
    Objects.requireNonNull(configs, "configs");
    lock.lock();
    try {
      for (Map.Entry<? extends Path, ? extends MountConfig> e : configs.entrySet()) {
        mountLocked(e.getKey(), e.getValue(), true);
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public UnmountResult unmount(Path path) {
    Objects.requireNonNull(path, "path");
    lock.lock();
    try {
      return unmountLocked(path, true);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void remount(Path from, Path to) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    lock.lock();
    try {
      MountTable t = current.get().table();
      MountConfig config = t.get(from).map(MountEntry::config).orElseThrow(() -> FileSystemException.mountNotFound(from));
      if (from.equals(to)) return;
      if (t.get(to).isPresent()) throw FileSystemException.mountExists(to);
      checkPathType(to, config);

      unmountLocked(from, true);
      try {
        mountLocked(to, config, true);
      } catch (RuntimeException e) {
        try {
          mountLocked(from, config, true);
        } catch (RuntimeException restore) {
          e.addSuppressed(restore);
        }
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<MountConfig> lookupMountConfig(Path path) {
    return current.get().table().get(path).map(MountEntry::config);
  }

  @Override
  public Map<Path, MountConfig> mounts() {
    return current.get().table().configs();
  }

  /**
   * Close open results and release every backend. The store is left untouched so the mounts come back on the
   * next {@link #start}.
   */
  @Override
  public void close() {
    lock.lock();
    try {
      results.closeAll();
    } finally {
      try {
        releaseAll();
      } finally {
        lock.unlock();
      }
    }
  }

  private void releaseAll() {
    List<MountEntry> entries = new ArrayList<>(current.get().table().entries());
    Collections.reverse(entries);
    for (MountEntry e : entries) {
      UnmountResult r = unmountLocked(e.path(), false);
      for (String w : r.warnings()) log.warn("mosaic.mount close path={} warning={}", e.path(), w);
    }
  }

  private void mountLocked(Path path, MountConfig config, boolean persist) {
    Snapshot s = current.get();
    if (s.table().get(path).isPresent()) throw FileSystemException.mountExists(path);
    checkPathType(path, config);

    MountEntry entry = open(path, config);
    try {
      MountTable next = s.table().insert(entry);
      if (persist) store.save(path, config);
      publish(next);
    } catch (RuntimeException e) {
      if (entry.live() != null) entry.live().retire().ifPresent(w -> log.warn("mosaic.mount rollback path={} warning={}", path, w));
      throw e;
    }
    log.info("mosaic.mount op=mount path={} type={} version={}", path, config.typeName(), current.get().table().version());
  }

  private UnmountResult unmountLocked(Path path, boolean persist) {
    Snapshot s = current.get();
    MountEntry e = s.table().get(path).orElseThrow(() -> FileSystemException.mountNotFound(path));
    MountTable next = s.table().remove(path);
    if (persist) store.delete(path);

    List<String> warnings = new ArrayList<>();
    if (e.live() != null) e.live().retire().ifPresent(warnings::add);
    publish(next);
    log.info("mosaic.mount op=unmount path={} type={} version={}", path, e.config().typeName(), next.version());
    return new UnmountResult(path, e.config(), warnings);
  }

  private MountEntry open(Path path, MountConfig config) {
    if (config instanceof ViewConfig v) {
      FilePath at = (FilePath) path;
      new ViewOverlay(compiler).compile(at, v);
      return MountEntry.view(at, v);
    }
    BackendConfig b = (BackendConfig) config;
    DirPath at = (DirPath) path;
    BackendConnection c = registry.open(b);
    return MountEntry.backend(at, b, new LiveHandle(at, c));
  }

  private static void checkPathType(Path path, MountConfig config) {
    if (config instanceof ViewConfig && !path.isFile()) throw FileSystemException.pathTypeMismatch(path, "file");
    if (config instanceof BackendConfig && !path.isDirectory()) throw FileSystemException.pathTypeMismatch(path, "directory");
  }

  private void publish(MountTable table) {
    current.set(new Snapshot(table, new Evaluator(table, compiler)));
  }

  private final class CurrentFileSystem implements FileSystem {
    private Evaluator eval() {
      return current.get().evaluator();
    }

    @Override
    public RowCursor read(FilePath file, Variables vars) {
      return eval().read(file, vars);
    }

    @Override
    public WriteResult write(FilePath file, List<Row> rows) {
      return eval().write(file, rows);
    }

    @Override
    public WriteResult append(FilePath file, List<Row> rows) {
      return eval().append(file, rows);
    }

    @Override
    public void delete(Path path) {
      eval().delete(path);
    }

    @Override
    public Set<Node> list(Path path) {
      return eval().list(path);
    }

    @Override
    public void move(Path src, Path dst) {
      eval().move(src, dst);
    }

    @Override
    public RowCursor query(DirPath dir, String query, Variables vars) {
      return eval().query(dir, query, vars);
    }

    @Override
    public boolean exists(Path path) {
      return eval().exists(path);
    }
  }
}
