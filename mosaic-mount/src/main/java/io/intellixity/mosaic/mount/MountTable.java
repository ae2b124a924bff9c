package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.config.MountConfig;
import io.intellixity.mosaic.fs.FileSystemException;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.path.Path;

import java.util.*;

/**
 * Immutable, path-ordered set of mounts.
 * <p>
 * {@link #insert(MountEntry)} and {@link #remove(Path)} return a new table with a bumped {@link #version()};
 * a table handed out is never mutated. Nesting a mount below another one is allowed and forms a hierarchical
 * composition; two mounts never share a path.
 * <p>
 * Equality compares the mounted paths and configurations only, not versions or live connections.
 */
public final class MountTable {
  private static final MountTable EMPTY = new MountTable(new TreeMap<>(), 0);

  private final NavigableMap<Path, MountEntry> entries;
  private final long version;

  private MountTable(NavigableMap<Path, MountEntry> entries, long version) {
    this.entries = Collections.unmodifiableNavigableMap(entries);
    this.version = version;
  }

  public static MountTable empty() {
    return EMPTY;
  }

  public long version() {
    return version;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /** Entry mounted at exactly {@code path}. */
  public Optional<MountEntry> get(Path path) {
    return Optional.ofNullable(entries.get(path));
  }

  public Collection<MountEntry> entries() {
    return entries.values();
  }

  public Map<Path, MountConfig> configs() {
    Map<Path, MountConfig> out = new LinkedHashMap<>();
    for (MountEntry e : entries.values()) out.put(e.path(), e.config());
    return Collections.unmodifiableMap(out);
  }

  /** @throws FileSystemException {@code MOUNT_EXISTS} if {@code entry}'s path is taken */
  public MountTable insert(MountEntry entry) {
    Objects.requireNonNull(entry, "entry");
    if (entries.containsKey(entry.path())) throw FileSystemException.mountExists(entry.path());
    TreeMap<Path, MountEntry> next = new TreeMap<>(entries);
    next.put(entry.path(), entry);
    return new MountTable(next, version + 1);
  }

  /** @throws FileSystemException {@code MOUNT_NOT_FOUND} if nothing is mounted at {@code path} */
  public MountTable remove(Path path) {
    Objects.requireNonNull(path, "path");
    if (!entries.containsKey(path)) throw FileSystemException.mountNotFound(path);
    TreeMap<Path, MountEntry> next = new TreeMap<>(entries);
    next.remove(path);
    return new MountTable(next, version + 1);
  }

  /**
   * The most specific mount covering {@code p}: a view mounted at exactly {@code p}, otherwise the backend with
   * the longest directory path that contains {@code p}. Empty if no mount covers it.
   */
  public Optional<MountEntry> deepestEnclosingMount(Path p) {
    Objects.requireNonNull(p, "p");
    if (p instanceof FilePath) {
      MountEntry view = entries.get(p);
      if (view != null) return Optional.of(view);
    }
    Optional<DirPath> d = Optional.of((p instanceof DirPath dir) ? dir : p.parentDir());
    while (d.isPresent()) {
      MountEntry e = entries.get(d.get());
      if (e != null) return Optional.of(e);
      d = d.get().parent();
    }
    return Optional.empty();
  }

  /** Mounts lying strictly below {@code dir}, in path order. */
  public List<MountEntry> mountsBelow(DirPath dir) {
    List<MountEntry> out = new ArrayList<>();
    // paths below dir print with dir's prefix, so they form one contiguous run in path order
    for (MountEntry e : entries.tailMap(dir, false).values()) {
      if (!e.path().startsWith(dir)) break;
      out.add(e);
    }
    return out;
  }

  /**
   * One mount per distinct first segment below {@code dir}: the shallowest mount reached through that segment.
   * A mount directly inside {@code dir} therefore wins over mounts deeper down the same branch.
   */
  public List<MountEntry> childMounts(DirPath dir) {
    Map<String, MountEntry> bySegment = new LinkedHashMap<>();
    for (MountEntry e : mountsBelow(dir)) {
      String first = e.path().segments().get(dir.depth());
      MountEntry prev = bySegment.get(first);
      if (prev == null || e.path().depth() < prev.path().depth()) bySegment.put(first, e);
    }
    return new ArrayList<>(bySegment.values());
  }

  /** {@code p} as the backend mounted at {@code mount} sees it. */
  public static Path relativize(Path p, DirPath mount) {
    return p.relativeTo(mount);
  }

  /** A backend-relative path back in the global namespace. */
  public static Path absolutize(Path p, DirPath mount) {
    return p.under(mount);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MountTable other)) return false;
    return configs().equals(other.configs());
  }

  @Override
  public int hashCode() {
    return configs().hashCode();
  }

  @Override
  public String toString() {
    return "MountTable[version=" + version + ", mounts=" + configs() + "]";
  }
}
