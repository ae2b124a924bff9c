package io.intellixity.mosaic.mongo;

import io.intellixity.mosaic.fs.FileSystemException;
import io.intellixity.mosaic.fs.Node;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;

import java.util.*;

/**
 * Maps backend paths onto MongoDB databases and collections.
 * <p>
 * Unpinned, the first segment names the database: {@code /db/a/b} is collection {@code a.b} in {@code db}.
 * Pinned to a database, every segment belongs to the collection name: {@code /a/b} is {@code a.b}.
 * Directories are dotted collection name prefixes. Within a segment {@code .} and {@code \} are escaped with a
 * backslash, so {@code /census/zips.json} is collection {@code zips\.json} and lists back as the file it was.
 */
public final class MongoPaths {
  /** Databases the server manages for itself; never listed nor dropped. */
  static final Set<String> SYSTEM_DATABASES = Set.of("admin", "local", "config");

  /** A collection a file maps to. */
  public record CollectionRef(String database, String name) {}

  /**
   * A directory: every collection in {@code database} whose name starts with {@code prefix}.
   * {@code database} is null for the root of an unpinned mount, which lists databases.
   */
  public record Prefix(String database, String prefix) {
    public boolean isServerRoot() {
      return database == null;
    }

    public boolean matches(String collection) {
      return collection.startsWith(prefix);
    }
  }

  private final String database;

  /** @param database database to pin the mount to, or null */
  public MongoPaths(String database) {
    this.database = (database == null || database.isBlank()) ? null : database.trim();
  }

  public Optional<String> database() {
    return Optional.ofNullable(database);
  }

  public CollectionRef collection(FilePath file) {
    List<String> segs = file.segments();
    if (database != null) return new CollectionRef(database, joined(segs));
    if (segs.size() < 2) throw FileSystemException.pathNotFound(file);
    return new CollectionRef(segs.get(0), joined(segs.subList(1, segs.size())));
  }

  public Prefix prefix(DirPath dir) {
    List<String> segs = dir.segments();
    if (database != null) return new Prefix(database, dotted(segs));
    if (segs.isEmpty()) return new Prefix(null, "");
    return new Prefix(segs.get(0), dotted(segs.subList(1, segs.size())));
  }

  /** Directory entries one level below {@code p}, given the collection names of its database. */
  public Set<Node> children(Prefix p, Iterable<String> collections) {
    Map<String, Node> out = new TreeMap<>();
    for (String c : collections) {
      if (c.startsWith("system.") || !p.matches(c)) continue;
      String rest = c.substring(p.prefix().length());
      if (rest.isEmpty()) continue;
      int dot = separator(rest);
      if (dot < 0) {
        String name = unescape(rest);
        out.put(name, Node.file(name));
      } else {
        String name = unescape(rest.substring(0, dot));
        out.putIfAbsent(name, Node.dir(name));
      }
    }
    return new LinkedHashSet<>(out.values());
  }

  private static String joined(List<String> segs) {
    StringBuilder sb = new StringBuilder();
    for (String seg : segs) {
      if (sb.length() > 0) sb.append('.');
      sb.append(escape(seg));
    }
    return sb.toString();
  }

  private static String dotted(List<String> segs) {
    return segs.isEmpty() ? "" : joined(segs) + ".";
  }

  static String escape(String segment) {
    return segment.replace("\\", "\\\\").replace(".", "\\.");
  }

  static String unescape(String segment) {
    StringBuilder sb = new StringBuilder(segment.length());
    for (int i = 0; i < segment.length(); i++) {
      char ch = segment.charAt(i);
      if (ch == '\\' && i + 1 < segment.length()) ch = segment.charAt(++i);
      sb.append(ch);
    }
    return sb.toString();
  }

  /** Index of the first unescaped {@code .}, or -1. */
  private static int separator(String name) {
    for (int i = 0; i < name.length(); i++) {
      char ch = name.charAt(i);
      if (ch == '\\') i++;
      else if (ch == '.') return i;
    }
    return -1;
  }
}
