package io.intellixity.mosaic.path;

import java.util.List;

/**
 * Absolute path in the mosaic namespace.
 * <p>
 * A path is statically either a {@link DirPath} or a {@link FilePath}; the two never share a representation.
 * Printing is POSIX style: directories end with {@code /}, files do not.
 */
public sealed interface Path extends Comparable<Path> permits DirPath, FilePath {

  /** All segments from the root, including the file name for files. */
  List<String> segments();

  /** Last segment, or the empty string for the root directory. */
  String name();

  /** Number of segments. */
  default int depth() {
    return segments().size();
  }

  /** The directory that directly contains this path; the root contains itself. */
  DirPath parentDir();

  /** Strip {@code base} off the front, producing the root-anchored path a mounted backend sees. */
  Path relativeTo(DirPath base);

  /** Re-anchor a root-anchored path under {@code base}; inverse of {@link #relativeTo(DirPath)}. */
  Path under(DirPath base);

  /** True if this path is {@code dir} or lies below it. */
  default boolean startsWith(DirPath dir) {
    return dir.contains(this);
  }

  default boolean isDirectory() {
    return this instanceof DirPath;
  }

  default boolean isFile() {
    return this instanceof FilePath;
  }

  @Override
  default int compareTo(Path o) {
    return toString().compareTo(o.toString());
  }

  /**
   * Parse a POSIX-style absolute path. A trailing {@code /} denotes a directory.
   *
   * @throws IllegalArgumentException if the path is not absolute or contains empty, {@code .} or {@code ..} segments
   */
  static Path parse(String s) {
    if (s == null) throw new IllegalArgumentException("path is required");
    return s.endsWith("/") ? DirPath.parse(s) : FilePath.parse(s);
  }

  static List<String> split(String s) {
    if (s == null || !s.startsWith("/")) throw new IllegalArgumentException("path must be absolute: " + s);
    String body = s.substring(1);
    if (body.endsWith("/")) body = body.substring(0, body.length() - 1);
    if (body.isEmpty()) return List.of();
    String[] parts = body.split("/", -1);
    for (String p : parts) checkSegment(p);
    return List.of(parts);
  }

  static String checkSegment(String segment) {
    if (segment == null || segment.isEmpty()) throw new IllegalArgumentException("empty path segment");
    if (segment.equals(".") || segment.equals("..")) throw new IllegalArgumentException("relative segment not allowed: " + segment);
    if (segment.indexOf('/') >= 0) throw new IllegalArgumentException("segment contains '/': " + segment);
    return segment;
  }
}
