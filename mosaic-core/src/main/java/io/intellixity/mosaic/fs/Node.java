package io.intellixity.mosaic.fs;

import io.intellixity.mosaic.path.Path;

import java.util.Objects;

/**
 * One entry of a directory listing.
 * <p>
 * {@code mountType} is non-null only for synthetic entries standing for a mount point (a view or a nested backend),
 * so callers can tell "a real file or directory" from "a mount point".
 *
 * @param name entry name, without any separator
 * @param kind file or directory
 * @param mountType {@code "view"} or the backend kind for mount points, otherwise null
 */
public record Node(String name, Kind kind, String mountType) {
  public enum Kind { FILE, DIRECTORY }

  public Node {
    Path.checkSegment(name);
    Objects.requireNonNull(kind, "kind");
  }

  public static Node file(String name) {
    return new Node(name, Kind.FILE, null);
  }

  public static Node dir(String name) {
    return new Node(name, Kind.DIRECTORY, null);
  }

  public static Node mount(String name, Kind kind, String mountType) {
    Objects.requireNonNull(mountType, "mountType");
    return new Node(name, kind, mountType);
  }

  public boolean isMount() {
    return mountType != null;
  }

  public boolean isDirectory() {
    return kind == Kind.DIRECTORY;
  }

  /** Listing form: {@code name/} for directories, {@code name@ (type)} for mount points. */
  public String display() {
    if (isMount()) return name + "@ (" + mountType + ")";
    return isDirectory() ? name + "/" : name;
  }
}
