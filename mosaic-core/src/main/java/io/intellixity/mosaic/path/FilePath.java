package io.intellixity.mosaic.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Absolute file path: a directory plus a file name. */
public record FilePath(DirPath dir, String name) implements Path {

  public FilePath {
    Objects.requireNonNull(dir, "dir");
    Path.checkSegment(name);
  }

  /** Parse {@code /a/b.json}. */
  public static FilePath parse(String s) {
    List<String> segs = Path.split(s);
    if (segs.isEmpty() || s.endsWith("/")) throw new IllegalArgumentException("not a file path: " + s);
    return new FilePath(new DirPath(segs.subList(0, segs.size() - 1)), segs.get(segs.size() - 1));
  }

  @Override
  public List<String> segments() {
    List<String> out = new ArrayList<>(dir.segments().size() + 1);
    out.addAll(dir.segments());
    out.add(name);
    return List.copyOf(out);
  }

  @Override
  public DirPath parentDir() {
    return dir;
  }

  public FilePath withName(String newName) {
    return new FilePath(dir, newName);
  }

  @Override
  public FilePath relativeTo(DirPath base) {
    return new FilePath(dir.relativeTo(base), name);
  }

  @Override
  public FilePath under(DirPath base) {
    return new FilePath(dir.under(base), name);
  }

  @Override
  public String toString() {
    return dir + name;
  }
}
