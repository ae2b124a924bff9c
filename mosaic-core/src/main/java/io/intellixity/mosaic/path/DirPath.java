package io.intellixity.mosaic.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Absolute directory path. */
public record DirPath(List<String> segments) implements Path {
  public static final DirPath ROOT = new DirPath(List.of());

  public DirPath {
    Objects.requireNonNull(segments, "segments");
    for (String s : segments) Path.checkSegment(s);
    segments = List.copyOf(segments);
  }

  public static DirPath of(String... segments) {
    return new DirPath(List.of(segments));
  }

  /** Parse {@code /a/b/}; the trailing slash is optional. */
  public static DirPath parse(String s) {
    return new DirPath(Path.split(s));
  }

  public boolean isRoot() {
    return segments.isEmpty();
  }

  public DirPath dir(String name) {
    List<String> out = new ArrayList<>(segments.size() + 1);
    out.addAll(segments);
    out.add(Path.checkSegment(name));
    return new DirPath(out);
  }

  public FilePath file(String name) {
    return new FilePath(this, name);
  }

  /** Enclosing directory, empty for the root. */
  public Optional<DirPath> parent() {
    if (isRoot()) return Optional.empty();
    return Optional.of(new DirPath(segments.subList(0, segments.size() - 1)));
  }

  @Override
  public DirPath parentDir() {
    return parent().orElse(ROOT);
  }

  @Override
  public String name() {
    return isRoot() ? "" : segments.get(segments.size() - 1);
  }

  /** True if {@code p} is this directory or lies anywhere below it. */
  public boolean contains(Path p) {
    List<String> other = p.segments();
    if (other.size() < segments.size()) return false;
    return other.subList(0, segments.size()).equals(segments);
  }

  /** True if {@code p} lies below this directory and is not this directory itself. */
  public boolean strictlyContains(Path p) {
    return contains(p) && !equals(p);
  }

  @Override
  public DirPath relativeTo(DirPath base) {
    if (!base.contains(this)) throw new IllegalArgumentException(this + " is not under " + base);
    return new DirPath(segments.subList(base.segments.size(), segments.size()));
  }

  @Override
  public DirPath under(DirPath base) {
    List<String> out = new ArrayList<>(base.segments.size() + segments.size());
    out.addAll(base.segments);
    out.addAll(segments);
    return new DirPath(out);
  }

  @Override
  public String toString() {
    if (isRoot()) return "/";
    return "/" + String.join("/", segments) + "/";
  }
}
