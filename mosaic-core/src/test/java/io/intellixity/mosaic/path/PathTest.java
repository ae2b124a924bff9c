package io.intellixity.mosaic.path;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PathTest {

  @Test
  void parse_trailingSlashDecidesKind() {
    assertEquals(DirPath.of("a", "b"), Path.parse("/a/b/"));
    assertEquals(DirPath.of("a").file("b"), Path.parse("/a/b"));
    assertEquals(DirPath.ROOT, Path.parse("/"));
  }

  @Test
  void print_isPosixStyle() {
    assertEquals("/", DirPath.ROOT.toString());
    assertEquals("/data/", DirPath.of("data").toString());
    assertEquals("/data/zips.json", FilePath.parse("/data/zips.json").toString());
  }

  @Test
  void parse_rejectsRelativeAndEmptySegments() {
    assertThrows(IllegalArgumentException.class, () -> Path.parse("a/b"));
    assertThrows(IllegalArgumentException.class, () -> Path.parse("/a//b"));
    assertThrows(IllegalArgumentException.class, () -> Path.parse("/a/../b"));
    assertThrows(IllegalArgumentException.class, () -> Path.parse(null));
    assertThrows(IllegalArgumentException.class, () -> FilePath.parse("/"));
  }

  @Test
  void relativeTo_andUnder_areInverse() {
    DirPath mount = DirPath.parse("/data/");
    FilePath abs = FilePath.parse("/data/sub/zips.json");

    FilePath rel = abs.relativeTo(mount);
    assertEquals(FilePath.parse("/sub/zips.json"), rel);
    assertEquals(abs, rel.under(mount));
    assertEquals(DirPath.ROOT, mount.relativeTo(mount));
  }

  @Test
  void relativeTo_outsideBase_fails() {
    assertThrows(IllegalArgumentException.class,
        () -> FilePath.parse("/other/x").relativeTo(DirPath.parse("/data/")));
  }

  @Test
  void contains_isSegmentWise() {
    DirPath a = DirPath.parse("/a/");
    assertTrue(a.contains(DirPath.parse("/a/")));
    assertTrue(a.contains(FilePath.parse("/a/b/c")));
    assertFalse(a.contains(DirPath.parse("/ab/")));
    assertFalse(a.strictlyContains(a));
    assertTrue(DirPath.ROOT.contains(a));
  }

  @Test
  void parent_ofRootIsEmpty() {
    assertTrue(DirPath.ROOT.parent().isEmpty());
    assertEquals(DirPath.ROOT, DirPath.ROOT.parentDir());
    assertEquals(DirPath.parse("/a/"), DirPath.parse("/a/b/").parent().orElseThrow());
    assertEquals(DirPath.parse("/a/"), FilePath.parse("/a/f").parentDir());
  }

  @Test
  void segments_includeFileName() {
    assertEquals(List.of("a", "b", "f"), FilePath.parse("/a/b/f").segments());
    assertEquals(3, FilePath.parse("/a/b/f").depth());
    assertEquals("f", FilePath.parse("/a/b/f").name());
    assertEquals("", DirPath.ROOT.name());
  }

  @Test
  void ordering_groupsPathsBelowADirectory() {
    List<Path> sorted = new java.util.TreeSet<Path>(List.of(
        Path.parse("/b/"), Path.parse("/a/x"), Path.parse("/a/"), Path.parse("/a/b/"))).stream().toList();
    assertEquals(List.of(Path.parse("/a/"), Path.parse("/a/b/"), Path.parse("/a/x"), Path.parse("/b/")), sorted);
  }
}
