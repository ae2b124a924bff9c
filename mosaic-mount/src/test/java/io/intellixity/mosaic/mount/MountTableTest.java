package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.config.BackendConfig;
import io.intellixity.mosaic.config.ViewConfig;
import io.intellixity.mosaic.fs.FileSystemException;
import io.intellixity.mosaic.fs.FsError;
import io.intellixity.mosaic.memory.InMemoryBackend;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.path.Path;
import io.intellixity.mosaic.query.Variables;
import io.intellixity.mosaic.spi.BackendConnection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MountTableTest {

  private static MountEntry backend(String dir) {
    DirPath d = DirPath.parse(dir);
    return MountEntry.backend(d, new BackendConfig("memory"), new LiveHandle(d, BackendConnection.of(new InMemoryBackend())));
  }

  private static MountEntry view(String file) {
    return MountEntry.view(FilePath.parse(file), new ViewConfig("select * from /data/zips.json", Variables.EMPTY));
  }

  private static MountTable table(MountEntry... es) {
    MountTable t = MountTable.empty();
    for (MountEntry e : es) t = t.insert(e);
    return t;
  }

  @Test
  void deepestEnclosingMount_picksLongestPrefix() {
    MountTable t = table(backend("/data/"), backend("/data/archive/"), backend("/"));

    assertEquals(Path.parse("/data/archive/"), t.deepestEnclosingMount(Path.parse("/data/archive/2019/x.json")).orElseThrow().path());
    assertEquals(Path.parse("/data/"), t.deepestEnclosingMount(Path.parse("/data/archived.json")).orElseThrow().path());
    assertEquals(Path.parse("/data/"), t.deepestEnclosingMount(Path.parse("/data/")).orElseThrow().path());
    assertEquals(Path.parse("/"), t.deepestEnclosingMount(Path.parse("/other/")).orElseThrow().path());
  }

  @Test
  void deepestEnclosingMount_viewMatchesOnlyItsOwnPath() {
    MountTable t = table(backend("/data/"), view("/data/big.json"));

    assertTrue(t.deepestEnclosingMount(Path.parse("/data/big.json")).orElseThrow().isView());
    assertTrue(t.deepestEnclosingMount(Path.parse("/data/big.json2")).orElseThrow().isBackend());
  }

  @Test
  void deepestEnclosingMount_noCover_isEmpty() {
    MountTable t = table(backend("/data/"));
    assertTrue(t.deepestEnclosingMount(Path.parse("/dat/x")).isEmpty());
    assertTrue(MountTable.empty().deepestEnclosingMount(DirPath.ROOT).isEmpty());
  }

  @Test
  void insert_existingPath_leavesTableUntouched() {
    MountTable t = table(backend("/data/"));

    FileSystemException e = assertThrows(FileSystemException.class, () -> t.insert(backend("/data/")));

    assertEquals(FsError.MOUNT_EXISTS, e.error());
    assertEquals(1, t.size());
    assertEquals(1, t.version());
  }

  @Test
  void insertThenRemove_equalsOriginal() {
    MountTable before = table(backend("/data/"));
    MountTable after = before.insert(backend("/logs/")).remove(Path.parse("/logs/"));

    assertEquals(before, after);
    assertEquals(before.hashCode(), after.hashCode());
    assertEquals(3, after.version());
    assertThrows(FileSystemException.class, () -> before.remove(Path.parse("/logs/")));
  }

  @Test
  void mountsBelow_isStrictAndOrdered() {
    MountTable t = table(backend("/data/"), backend("/data/b/"), view("/data/a.json"), backend("/database/"));

    List<Path> below = t.mountsBelow(DirPath.parse("/data/")).stream().map(MountEntry::path).toList();

    assertEquals(List.of(Path.parse("/data/a.json"), Path.parse("/data/b/")), below);
  }

  @Test
  void childMounts_keepsShallowestPerBranch() {
    MountTable t = table(backend("/data/x/y/"), backend("/data/x/"), backend("/data/z/deep/"), view("/data/v.json"));

    List<Path> children = t.childMounts(DirPath.parse("/data/")).stream().map(MountEntry::path).toList();

    assertEquals(List.of(Path.parse("/data/v.json"), Path.parse("/data/x/"), Path.parse("/data/z/deep/")), children);
  }

  @Test
  void entry_rejectsMismatchedPathKinds() {
    assertThrows(IllegalArgumentException.class,
        () -> new MountEntry(DirPath.parse("/v/"), new ViewConfig("select * from x", Variables.EMPTY), null));
    assertThrows(IllegalArgumentException.class,
        () -> new MountEntry(FilePath.parse("/b"), new BackendConfig("memory"), null));
  }
}
