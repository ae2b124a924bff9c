package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.config.BackendConfig;
import io.intellixity.mosaic.config.ViewConfig;
import io.intellixity.mosaic.fs.*;
import io.intellixity.mosaic.memory.InMemoryBackend;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.path.Path;
import io.intellixity.mosaic.query.QueryCompileException;
import io.intellixity.mosaic.query.QueryPlan;
import io.intellixity.mosaic.query.SourceReader;
import io.intellixity.mosaic.query.Variables;
import io.intellixity.mosaic.spi.BackendConnection;
import io.intellixity.mosaic.spi.FileSystemBackend;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

final class EvaluatorTest {

  private static final DirPath DATA = DirPath.parse("/data/");
  private static final DirPath ARCHIVE = DirPath.parse("/data/archive/");

  /** Memory backend that counts plans pushed down to it. */
  private static final class CountingBackend implements FileSystemBackend {
    final InMemoryBackend delegate = new InMemoryBackend();
    final AtomicInteger queries = new AtomicInteger();

    @Override public RowCursor read(FilePath file) { return delegate.read(file); }
    @Override public WriteResult write(FilePath file, List<Row> rows) { return delegate.write(file, rows); }
    @Override public WriteResult append(FilePath file, List<Row> rows) { return delegate.append(file, rows); }
    @Override public void delete(Path path) { delegate.delete(path); }
    @Override public Set<Node> list(DirPath dir) { return delegate.list(dir); }
    @Override public void move(Path src, Path dst) { delegate.move(src, dst); }
    @Override public void close() { delegate.close(); }

    @Override
    public RowCursor query(QueryPlan plan, Variables vars) {
      queries.incrementAndGet();
      return FileSystemBackend.super.query(plan, vars);
    }
  }

  private final CountingBackend data = new CountingBackend();
  private final CountingBackend archive = new CountingBackend();

  private Evaluator evaluator() {
    MountTable t = MountTable.empty()
        .insert(MountEntry.backend(DATA, new BackendConfig("memory"), new LiveHandle(DATA, BackendConnection.of(data))))
        .insert(MountEntry.backend(ARCHIVE, new BackendConfig("memory"), new LiveHandle(ARCHIVE, BackendConnection.of(archive))));
    return new Evaluator(t, new SelectQueryCompiler());
  }

  private static List<Row> rows(int... ns) {
    return Arrays.stream(ns).mapToObj(n -> Row.of("n", n)).toList();
  }

  @Test
  void list_nestedMountAddsOneEntry() {
    data.delegate.put(FilePath.parse("/a"), List.of()).put(FilePath.parse("/b"), List.of());

    Set<Node> listing = evaluator().list(DATA);

    assertEquals(3, listing.size());
    assertTrue(listing.contains(Node.mount("archive", Node.Kind.DIRECTORY, "memory")));
  }

  @Test
  void list_nestedMountShadowsNativeEntryOfSameName() {
    data.delegate.put(FilePath.parse("/a"), List.of()).put(FilePath.parse("/archive/old"), List.of());

    Set<Node> listing = evaluator().list(DATA);

    assertEquals(Set.of(Node.file("a"), Node.mount("archive", Node.Kind.DIRECTORY, "memory")), listing);
  }

  @Test
  void list_directoriesLeadingToMountsAreSynthesized() {
    Evaluator e = evaluator();

    assertEquals(Set.of(Node.mount("data", Node.Kind.DIRECTORY, "memory")), e.list(DirPath.ROOT));
    assertEquals(Set.of(Node.mount("archive", Node.Kind.DIRECTORY, "memory")), e.list(DATA));
    assertThrows(FileSystemException.class, () -> e.list(DirPath.parse("/nowhere/")));
  }

  @Test
  void list_file_returnsThatFileOnly() {
    data.delegate.put(FilePath.parse("/a"), List.of()).put(FilePath.parse("/b"), List.of());

    assertEquals(Set.of(Node.file("a")), evaluator().list(FilePath.parse("/data/a")));
    assertThrows(FileSystemException.class, () -> evaluator().list(FilePath.parse("/data/c")));
  }

  @Test
  void backendErrors_carryGlobalPaths() {
    FileSystemException e = assertThrows(FileSystemException.class, () -> evaluator().read(FilePath.parse("/data/archive/missing")));

    assertEquals(FsError.PATH_NOT_FOUND, e.error());
    assertEquals(FilePath.parse("/data/archive/missing"), e.path());
    assertEquals(ARCHIVE, e.mount());
  }

  @Test
  void write_routesToDeepestMount_andRelocatesRecordErrors() {
    Evaluator e = evaluator();

    WriteResult r = e.write(FilePath.parse("/data/archive/x"), Arrays.asList(Row.of("n", 1), null));

    assertEquals(1, r.written());
    assertEquals(FilePath.parse("/data/archive/x"), r.errors().get(0).path());
    assertEquals(Set.of(FilePath.parse("/x")), archive.delegate.files());
    assertTrue(data.delegate.files().isEmpty());
  }

  @Test
  void unmountedPath_isNotFound() {
    FileSystemException e = assertThrows(FileSystemException.class,
        () -> evaluator().write(FilePath.parse("/elsewhere/x"), List.of()));
    assertEquals(FsError.PATH_NOT_FOUND, e.error());
  }

  @Test
  void move_acrossMounts_failsWithoutTouchingEither() {
    data.delegate.put(FilePath.parse("/a"), rows(1));

    FileSystemException e = assertThrows(FileSystemException.class,
        () -> evaluator().move(FilePath.parse("/data/a"), FilePath.parse("/data/archive/a")));

    assertEquals(FsError.CROSS_MOUNT_OPERATION, e.error());
    assertEquals(Set.of(FilePath.parse("/a")), data.delegate.files());
    assertTrue(archive.delegate.files().isEmpty());
  }

  @Test
  void move_withinMount() {
    data.delegate.put(FilePath.parse("/a"), rows(1));

    evaluator().move(FilePath.parse("/data/a"), FilePath.parse("/data/sub/b"));

    assertEquals(rows(1), evaluator().read(FilePath.parse("/data/sub/b")).drain());
  }

  @Test
  void move_mixedKinds_isTypeMismatch() {
    FileSystemException e = assertThrows(FileSystemException.class,
        () -> evaluator().move(FilePath.parse("/data/a"), DirPath.parse("/data/b/")));
    assertEquals(FsError.PATH_TYPE_MISMATCH, e.error());
  }

  @Test
  void directoryOps_spanningNestedMount_areCrossMount() {
    data.delegate.put(FilePath.parse("/a"), rows(1));
    Evaluator e = evaluator();

    assertEquals(FsError.CROSS_MOUNT_OPERATION,
        assertThrows(FileSystemException.class, () -> e.delete(DATA)).error());
    assertEquals(FsError.CROSS_MOUNT_OPERATION,
        assertThrows(FileSystemException.class, () -> e.move(DATA, DirPath.parse("/data/x/"))).error());
    assertEquals(Set.of(FilePath.parse("/a")), data.delegate.files());
  }

  @Test
  void query_singleBackend_runsNatively() {
    data.delegate.put(FilePath.parse("/a"), rows(1, 2, 3));

    List<Row> out = evaluator().query(DATA, "select * from a where n >= 2", Variables.EMPTY).drain();

    assertEquals(rows(2, 3), out);
    assertEquals(1, data.queries.get());
  }

  @Test
  void query_acrossBackends_runsInCore() {
    data.delegate.put(FilePath.parse("/a"), rows(1));
    archive.delegate.put(FilePath.parse("/old"), rows(2));

    List<Row> out = evaluator().query(DATA, "select * from a, archive/old", Variables.EMPTY).drain();

    assertEquals(rows(1, 2), out);
    assertEquals(0, data.queries.get());
    assertEquals(0, archive.queries.get());
  }

  @Test
  void query_badText_isQueryError() {
    FileSystemException e = assertThrows(FileSystemException.class,
        () -> evaluator().query(DATA, "delete everything", Variables.EMPTY));
    assertEquals(FsError.QUERY_ERROR, e.error());
  }

  @Test
  void view_unboundVariable_isQueryErrorOnEitherRoute() {
    data.delegate.put(FilePath.parse("/a"), rows(1));
    archive.delegate.put(FilePath.parse("/old"), rows(2));
    FilePath one = FilePath.parse("/v/one.json");
    FilePath two = FilePath.parse("/v/two.json");
    MountTable t = evaluator().table()
        .insert(MountEntry.view(one, new ViewConfig("select * from /data/a where n > :min")))
        .insert(MountEntry.view(two, new ViewConfig("select * from /data/a, /data/archive/old where n > :min")));
    Evaluator e = new Evaluator(t, new SelectQueryCompiler());

    FileSystemException nativeRoute = assertThrows(FileSystemException.class, () -> e.read(one).drain());
    assertEquals(FsError.QUERY_ERROR, nativeRoute.error());
    assertEquals(DATA, nativeRoute.mount());

    FileSystemException coreRoute = assertThrows(FileSystemException.class, () -> e.read(two).drain());
    assertEquals(FsError.QUERY_ERROR, coreRoute.error());
    assertEquals(two, coreRoute.path());
    assertInstanceOf(QueryCompileException.class, coreRoute.getCause());
  }

  @Test
  void coreQuery_failureWhilePulling_isQueryError() {
    Iterator<Row> failing = new Iterator<>() {
      @Override public boolean hasNext() { return true; }
      @Override public Row next() { throw new IllegalStateException("division by zero"); }
    };
    QueryPlan plan = new QueryPlan() {
      @Override public Set<FilePath> sources() { return Set.of(); }
      @Override public QueryPlan relocate(UnaryOperator<FilePath> f) { return this; }
      @Override public RowCursor execute(Variables vars, SourceReader reader) { return RowCursor.fromIterator(failing, () -> {}); }
    };

    RowCursor c = evaluator().run(DATA, plan, Variables.EMPTY, ViewStack.EMPTY);

    FileSystemException e = assertThrows(FileSystemException.class, () -> c.next(1));
    assertEquals(FsError.QUERY_ERROR, e.error());
    assertEquals(DATA, e.path());
  }

  @Test
  void coreQuery_namespaceFailuresPassThrough() {
    data.delegate.put(FilePath.parse("/a"), rows(1));

    FileSystemException e = assertThrows(FileSystemException.class,
        () -> evaluator().query(DATA, "select * from a, archive/missing", Variables.EMPTY).drain());
    assertEquals(FsError.PATH_NOT_FOUND, e.error());
    assertEquals(FilePath.parse("/data/archive/missing"), e.path());
  }

  @Test
  void exists() {
    data.delegate.put(FilePath.parse("/sub/a"), rows(1));
    Evaluator e = evaluator();

    assertTrue(e.exists(DirPath.ROOT));
    assertTrue(e.exists(DirPath.parse("/data/sub/")));
    assertTrue(e.exists(FilePath.parse("/data/sub/a")));
    assertTrue(e.exists(ARCHIVE));
    assertFalse(e.exists(FilePath.parse("/data/sub/b")));
    assertFalse(e.exists(DirPath.parse("/other/")));
  }
}
