package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.fs.FileSystemException;
import io.intellixity.mosaic.fs.FsError;
import io.intellixity.mosaic.memory.InMemoryBackend;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.spi.BackendConnection;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class LiveHandleTest {

  private static final DirPath DATA = DirPath.parse("/data/");

  @Test
  void retire_withoutCallsInFlight_releasesImmediately() {
    AtomicInteger releases = new AtomicInteger();
    LiveHandle h = new LiveHandle(DATA, new BackendConnection(new InMemoryBackend(), releases::incrementAndGet));

    assertTrue(h.retire().isEmpty());
    assertTrue(h.retire().isEmpty());

    assertEquals(1, releases.get());
    FileSystemException e = assertThrows(FileSystemException.class, () -> h.call(b -> b.list(DirPath.ROOT)));
    assertEquals(FsError.BACKEND_UNAVAILABLE, e.error());
  }

  @Test
  void retire_duringCall_defersReleaseUntilCallReturns() {
    AtomicInteger releases = new AtomicInteger();
    LiveHandle h = new LiveHandle(DATA, new BackendConnection(new InMemoryBackend(), releases::incrementAndGet));

    h.call(b -> {
      h.retire();
      assertEquals(0, releases.get());
      return b.list(DirPath.ROOT);
    });

    assertEquals(1, releases.get());
    assertTrue(h.isReleased());
  }

  @Test
  void retire_reportsReleaseFailure() {
    LiveHandle h = new LiveHandle(DATA, new BackendConnection(new InMemoryBackend(), () -> {
      throw new IllegalStateException("socket already gone");
    }));

    String warning = h.retire().orElseThrow();

    assertTrue(warning.contains("/data/"));
    assertTrue(warning.contains("socket already gone"));
  }
}
