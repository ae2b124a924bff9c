package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.config.BackendConfig;
import io.intellixity.mosaic.fs.FileSystemException;
import io.intellixity.mosaic.fs.FsError;
import io.intellixity.mosaic.memory.InMemoryBackend;
import io.intellixity.mosaic.memory.InMemoryBackendKind;
import io.intellixity.mosaic.spi.BackendConnectException;
import io.intellixity.mosaic.spi.BackendConnection;
import io.intellixity.mosaic.spi.BackendKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class BackendRegistryTest {

  private static BackendKind failing(String id) {
    return new BackendKind() {
      @Override public String id() { return id; }
      @Override public BackendConnection open(Map<String, String> params) {
        throw new BackendConnectException("connection refused");
      }
    };
  }

  @Test
  void discover_findsMemoryKindFromFactories() {
    assertTrue(BackendRegistry.discover().kinds().contains(InMemoryBackendKind.ID));
  }

  @Test
  void duplicateIds_areRejected() {
    assertThrows(IllegalStateException.class,
        () -> BackendRegistry.of(new InMemoryBackendKind(), new InMemoryBackendKind()));
  }

  @Test
  void open_unknownKind() {
    FileSystemException e = assertThrows(FileSystemException.class,
        () -> BackendRegistry.of().open(new BackendConfig("couchbase")));
    assertEquals(FsError.UNKNOWN_BACKEND_KIND, e.error());
  }

  @Test
  void open_failure_isConnectError() {
    FileSystemException e = assertThrows(FileSystemException.class,
        () -> BackendRegistry.of(failing("flaky")).open(new BackendConfig("flaky")));
    assertEquals(FsError.BACKEND_CONNECT_ERROR, e.error());
    assertInstanceOf(BackendConnectException.class, e.getCause());
  }

  @Test
  void open_nullConnection_isAContractViolation() {
    BackendKind broken = new BackendKind() {
      @Override public String id() { return "broken"; }
      @Override public BackendConnection open(Map<String, String> params) { return null; }
    };
    assertThrows(IllegalStateException.class, () -> BackendRegistry.of(broken).open(new BackendConfig("broken")));
  }

  @Test
  void open_passesParams() {
    InMemoryBackend shared = new InMemoryBackend();
    BackendKind k = new BackendKind() {
      @Override public String id() { return "echo"; }
      @Override public BackendConnection open(Map<String, String> params) {
        assertEquals("v", params.get("k"));
        return BackendConnection.of(shared);
      }
    };
    assertSame(shared, BackendRegistry.of(k).open(new BackendConfig("echo", Map.of("k", "v"))).backend());
  }
}
