package io.intellixity.mosaic.spi;

import java.util.Objects;

/**
 * Result of opening a backend: the capability plus the action that releases its connection.
 *
 * @param backend capability handed to the core
 * @param release runs once when the owning mount is removed
 */
public record BackendConnection(FileSystemBackend backend, AutoCloseable release) {
  public BackendConnection {
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(release, "release");
  }

  /** Connection whose release simply closes the backend. */
  public static BackendConnection of(FileSystemBackend backend) {
    return new BackendConnection(backend, backend);
  }
}
