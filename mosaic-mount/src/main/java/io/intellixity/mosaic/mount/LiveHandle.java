package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.fs.FileSystemException;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.spi.BackendConnection;
import io.intellixity.mosaic.spi.FileSystemBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Opened backend connection owned by a {@link MountTable} entry.
 * <p>
 * Every call into the backend holds a lease. Once {@link #retire()} is called no new lease is granted
 * (callers see {@code BACKEND_UNAVAILABLE}); the release action runs when the last lease is returned,
 * or immediately if none is out. The release action runs at most once.
 */
public final class LiveHandle {
  private static final Logger log = LoggerFactory.getLogger(LiveHandle.class);

  private final DirPath mount;
  private final FileSystemBackend backend;
  private final AutoCloseable release;
  private final AtomicInteger leases = new AtomicInteger();
  private final AtomicBoolean released = new AtomicBoolean();
  private volatile boolean retired;

  public LiveHandle(DirPath mount, BackendConnection connection) {
    this.mount = Objects.requireNonNull(mount, "mount");
    Objects.requireNonNull(connection, "connection");
    this.backend = connection.backend();
    this.release = connection.release();
  }

  public DirPath mount() {
    return mount;
  }

  public boolean isRetired() {
    return retired;
  }

  public boolean isReleased() {
    return released.get();
  }

  /** Run {@code op} against the backend under a lease. */
  public <T> T call(Function<FileSystemBackend, T> op) {
    acquire();
    try {
      return op.apply(backend);
    } finally {
      returnLease();
    }
  }

  /**
   * Stop granting leases and release the connection as soon as no call is in flight.
   *
   * @return a warning if the release ran now and failed; deferred release failures are only logged
   */
  public Optional<String> retire() {
    retired = true;
    if (leases.get() == 0) return releaseNow();
    log.debug("mosaic.live release deferred mount={} inFlight={}", mount, leases.get());
    return Optional.empty();
  }

  private void acquire() {
    if (retired) throw FileSystemException.backendUnavailable(mount);
    leases.incrementAndGet();
    if (retired) {
      returnLease();
      throw FileSystemException.backendUnavailable(mount);
    }
  }

  private void returnLease() {
    if (leases.decrementAndGet() == 0 && retired) releaseNow();
  }

  private Optional<String> releaseNow() {
    if (!released.compareAndSet(false, true)) return Optional.empty();
    try {
      release.close();
      log.debug("mosaic.live released mount={}", mount);
      return Optional.empty();
    } catch (Exception e) {
      log.warn("mosaic.live release failed mount={}", mount, e);
      return Optional.of("Release of backend at " + mount + " failed: " + e.getMessage());
    }
  }
}
