package io.intellixity.mosaic.memory;

import io.intellixity.mosaic.spi.BackendConnection;
import io.intellixity.mosaic.spi.BackendKind;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * {@link BackendKind} handing out {@link InMemoryBackend}s.
 * <p>
 * Counts opens and releases so callers can check that every opened connection was released.
 */
public final class InMemoryBackendKind implements BackendKind {
  public static final String ID = "memory";

  private final String id;
  private final Supplier<InMemoryBackend> backends;
  private final AtomicInteger opened = new AtomicInteger();
  private final AtomicInteger released = new AtomicInteger();

  /** Discovery constructor: kind {@code memory}, a fresh empty backend per mount. */
  public InMemoryBackendKind() {
    this(ID, InMemoryBackend::new);
  }

  public InMemoryBackendKind(String id, Supplier<InMemoryBackend> backends) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
    this.id = id;
    this.backends = Objects.requireNonNull(backends, "backends");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public BackendConnection open(Map<String, String> params) {
    InMemoryBackend backend = backends.get();
    if (backend == null) throw new IllegalStateException("Backend supplier returned null for kind " + id);
    opened.incrementAndGet();
    return new BackendConnection(backend, () -> {
      released.incrementAndGet();
      backend.close();
    });
  }

  public int opened() {
    return opened.get();
  }

  public int released() {
    return released.get();
  }
}
