package io.intellixity.mosaic.mount;

import io.intellixity.mosaic.config.BackendConfig;
import io.intellixity.mosaic.fs.FileSystemException;
import io.intellixity.mosaic.spi.BackendConnection;
import io.intellixity.mosaic.spi.BackendKind;
import io.intellixity.mosaic.util.MosaicFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Backend kinds known to a mount manager, keyed by {@link BackendKind#id()}.
 */
public final class BackendRegistry {
  private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

  private final Map<String, BackendKind> kinds;

  public BackendRegistry(Collection<? extends BackendKind> kinds) {
    Objects.requireNonNull(kinds, "kinds");
    Map<String, BackendKind> m = new LinkedHashMap<>();
    for (BackendKind k : kinds) {
      Objects.requireNonNull(k, "kind");
      String id = Objects.requireNonNull(k.id(), "id");
      BackendKind prev = m.putIfAbsent(id, k);
      if (prev != null) {
        throw new IllegalStateException("Duplicate backend kind '" + id + "': "
            + prev.getClass().getName() + " and " + k.getClass().getName());
      }
    }
    this.kinds = Collections.unmodifiableMap(m);
  }

  public static BackendRegistry of(BackendKind... kinds) {
    return new BackendRegistry(List.of(kinds));
  }

  /** Registry of every kind listed in {@code META-INF/mosaic.factories} on the context class path. */
  public static BackendRegistry discover() {
    return discover(Thread.currentThread().getContextClassLoader());
  }

  public static BackendRegistry discover(ClassLoader cl) {
    BackendRegistry r = new BackendRegistry(MosaicFactoriesLoader.load(BackendKind.class, cl));
    log.info("mosaic.registry discovered kinds={}", r.kinds());
    return r;
  }

  public Set<String> kinds() {
    return kinds.keySet();
  }

  public Optional<BackendKind> kind(String id) {
    return Optional.ofNullable(kinds.get(id));
  }

  /**
   * Open a live connection for {@code config}.
   *
   * @throws FileSystemException {@code UNKNOWN_BACKEND_KIND} or {@code BACKEND_CONNECT_ERROR}
   */
  public BackendConnection open(BackendConfig config) {
    Objects.requireNonNull(config, "config");
    BackendKind kind = kinds.get(config.kind());
    if (kind == null) throw FileSystemException.unknownBackendKind(config.kind());

    BackendConnection c;
    try {
      c = kind.open(config.params());
    } catch (FileSystemException e) {
      throw e;
    } catch (RuntimeException e) {
      throw FileSystemException.backendConnect(config.kind(), e);
    }
    if (c == null) throw new IllegalStateException("BackendKind " + config.kind() + " returned null connection");
    return c;
  }
}
