package io.intellixity.mosaic.spi;

import java.util.Map;

/**
 * Factory for one kind of backend (e.g. {@code mongodb}).
 * <p>
 * Implementations are registered programmatically or discovered through {@code META-INF/mosaic.factories}.
 */
public interface BackendKind {

  /** Stable identifier used in backend mount configurations. */
  String id();

  /**
   * Open a live connection.
   *
   * @throws BackendConnectException if the connection cannot be established; nothing may leak in that case
   */
  BackendConnection open(Map<String, String> params);
}
