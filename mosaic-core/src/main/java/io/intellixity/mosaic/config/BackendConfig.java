package io.intellixity.mosaic.config;

import java.util.Map;

/**
 * Connection descriptor for a physical backend.
 *
 * @param kind backend kind id, looked up in the backend registry
 * @param params kind-specific connection parameters
 */
public record BackendConfig(String kind, Map<String, String> params) implements MountConfig {
  public BackendConfig {
    if (kind == null || kind.isBlank()) throw new IllegalArgumentException("kind is required");
    kind = kind.trim();
    params = (params == null) ? Map.of() : Map.copyOf(params);
  }

  public BackendConfig(String kind) {
    this(kind, Map.of());
  }

  @Override
  public String typeName() {
    return kind;
  }
}
