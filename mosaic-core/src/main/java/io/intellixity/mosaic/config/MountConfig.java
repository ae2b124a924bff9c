package io.intellixity.mosaic.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * What is mounted at a path: a saved-query view or a backend connection descriptor.
 */
@JsonSerialize(using = MountConfigJsonSerializer.class)
@JsonDeserialize(using = MountConfigJsonDeserializer.class)
public sealed interface MountConfig permits ViewConfig, BackendConfig {

  /** {@code "view"} for views, the backend kind for backends. */
  String typeName();
}
