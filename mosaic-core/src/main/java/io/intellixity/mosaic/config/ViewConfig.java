package io.intellixity.mosaic.config;

import io.intellixity.mosaic.query.Variables;

/**
 * A virtual read-only file defined by a saved query.
 *
 * @param query query text, compiled relative to the directory containing the view
 * @param defaults variable bindings used where the caller binds nothing
 */
public record ViewConfig(String query, Variables defaults) implements MountConfig {
  public static final String TYPE = "view";

  public ViewConfig {
    if (query == null || query.isBlank()) throw new IllegalArgumentException("query is required");
    defaults = (defaults == null) ? Variables.EMPTY : defaults;
  }

  public ViewConfig(String query) {
    this(query, Variables.EMPTY);
  }

  @Override
  public String typeName() {
    return TYPE;
  }
}
