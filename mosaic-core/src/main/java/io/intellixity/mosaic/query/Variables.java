package io.intellixity.mosaic.query;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Named query variable bindings. */
public record Variables(Map<String, String> values) {
  public static final Variables EMPTY = new Variables(Map.of());

  public Variables {
    Objects.requireNonNull(values, "values");
    values = Map.copyOf(values);
  }

  public static Variables of(Map<String, String> values) {
    return (values == null || values.isEmpty()) ? EMPTY : new Variables(values);
  }

  public Optional<String> get(String name) {
    return Optional.ofNullable(values.get(name));
  }

  /** These bindings laid over {@code defaults}: a name bound here wins. */
  public Variables overlay(Variables defaults) {
    if (defaults == null || defaults.values.isEmpty()) return this;
    if (values.isEmpty()) return defaults;
    Map<String, String> out = new LinkedHashMap<>(defaults.values);
    out.putAll(values);
    return new Variables(out);
  }
}
