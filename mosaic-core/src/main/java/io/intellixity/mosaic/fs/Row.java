package io.intellixity.mosaic.fs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One record flowing through the namespace.
 * <p>
 * Field order is preserved; values are whatever the originating backend produced.
 */
public record Row(Map<String, Object> values) {
  public Row {
    Objects.requireNonNull(values, "values");
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static Row of(Map<String, ?> values) {
    return new Row(values == null ? Map.of() : new LinkedHashMap<>(values));
  }

  public static Row of(String k1, Object v1) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(k1, v1);
    return new Row(m);
  }

  public static Row of(String k1, Object v1, String k2, Object v2) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(k1, v1);
    m.put(k2, v2);
    return new Row(m);
  }

  public Object get(String field) {
    return values.get(field);
  }

  public boolean has(String field) {
    return values.containsKey(field);
  }
}
