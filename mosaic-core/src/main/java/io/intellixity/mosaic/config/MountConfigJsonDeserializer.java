package io.intellixity.mosaic.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.mosaic.query.Variables;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Reads the format written by {@link MountConfigJsonSerializer}. */
public final class MountConfigJsonDeserializer extends JsonDeserializer<MountConfig> {
  @Override
  public MountConfig deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Mount config JSON must be an object");

    JsonNode view = root.get("view");
    if (view != null && view.isObject()) {
      return new ViewConfig(textOrNull(view.get("query")), Variables.of(strings(view.get("defaults"))));
    }
    JsonNode backend = root.get("backend");
    if (backend != null && backend.isObject()) {
      return new BackendConfig(textOrNull(backend.get("kind")), strings(backend.get("params")));
    }
    throw new IllegalArgumentException("Mount config must have a view or backend object: " + root);
  }

  private static Map<String, String> strings(JsonNode n) {
    Map<String, String> out = new LinkedHashMap<>();
    if (n == null || !n.isObject()) return out;
    n.fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue().asText()));
    return out;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
