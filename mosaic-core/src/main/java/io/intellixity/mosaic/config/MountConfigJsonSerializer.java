package io.intellixity.mosaic.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Canonical JSON for {@link MountConfig}:
 * <pre>
 * {"view": {"query": "...", "defaults": {"min": "1000"}}}
 * {"backend": {"kind": "mongodb", "params": {"connectionUri": "mongodb://..."}}}
 * </pre>
 */
public final class MountConfigJsonSerializer extends JsonSerializer<MountConfig> {
  @Override
  public void serialize(MountConfig c, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (c == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    if (c instanceof ViewConfig v) {
      g.writeObjectFieldStart("view");
      g.writeStringField("query", v.query());
      if (!v.defaults().values().isEmpty()) g.writeObjectField("defaults", v.defaults().values());
    } else {
      BackendConfig b = (BackendConfig) c;
      g.writeObjectFieldStart("backend");
      g.writeStringField("kind", b.kind());
      if (!b.params().isEmpty()) g.writeObjectField("params", b.params());
    }
    g.writeEndObject();
    g.writeEndObject();
  }
}
