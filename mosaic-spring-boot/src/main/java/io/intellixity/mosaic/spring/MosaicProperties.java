package io.intellixity.mosaic.spring;

import io.intellixity.mosaic.config.BackendConfig;
import io.intellixity.mosaic.config.MountConfig;
import io.intellixity.mosaic.config.ViewConfig;
import io.intellixity.mosaic.path.Path;
import io.intellixity.mosaic.query.Variables;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mounts declared in application configuration, keyed by mount path:
 *
 * <pre>
 * mosaic.mounts[/data/].backend.kind=mongodb
 * mosaic.mounts[/data/].backend.params.connectionUri=mongodb://localhost:27017
 * mosaic.mounts[/views/big.json].view.query=select city from /data/census/zips where pop &gt; :min
 * mosaic.mounts[/views/big.json].view.defaults.min=100000
 * mosaic.store-file=/var/lib/mosaic/mounts.json
 * </pre>
 * Without {@code store-file} mounts live in memory only.
 */
@ConfigurationProperties(prefix = "mosaic")
public class MosaicProperties {
  private final Map<String, Mount> mounts = new LinkedHashMap<>();
  private String storeFile;

  public Map<String, Mount> getMounts() { return mounts; }
  public String getStoreFile() { return storeFile; }
  public void setStoreFile(String storeFile) { this.storeFile = storeFile; }

  /** Declared mounts as typed configs, in declaration order. */
  public Map<Path, MountConfig> toConfigs() {
    Map<Path, MountConfig> out = new LinkedHashMap<>();
    for (Map.Entry<String, Mount> e : mounts.entrySet()) {
      out.put(Path.parse(e.getKey()), e.getValue().toConfig(e.getKey()));
    }
    return out;
  }

  public static class Mount {
    private View view;
    private Backend backend;

    public View getView() { return view; }
    public void setView(View view) { this.view = view; }
    public Backend getBackend() { return backend; }
    public void setBackend(Backend backend) { this.backend = backend; }

    MountConfig toConfig(String path) {
      if ((view == null) == (backend == null)) {
        throw new IllegalArgumentException("Mount " + path + " must declare exactly one of view or backend");
      }
      if (view != null) return new ViewConfig(view.getQuery(), Variables.of(view.getDefaults()));
      return new BackendConfig(backend.getKind(), backend.getParams());
    }
  }

  public static class View {
    private String query;
    private final Map<String, String> defaults = new LinkedHashMap<>();

    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }
    public Map<String, String> getDefaults() { return defaults; }
  }

  public static class Backend {
    private String kind;
    private final Map<String, String> params = new LinkedHashMap<>();

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }
    public Map<String, String> getParams() { return params; }
  }
}
