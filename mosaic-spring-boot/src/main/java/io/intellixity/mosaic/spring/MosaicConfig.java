package io.intellixity.mosaic.spring;

import io.intellixity.mosaic.config.InMemoryMountConfigStore;
import io.intellixity.mosaic.config.JsonFileMountConfigStore;
import io.intellixity.mosaic.config.MountConfig;
import io.intellixity.mosaic.config.MountConfigStore;
import io.intellixity.mosaic.fs.FileSystem;
import io.intellixity.mosaic.mount.BackendRegistry;
import io.intellixity.mosaic.mount.MountManager;
import io.intellixity.mosaic.mount.ResultHandleTable;
import io.intellixity.mosaic.path.Path;
import io.intellixity.mosaic.query.QueryCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(MosaicProperties.class)
public class MosaicConfig {
  private static final Logger log = LoggerFactory.getLogger(MosaicConfig.class);

  @Bean
  public BackendRegistry backendRegistry() {
    return BackendRegistry.discover();
  }

  @Bean
  public MountConfigStore mountConfigStore(MosaicProperties props) {
    String file = props.getStoreFile();
    if (file == null || file.isBlank()) return new InMemoryMountConfigStore();
    log.info("mosaic.spring store file={}", file);
    return new JsonFileMountConfigStore(Paths.get(file));
  }

  /**
   * Restores persisted mounts, then mounts every configured one the store does not already hold. Deployments
   * without a {@link QueryCompiler} bean can mount backends only.
   */
  @Bean(destroyMethod = "close")
  public MountManager mountManager(BackendRegistry registry,
                                   MountConfigStore store,
                                   ObjectProvider<QueryCompiler> compilers,
                                   MosaicProperties props) {
    QueryCompiler compiler = compilers.getIfAvailable(QueryCompiler::unsupported);
    Map<Path, MountConfig> declared = props.toConfigs();

    MountManager m = MountManager.start(registry, compiler, store);
    try {
      Map<Path, MountConfig> missing = new LinkedHashMap<>();
      for (Map.Entry<Path, MountConfig> e : declared.entrySet()) {
        MountConfig existing = m.lookupMountConfig(e.getKey()).orElse(null);
        if (existing == null) missing.put(e.getKey(), e.getValue());
        else if (!existing.equals(e.getValue())) {
          log.warn("mosaic.spring mount path={} differs from persisted config; keeping persisted", e.getKey());
        }
      }
      m.mountAll(missing);
    } catch (RuntimeException e) {
      m.close();
      throw e;
    }
    log.info("mosaic.spring ready mounts={}", m.mounts().keySet());
    return m;
  }

  @Bean
  public FileSystem mosaicFileSystem(MountManager mountManager) {
    return mountManager.fileSystem();
  }

  @Bean
  public ResultHandleTable resultHandleTable(MountManager mountManager) {
    return mountManager.results();
  }
}
