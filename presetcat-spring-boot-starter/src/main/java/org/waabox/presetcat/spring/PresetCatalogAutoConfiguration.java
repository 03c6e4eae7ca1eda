package org.waabox.presetcat.spring;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.presetcat.PresetCatalog;
import org.waabox.presetcat.metrics.CatalogMetrics;
import org.waabox.presetcat.sync.CatalogSync;
import org.waabox.presetcat.sync.DisabledCatalogSync;
import org.waabox.presetcat.sync.SyncMode;
import org.waabox.presetcat.sync.git.GitCatalogSync;
import org.waabox.presetcat.sync.git.GitSyncConfig;

/**
 * Spring Boot auto-configuration for the preset catalog.
 *
 * <p>This configuration creates a singleton {@link PresetCatalog} over the
 * directory named by {@code presetcat.root}, kept in sync with git unless
 * {@code presetcat.sync-enabled} is false. An application can replace the
 * sync engine by declaring its own {@link CatalogSync} bean, and plug in
 * metrics with a {@link CatalogMetrics} bean.
 *
 * <p>The catalog lifecycle is managed through Spring's
 * {@link SmartLifecycle}: on start the root is synced and then scanned.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(PresetCatalogProperties.class)
public class PresetCatalogAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PresetCatalogAutoConfiguration.class);

  /**
   * Creates the sync engine. Git backed when sync is enabled, a no-op
   * otherwise.
   *
   * @param properties the configuration properties, never null
   *
   * @return the sync engine, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public CatalogSync catalogSync(final PresetCatalogProperties properties) {
    if (!properties.isSyncEnabled()) {
      log.info("Preset catalog sync is disabled");
      return new DisabledCatalogSync();
    }
    final Path root = Path.of(properties.getRoot()).toAbsolutePath()
        .normalize();
    final Path parent = properties.getParentRepository() == null
        ? root.getParent()
        : Path.of(properties.getParentRepository());
    final String submodulePath = properties.getSubmodulePath() == null
        ? parent.toAbsolutePath().normalize().relativize(root).toString()
        : properties.getSubmodulePath();
    final GitSyncConfig config = GitSyncConfig.create(root, parent,
        submodulePath, properties.getRemoteUrl(), true);
    log.info("Preset catalog synced with {} ({} inside {})",
        config.remoteUrl(), config.submodulePath(),
        config.parentRepository());
    return new GitCatalogSync(config);
  }

  /**
   * Creates the singleton {@link PresetCatalog} bean.
   *
   * @param properties      the configuration properties, never null
   * @param catalogSync     the sync engine, never null
   * @param metricsProvider provider for an optional CatalogMetrics bean
   *
   * @return the configured catalog, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public PresetCatalog presetCatalog(
      final PresetCatalogProperties properties,
      final CatalogSync catalogSync,
      final ObjectProvider<CatalogMetrics> metricsProvider) {

    final SyncMode mode = SyncMode.fromRole(properties.getRole());
    final PresetCatalog.Builder builder = PresetCatalog.builder()
        .root(Path.of(properties.getRoot()))
        .cacheTtl(properties.getCacheTtl())
        .sync(catalogSync)
        .syncMode(mode);

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Preset catalog using custom CatalogMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    final PresetCatalog catalog = builder.build();
    log.info("Preset catalog created at {} in {} mode", catalog.root(), mode);
    return catalog;
  }

  /**
   * Creates a {@link SmartLifecycle} bean that starts and stops the
   * catalog.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1})
   * so that every other bean is ready before the first sync.
   *
   * @param catalog the catalog to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle presetCatalogLifecycle(final PresetCatalog catalog) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting preset catalog lifecycle...");
        catalog.start();
        running = true;
        log.info("Preset catalog lifecycle started with {} manufacturer(s)",
            catalog.manufacturers().size());
      }

      @Override
      public void stop() {
        log.info("Stopping preset catalog lifecycle...");
        catalog.stop();
        running = false;
        log.info("Preset catalog lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }
}
