/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.spring;

import java.util.Optional;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.replicas.ConnectionPool;
import com.macstab.oss.replicas.ReplicasConnectionsFactory;
import com.macstab.oss.replicas.Settings;
import com.macstab.oss.replicas.metrics.ReplicasMetrics;
import com.macstab.oss.replicas.strategy.LargestPacketNumberStrategy;
import com.macstab.oss.replicas.strategy.ReplicaSelectionStrategy;

import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration for the replica multiplexer.
 *
 * <p>Binds {@code replicas.fanout.*} into {@link Settings} and, once the application provides a
 * {@link ConnectionPool} bean, exposes a {@link ReplicasConnectionsFactory} that opens one replica
 * set per query.
 *
 * <p><strong>Beans (each backs off for a user-defined one):</strong>
 *
 * <ul>
 *   <li>{@link Settings} from {@link ReplicasFanoutProperties}
 *   <li>{@link ReplicaSelectionStrategy}: {@link LargestPacketNumberStrategy}
 *   <li>{@link ReplicasConnectionsFactory}: requires a {@link ConnectionPool} bean; uses the
 *       {@link ReplicasMetrics} bean when one exists (see {@code replicas-fanout-metrics})
 * </ul>
 *
 * <p>Disabled with {@code replicas.fanout.enabled=false}.
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "com.macstab.oss.replicas.metrics.autoconfigure.ReplicasMetricsAutoConfiguration")
@ConditionalOnProperty(
    prefix = "replicas.fanout",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties(ReplicasFanoutProperties.class)
public class ReplicasFanoutAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(Settings.class)
  public Settings replicasFanoutSettings(final ReplicasFanoutProperties properties) {
    return properties.toSettings();
  }

  @Bean
  @ConditionalOnMissingBean(ReplicaSelectionStrategy.class)
  public ReplicaSelectionStrategy replicaSelectionStrategy() {
    return new LargestPacketNumberStrategy();
  }

  /**
   * Creates the factory of per-query replica sets.
   *
   * @param pool replica source provided by the application
   * @param settings default settings of every opened set
   * @param strategy replica selection strategy
   * @param metricsProvider metrics collector provider (optional, for observability)
   * @return replica set factory
   */
  @Bean
  @ConditionalOnBean(ConnectionPool.class)
  @ConditionalOnMissingBean(ReplicasConnectionsFactory.class)
  public ReplicasConnectionsFactory replicasConnectionsFactory(
      final ConnectionPool pool,
      final Settings settings,
      final ReplicaSelectionStrategy strategy,
      final ObjectProvider<ReplicasMetrics> metricsProvider) {

    final var metrics = Optional.ofNullable(metricsProvider.getIfAvailable());

    if (log.isInfoEnabled()) {
      log.info(
          "Replica fan-out '{}': pollInterval={}, maxParallelReplicas={}, strategy={}, metrics={}",
          settings.getName(),
          settings.getPollInterval(),
          Integer.valueOf(settings.getMaxParallelReplicas()),
          strategy.getName(),
          metrics.filter(m -> m != ReplicasMetrics.NOOP).isPresent() ? "enabled" : "disabled");
    }

    return new ReplicasConnectionsFactory(pool, settings, strategy, metrics);
  }
}
