/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.replicas.metrics.ReplicasMetrics;
import com.macstab.oss.replicas.metrics.micrometer.MicrometerReplicasMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot auto-configuration for replica multiplexer metrics.
 *
 * <p><strong>Activation Conditions:</strong>
 *
 * <ol>
 *   <li>{@code MeterRegistry.class} on classpath (Micrometer present)
 *   <li>{@code MeterRegistry} bean exists (Spring Boot Actuator configured)
 *   <li>{@code management.metrics.replicas-fanout.enabled=true} (default: true)
 * </ol>
 *
 * <p><strong>Bean Created:</strong>
 *
 * <ul>
 *   <li>If conditions met: {@link MicrometerReplicasMetrics}
 *   <li>Otherwise: {@link ReplicasMetrics#NOOP}
 * </ul>
 *
 * <p>Ordered after Actuator's registry auto-configurations (referenced by name, Actuator stays
 * optional) so that the {@code MeterRegistry} condition sees their bean.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
    })
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(ReplicasMetricsProperties.class)
public class ReplicasMetricsAutoConfiguration {

  /**
   * Creates the Micrometer metrics collector.
   *
   * <p>Shared by every replica set of the application; the {@code connection.name} tag keeps them
   * apart. Closed with the context.
   *
   * @param registry Micrometer meter registry
   * @param properties metrics configuration properties
   * @return Micrometer metrics collector
   */
  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.replicas-fanout",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(ReplicasMetrics.class)
  public ReplicasMetrics micrometerReplicasMetrics(
      final MeterRegistry registry, final ReplicasMetricsProperties properties) {

    log.info(
        "Activating replica multiplexer metrics (Micrometer) - maxCacheSize: {}",
        properties.getMaxCacheSize());

    return new MicrometerReplicasMetrics(registry, properties.getMaxCacheSize());
  }

  /**
   * Creates the no-op metrics collector when metrics are disabled or no registry exists.
   *
   * <p>Optional for the core library (it falls back to {@link ReplicasMetrics#NOOP} by itself),
   * provided so that injection points always find a bean.
   *
   * @return no-op metrics collector
   */
  @Bean
  @ConditionalOnMissingBean(ReplicasMetrics.class)
  public ReplicasMetrics noOpReplicasMetrics() {
    log.debug("Replica multiplexer metrics disabled - using NOOP singleton");
    return ReplicasMetrics.NOOP;
  }
}
