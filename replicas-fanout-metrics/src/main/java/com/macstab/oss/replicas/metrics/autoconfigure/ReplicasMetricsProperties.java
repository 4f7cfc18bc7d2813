/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.replicas.metrics.micrometer.MicrometerReplicasMetrics;

import lombok.Data;

/**
 * Configuration properties for replica multiplexer metrics.
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     replicas-fanout:
 *       enabled: true
 *       max-cache-size: 1000
 * }</pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.replicas-fanout")
public class ReplicasMetricsProperties {

  /**
   * Enable metrics collection.
   *
   * <p><strong>When disabled:</strong> {@code ReplicasMetrics.NOOP} is used.
   */
  private boolean enabled = true;

  /**
   * Maximum cached meter instances.
   *
   * <p>Counters tagged with {@code server.address} grow with the number of replicas: 3 shards ×
   * 3 replicas × 2 strategies stays well below the default. When the cache is full, meters still
   * work through direct registry lookups and a warning is logged.
   */
  private int maxCacheSize = MicrometerReplicasMetrics.DEFAULT_MAX_CACHE_SIZE;
}
