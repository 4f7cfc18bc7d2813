/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.spring;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.replicas.Settings;

import lombok.Getter;
import lombok.Setter;

/**
 * Configuration properties for the replica multiplexer.
 *
 * <pre>{@code
 * replicas:
 *   fanout:
 *     poll-interval: 10s
 *     max-parallel-replicas: 3
 *     name: shard-1
 *     query-parameters:
 *       max_threads: 8
 * }</pre>
 *
 * <p>{@code max-parallel-replicas} is clamped to {@value #MIN_PARALLEL_REPLICAS}..{@value
 * #MAX_PARALLEL_REPLICAS} instead of failing startup.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "replicas.fanout")
public class ReplicasFanoutProperties {

  public static final int MIN_PARALLEL_REPLICAS = 1;
  public static final int MAX_PARALLEL_REPLICAS = 64;

  /** Enables the auto-configuration. */
  private boolean enabled = true;

  /** Upper bound of every readiness wait. */
  private Duration pollInterval = Settings.DEFAULT_POLL_INTERVAL;

  /** Number of replicas a connection pool should hand out per query. */
  private int maxParallelReplicas = MIN_PARALLEL_REPLICAS;

  /** Replica set name used in logs and as the {@code connection.name} metrics tag. */
  private String name = Settings.DEFAULT_NAME;

  /** Settings forwarded with every query, untouched. */
  private Map<String, String> queryParameters = new LinkedHashMap<>();

  public void setMaxParallelReplicas(final int maxParallelReplicas) {
    this.maxParallelReplicas =
        Math.max(MIN_PARALLEL_REPLICAS, Math.min(maxParallelReplicas, MAX_PARALLEL_REPLICAS));
  }

  /**
   * Converts to core settings.
   *
   * @throws IllegalArgumentException if the poll interval is not positive
   */
  public Settings toSettings() {
    return Settings.builder()
        .pollInterval(pollInterval)
        .maxParallelReplicas(maxParallelReplicas)
        .name(name)
        .queryParameters(queryParameters)
        .build();
  }
}
