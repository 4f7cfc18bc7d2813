/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas;

import java.time.Duration;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings consumed by the replica multiplexer.
 *
 * <p>{@code pollInterval} bounds every readiness wait. {@code maxParallelReplicas} is read by
 * {@link ConnectionPool} implementations. {@code queryParameters} is forwarded opaquely with
 * {@link Connection#sendQuery}.
 */
@Value
public class Settings {

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);
  public static final String DEFAULT_NAME = "default";

  Duration pollInterval;
  int maxParallelReplicas;

  /** Dimension for logs and metrics (e.g. the cluster or shard name). */
  String name;

  Map<String, String> queryParameters;

  @Builder(toBuilder = true)
  private Settings(
      final Duration pollInterval,
      final Integer maxParallelReplicas,
      final String name,
      final Map<String, String> queryParameters) {
    this.pollInterval = pollInterval != null ? pollInterval : DEFAULT_POLL_INTERVAL;
    this.maxParallelReplicas = maxParallelReplicas != null ? maxParallelReplicas : 1;
    this.name = name != null ? name : DEFAULT_NAME;
    this.queryParameters = queryParameters != null ? Map.copyOf(queryParameters) : Map.of();

    if (this.pollInterval.isNegative() || this.pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be > 0, got: " + this.pollInterval);
    }
    if (this.maxParallelReplicas < 1) {
      throw new IllegalArgumentException(
          "maxParallelReplicas must be >= 1, got: " + this.maxParallelReplicas);
    }
  }

  public static Settings defaults() {
    return builder().build();
  }

  public static Settings withPollInterval(@NonNull final Duration pollInterval) {
    return builder().pollInterval(pollInterval).build();
  }
}
