/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.metrics.micrometer;

import static com.macstab.oss.replicas.metrics.micrometer.MetricsConfiguration.*;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

import com.macstab.oss.replicas.metrics.ReplicasMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link ReplicasMetrics} with dimensional tags.
 *
 * <p><strong>Dimensional Metrics:</strong> every meter carries the {@code connection.name} tag
 * (the replica set name from {@code Settings#getName()}), so several clusters or shards share one
 * instance and one registry.
 *
 * <p><strong>Metrics Published:</strong>
 *
 * <table>
 *   <caption>Metric Summary</caption>
 *   <thead>
 *     <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr><td>{@code replicas.fanout.replica.selections}</td><td>Counter</td>
 *         <td>connection.name, server.address, strategy.name</td></tr>
 *     <tr><td>{@code replicas.fanout.packets.returned}</td><td>Counter</td>
 *         <td>connection.name, packet.type</td></tr>
 *     <tr><td>{@code replicas.fanout.packets.discarded}</td><td>Counter</td>
 *         <td>connection.name, packet.type</td></tr>
 *     <tr><td>{@code replicas.fanout.replica.invalidations}</td><td>Counter</td>
 *         <td>connection.name, server.address, reason</td></tr>
 *     <tr><td>{@code replicas.fanout.drain.runs / packets / failures}</td><td>Counter</td>
 *         <td>connection.name</td></tr>
 *     <tr><td>{@code replicas.fanout.poll.empty}</td><td>Counter</td>
 *         <td>connection.name</td></tr>
 *     <tr><td>{@code replicas.fanout.sets.opened / replicas}</td><td>Counter</td>
 *         <td>connection.name</td></tr>
 *     <tr><td>{@code replicas.fanout.sets.active}</td><td>Gauge</td>
 *         <td>connection.name</td></tr>
 *   </tbody>
 * </table>
 *
 * <p><strong>Thread Safety:</strong> all methods are safe for concurrent use; replica sets on
 * different threads record into the same instance.
 *
 * <p><strong>Lifecycle:</strong> {@link #close(String)} drops the gauges of one replica set name,
 * {@link #close()} drops all of them and turns every later call into a no-op.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class MicrometerReplicasMetrics implements ReplicasMetrics {

  /** Default bound of the meter cache. */
  public static final int DEFAULT_MAX_CACHE_SIZE = 1000;

  private static final String UNKNOWN = "unknown";

  private final MetricCache cache;

  // Closed flag (idempotent close)
  private volatile boolean closed = false;

  /**
   * Creates a Micrometer metrics collector.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws NullPointerException if registry is null
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  public MicrometerReplicasMetrics(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.cache = new MetricCache(registry, maxCacheSize);
    log.debug("Created MicrometerReplicasMetrics (maxCacheSize: {})", maxCacheSize);
  }

  public MicrometerReplicasMetrics(@NonNull final MeterRegistry registry) {
    this(registry, DEFAULT_MAX_CACHE_SIZE);
  }

  @Override
  public void recordReplicaSelection(
      final String name, final String serverAddress, final String strategyName) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(
            REPLICA_SELECTIONS,
            "Replicas picked by the selection strategy",
            TAG_CONNECTION_NAME,
            tag(name),
            TAG_SERVER_ADDRESS,
            tag(serverAddress),
            TAG_STRATEGY_NAME,
            tag(strategyName))
        .increment();
  }

  @Override
  public void recordPacketReturned(final String name, final String packetType) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(
            PACKETS_RETURNED,
            "Packets returned to the caller",
            TAG_CONNECTION_NAME,
            tag(name),
            TAG_PACKET_TYPE,
            tag(packetType))
        .increment();
  }

  @Override
  public void recordPacketDiscarded(final String name, final String packetType) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(
            PACKETS_DISCARDED,
            "Packets read from a replica but not returned",
            TAG_CONNECTION_NAME,
            tag(name),
            TAG_PACKET_TYPE,
            tag(packetType))
        .increment();
  }

  @Override
  public void recordReplicaInvalidated(
      final String name, final String serverAddress, final InvalidationReason reason) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(
            REPLICA_INVALIDATIONS,
            "Replicas removed from the valid set",
            TAG_CONNECTION_NAME,
            tag(name),
            TAG_SERVER_ADDRESS,
            tag(serverAddress),
            TAG_REASON,
            reason == null ? UNKNOWN : reason.name().toLowerCase(Locale.ROOT))
        .increment();
  }

  @Override
  public void recordResidualDrain(final String name, final int drainedPackets, final int failures) {
    if (closed) {
      return;
    }
    if (drainedPackets < 0 || failures < 0) {
      log.warn(
          "Invalid drain counts (packets: {}, failures: {}), skipping metric",
          drainedPackets,
          failures);
      return;
    }

    cache
        .getOrCreateCounter(DRAIN_RUNS, "Residual drain runs", TAG_CONNECTION_NAME, tag(name))
        .increment();
    cache
        .getOrCreateCounter(
            DRAIN_PACKETS, "Packets discarded by residual drains", TAG_CONNECTION_NAME, tag(name))
        .increment(drainedPackets);
    cache
        .getOrCreateCounter(
            DRAIN_FAILURES,
            "Replicas whose residual drain ended with an error",
            TAG_CONNECTION_NAME,
            tag(name))
        .increment(failures);
  }

  @Override
  public void recordEmptyPoll(final String name) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(
            EMPTY_POLLS, "Readiness polls without a usable replica", TAG_CONNECTION_NAME, tag(name))
        .increment();
  }

  @Override
  public void recordReplicaSetOpened(final String name, final int replicas) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(SETS_OPENED, "Replica sets opened", TAG_CONNECTION_NAME, tag(name))
        .increment();
    cache
        .getOrCreateCounter(
            SETS_REPLICAS, "Replicas handed out by the pool", TAG_CONNECTION_NAME, tag(name))
        .increment(Math.max(0, replicas));
    activeSets(name).incrementAndGet();
  }

  @Override
  public void recordReplicaSetClosed(final String name) {
    if (closed) {
      return;
    }
    activeSets(name).updateAndGet(current -> Math.max(0, current - 1));
  }

  @Override
  public void close(final String name) {
    try {
      cache.removeGaugesFor(tag(name));
      log.debug("Closed metrics for replica set '{}'", name);
    } catch (final RuntimeException e) {
      log.error("Error closing metrics for replica set '{}'", name, e);
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      cache.removeAllGauges();
      log.debug("Closed MicrometerReplicasMetrics");
    } catch (final RuntimeException e) {
      log.error("Error closing MicrometerReplicasMetrics", e);
    }
  }

  /** Current cache size (for tests). */
  int getCacheSize() {
    return cache.getCacheSize();
  }

  private AtomicInteger activeSets(final String name) {
    return cache.getOrCreateGaugeValue(
        SETS_ACTIVE, "Replica sets currently open", TAG_CONNECTION_NAME, tag(name));
  }

  private static String tag(final String value) {
    return value == null ? UNKNOWN : value;
  }
}
