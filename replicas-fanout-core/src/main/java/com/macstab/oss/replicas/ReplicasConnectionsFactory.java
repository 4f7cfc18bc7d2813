/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas;

import java.util.Optional;

import com.macstab.oss.replicas.metrics.ReplicasMetrics;
import com.macstab.oss.replicas.readiness.NioSocketPoller;
import com.macstab.oss.replicas.strategy.LargestPacketNumberStrategy;
import com.macstab.oss.replicas.strategy.ReplicaSelectionStrategy;

import lombok.Getter;
import lombok.NonNull;

/**
 * Opens one {@link ReplicasConnections} per query.
 *
 * <p>Long-lived and thread-safe (immutable): the pool, default settings, strategy and metrics are
 * shared; every opened set gets its own NIO poller and is owned by the thread that opened it.
 *
 * <pre>{@code
 * try (var replicas = factory.open()) {
 *   replicas.sendQuery(sql, queryId, QueryStage.COMPLETE, factory.getSettings(), false);
 *   Packet packet;
 *   do {
 *     packet = replicas.receivePacket();
 *     ...
 *   } while (!packet.getType().isTerminal());
 * }
 * }</pre>
 */
public final class ReplicasConnectionsFactory {

  private final ConnectionPool pool;
  @Getter private final Settings settings;
  private final ReplicaSelectionStrategy strategy;
  private final ReplicasMetrics metrics;

  public ReplicasConnectionsFactory(
      @NonNull final ConnectionPool pool, @NonNull final Settings settings) {
    this(pool, settings, new LargestPacketNumberStrategy(), Optional.empty());
  }

  public ReplicasConnectionsFactory(
      @NonNull final ConnectionPool pool,
      @NonNull final Settings settings,
      @NonNull final ReplicaSelectionStrategy strategy,
      @NonNull final Optional<ReplicasMetrics> metrics) {
    this.pool = pool;
    this.settings = settings;
    this.strategy = strategy;
    this.metrics = metrics.orElse(ReplicasMetrics.NOOP);
  }

  /** Opens a replica set with the factory's default settings. */
  public ReplicasConnections open() {
    return open(settings);
  }

  /**
   * Opens a replica set with per-query settings (e.g. a shorter poll interval).
   *
   * @param querySettings settings for this query only
   */
  public ReplicasConnections open(@NonNull final Settings querySettings) {
    return new ReplicasConnections(
        pool, querySettings, new NioSocketPoller(), strategy, Optional.of(metrics));
  }

  public String getStrategyName() {
    return strategy.getName();
  }
}
