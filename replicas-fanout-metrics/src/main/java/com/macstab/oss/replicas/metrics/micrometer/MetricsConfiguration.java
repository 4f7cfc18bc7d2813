/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Metric names and tag keys of the Micrometer integration.
 *
 * <p><strong>Naming Convention:</strong> {@code replicas.fanout.*}. Micrometer's naming
 * conventions translate the dots per backend:
 *
 * <pre>
 * replicas.fanout.packets.returned → replicas_fanout_packets_returned_total
 * replicas.fanout.sets.active      → replicas_fanout_sets_active
 * </pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class MetricsConfiguration {

  /** Metric name prefix. */
  public static final String PREFIX = "replicas.fanout";

  /**
   * Replica picks of the selection strategy.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code server.address}, {@code
   * strategy.name}
   *
   * <p><strong>Usage:</strong> Shows which replicas actually serve queries (a replica that is never
   * picked is slow or broken).
   */
  public static final String REPLICA_SELECTIONS = PREFIX + ".replica.selections";

  /**
   * Packets returned to the caller.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code packet.type}
   */
  public static final String PACKETS_RETURNED = PREFIX + ".packets.returned";

  /**
   * Packets read but not returned (duplicate positions, dropped malformed packets).
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code packet.type}
   *
   * <p><strong>Usage:</strong> Ratio to {@link #PACKETS_RETURNED} is the cost of reading replicas
   * redundantly.
   */
  public static final String PACKETS_DISCARDED = PREFIX + ".packets.discarded";

  /**
   * Replicas leaving the valid set.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code server.address}, {@code reason}
   * (terminal, malformed, disconnected)
   */
  public static final String REPLICA_INVALIDATIONS = PREFIX + ".replica.invalidations";

  /** Residual drain runs. Counter, tag {@code connection.name}. */
  public static final String DRAIN_RUNS = PREFIX + ".drain.runs";

  /** Packets consumed by residual drains. Counter, tag {@code connection.name}. */
  public static final String DRAIN_PACKETS = PREFIX + ".drain.packets";

  /** Replicas whose drain ended with an error. Counter, tag {@code connection.name}. */
  public static final String DRAIN_FAILURES = PREFIX + ".drain.failures";

  /**
   * Readiness polls without a usable replica.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Usage:</strong> Each one surfaced as {@code NoAvailableReplicaException}; a rising
   * rate means replicas answer slower than the poll interval.
   */
  public static final String EMPTY_POLLS = PREFIX + ".poll.empty";

  /** Replica sets opened. Counter, tag {@code connection.name}. */
  public static final String SETS_OPENED = PREFIX + ".sets.opened";

  /** Replicas handed out by the pool, summed over all sets. Counter. */
  public static final String SETS_REPLICAS = PREFIX + ".sets.replicas";

  /**
   * Replica sets currently open.
   *
   * <p><strong>Type:</strong> Gauge
   *
   * <p><strong>Usage:</strong> Concurrent fan-out queries. Must return to zero when idle, otherwise
   * sets are leaked without {@code close()}.
   */
  public static final String SETS_ACTIVE = PREFIX + ".sets.active";

  // Tag keys
  public static final String TAG_CONNECTION_NAME = "connection.name";
  public static final String TAG_SERVER_ADDRESS = "server.address";
  public static final String TAG_STRATEGY_NAME = "strategy.name";
  public static final String TAG_PACKET_TYPE = "packet.type";
  public static final String TAG_REASON = "reason";
}
