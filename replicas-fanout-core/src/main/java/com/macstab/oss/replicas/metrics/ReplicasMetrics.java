/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.metrics;

/**
 * Metrics SPI of the replica multiplexer.
 *
 * <p>Core ships no metrics backend. The {@code replicas-fanout-metrics} module provides a
 * Micrometer implementation; without it {@link #NOOP} is used and every call is a no-op.
 *
 * <p>Every method takes the replica set {@code name} ({@link
 * com.macstab.oss.replicas.Settings#getName()}) as a dimension so several shards/clusters can be
 * told apart in one registry.
 *
 * <p><strong>Exception handling requirement:</strong> implementations MUST NOT throw. Calls sit on
 * the receive path and on failure paths (drain, teardown) where an exception would hide the
 * original problem.
 */
public interface ReplicasMetrics extends AutoCloseable {

  /** No-op singleton (all interface defaults). */
  ReplicasMetrics NOOP = new ReplicasMetrics() {};

  /** Why a replica left the valid set. */
  enum InvalidationReason {
    /** End-of-stream or exception packet. */
    TERMINAL,
    /** Packet type not allowed mid-query. */
    MALFORMED,
    /** Closed through {@code disconnect()}. */
    DISCONNECTED
  }

  /**
   * Records that the selection strategy picked a replica.
   *
   * @param name replica set name
   * @param serverAddress address of the picked replica
   * @param strategyName strategy that picked it
   */
  default void recordReplicaSelection(String name, String serverAddress, String strategyName) {
    // No-op by default
  }

  /** Records a packet returned to the caller (advanced the global cursor). */
  default void recordPacketReturned(String name, String packetType) {
    // No-op by default
  }

  /** Records a packet consumed but not returned (out of turn or superseded by a retry). */
  default void recordPacketDiscarded(String name, String packetType) {
    // No-op by default
  }

  default void recordReplicaInvalidated(
      String name, String serverAddress, InvalidationReason reason) {
    // No-op by default
  }

  /**
   * Records one residual drain run.
   *
   * @param name replica set name
   * @param drainedPackets packets consumed and discarded across all replicas
   * @param failures replicas whose stream ended with an error
   */
  default void recordResidualDrain(String name, int drainedPackets, int failures) {
    // No-op by default
  }

  /** Records a readiness poll that found no usable replica. */
  default void recordEmptyPoll(String name) {
    // No-op by default
  }

  /**
   * Records a replica set opened for one query.
   *
   * @param name replica set name
   * @param replicas number of connections handed out by the pool
   */
  default void recordReplicaSetOpened(String name, int replicas) {
    // No-op by default
  }

  /** Records a replica set closed (query finished, failed or was disconnected). */
  default void recordReplicaSetClosed(String name) {
    // No-op by default
  }

  /**
   * Removes all gauges registered for {@code name}.
   *
   * <p>One metrics instance is shared by every replica set with the same name, so this is called
   * by the owner of the metrics (application shutdown), never by a single replica set. MUST NOT
   * throw.
   */
  default void close(String name) {
    // No-op by default
  }

  @Override
  default void close() {
    close("default");
  }
}
