/* (C)2026 Macstab GmbH */

/**
 * Replica multiplexer core (NO Spring dependencies).
 *
 * <h2>Purpose</h2>
 *
 * <p>Sends one query to several replicas of a shard and reads their answers back as a single,
 * ordered packet stream. Whichever replica answers first serves the next packet; slow or failing
 * replicas are skipped without the caller noticing.
 *
 * <h2>Core Problem: Positional Protocol, Redundant Streams</h2>
 *
 * <p>The native protocol has no request IDs and no packet sequence numbers. Every replica produces
 * the same packet sequence for the same query, but at its own pace:
 *
 * <pre>{@code
 * replica-1: [Data 0] [Data 1]             [EndOfStream]
 * replica-2:          [Data 0] [Data 1] [Data 2] [EndOfStream]
 *
 * caller must see: Data 0, Data 1, Data 2, EndOfStream (each exactly once)
 * }</pre>
 *
 * <h2>Solution: Sequence Cursors</h2>
 *
 * <p>{@link com.macstab.oss.replicas.ReplicasConnections} counts the packets read from every
 * {@link com.macstab.oss.replicas.Replica} and the packets returned to the caller. A packet is
 * returned only when the two counters match; the readiness poll ({@link
 * com.macstab.oss.replicas.readiness.SocketPoller}) and the selection strategy ({@link
 * com.macstab.oss.replicas.strategy.LargestPacketNumberStrategy}) decide which replica is read
 * next.
 *
 * <h2>Key Components</h2>
 *
 * <dl>
 *   <dt>{@link com.macstab.oss.replicas.ReplicasConnections}
 *   <dd>Per-query replica set: broadcast, ordered receive, cancel, drain, disconnect.
 *   <dt>{@link com.macstab.oss.replicas.ReplicasConnectionsFactory}
 *   <dd>Opens replica sets from a {@link com.macstab.oss.replicas.ConnectionPool}.
 *   <dt>{@link com.macstab.oss.replicas.drain.ResidualPacketDrainer}
 *   <dd>Flushes cancelled replicas so their connections can be reused.
 *   <dt>{@link com.macstab.oss.replicas.metrics.ReplicasMetrics}
 *   <dd>Metrics SPI, no-op unless {@code replicas-fanout-metrics} is present.
 * </dl>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>A replica set belongs to the thread that opened it (checked). Factories, strategies and
 * metrics are shared and thread-safe.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
package com.macstab.oss.replicas;
