/* (C)2026 Macstab GmbH */

/**
 * Micrometer metrics for the replica multiplexer.
 *
 * <h2>Quick Start</h2>
 *
 * <p>Add {@code replicas-fanout-metrics} next to Spring Boot Actuator. Metrics activate when a
 * {@code MeterRegistry} bean exists:
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     replicas-fanout:
 *       enabled: true  # default
 * }</pre>
 *
 * <h2>Prometheus Output Example</h2>
 *
 * <pre>
 * replicas_fanout_packets_returned_total{connection_name="shard-1",packet_type="DATA"} 18342
 * replicas_fanout_packets_discarded_total{connection_name="shard-1",packet_type="DATA"} 912
 * replicas_fanout_replica_invalidations_total{reason="malformed",server_address="r2:9000"} 1
 * replicas_fanout_sets_active{connection_name="shard-1"} 4
 * </pre>
 *
 * <h2>Operational Alerts</h2>
 *
 * <pre>
 * # Replicas answer slower than the poll interval
 * - alert: ReplicasFanoutEmptyPolls
 *   expr: rate(replicas_fanout_poll_empty_total[5m]) > 0
 *   for: 5m
 *
 * # Cancelled replicas do not end cleanly (connections may be unusable)
 * - alert: ReplicasFanoutDrainFailures
 *   expr: increase(replicas_fanout_drain_failures_total[15m]) > 0
 * </pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 * @see com.macstab.oss.replicas.metrics.micrometer.MicrometerReplicasMetrics
 */
package com.macstab.oss.replicas.metrics.micrometer;
