/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.strategy;

import java.util.Collection;
import java.util.Optional;

import com.macstab.oss.replicas.Replica;

/**
 * Picks which ready replica the multiplexer reads its next packet from.
 *
 * <p><strong>Contract:</strong>
 *
 * <ul>
 *   <li>Only replicas with {@link Replica#isSelectable()} (valid AND readable in the last poll)
 *       may be returned. Validity can change between poll and pick, so implementations MUST
 *       re-check it rather than trust the poll result.
 *   <li>Deterministic for a given iteration order: the multiplexer iterates replicas in the order
 *       the pool handed them out, and tests depend on reproducible picks.
 *   <li>Returns empty when no replica is selectable. The multiplexer turns that into {@link
 *       com.macstab.oss.replicas.exception.NoAvailableReplicaException}.
 * </ul>
 *
 * <p>Called once per pick from the replica set's owner thread. No synchronization needed.
 *
 * @see LargestPacketNumberStrategy
 */
public interface ReplicaSelectionStrategy {

  /**
   * Selects the replica to read from.
   *
   * @param replicas all replicas of the set in iteration order, valid or not
   * @return chosen replica, empty if none is selectable
   */
  Optional<Replica> select(Collection<Replica> replicas);

  /**
   * Returns strategy name for logging/metrics.
   *
   * @return strategy name (e.g. "largest-packet-number")
   */
  String getName();
}
