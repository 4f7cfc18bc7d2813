/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.strategy;

import java.util.Collection;
import java.util.Optional;

import com.macstab.oss.replicas.Replica;

/**
 * Picks the ready replica that is furthest ahead in its own packet stream.
 *
 * <p><strong>Why the largest {@code nextPacketNumber} wins:</strong>
 *
 * <p>The multiplexer returns a packet only when the replica's own counter equals the global
 * cursor. The replica that produced the last returned packet sits exactly on the cursor, every
 * other replica is behind it. Preferring the leader keeps serving from the same stream with zero
 * discarded packets; a lagging replica only takes over when the leader is not readable (or is
 * gone), and then skips its already-delivered prefix.
 *
 * <pre>
 * global cursor = 3
 * replica A: next = 3, readable   ← picked, packet 3 returned directly
 * replica B: next = 1, readable     (would discard 2 packets first)
 * replica C: next = 2, not ready
 * </pre>
 *
 * <p><strong>Ties:</strong> first selectable replica in iteration order wins (strict {@code >}
 * comparison), e.g. all replicas at 0 right after {@code sendQuery}.
 *
 * <p>Stateless, O(N) scan over the replica set (N is the number of parallel replicas, usually 2
 * to 3).
 */
public final class LargestPacketNumberStrategy implements ReplicaSelectionStrategy {

  public static final String NAME = "largest-packet-number";

  @Override
  public Optional<Replica> select(final Collection<Replica> replicas) {
    Replica best = null;
    for (final var replica : replicas) {
      if (!replica.isSelectable()) {
        continue;
      }
      if (best == null || replica.getNextPacketNumber() > best.getNextPacketNumber()) {
        best = replica;
      }
    }
    return Optional.ofNullable(best);
  }

  @Override
  public String getName() {
    return NAME;
  }
}
