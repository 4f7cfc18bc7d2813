/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;

/**
 * Per-connection state of one replica inside a {@link ReplicasConnections} set.
 *
 * <p>Mutators are package-private: only the owning {@link ReplicasConnections} changes state, on
 * its owner thread. Transitions are one-way where it matters:
 *
 * <ul>
 *   <li>{@code valid}: {@code true} until a terminal or malformed packet, then {@code false}
 *       forever
 *   <li>{@code nextPacketNumber}: starts at 0, {@code +1} per consumed packet, never decreases
 *   <li>{@code canRead}: recomputed on every readiness poll, meaningless once invalid
 * </ul>
 */
@FieldDefaults(level = AccessLevel.PRIVATE)
public final class Replica {

  /** Borrowed. Never closed by the replica set on teardown. */
  @Getter final Connection connection;

  @Getter boolean valid = true;
  boolean canRead;
  @Getter long nextPacketNumber;

  Replica(@NonNull final Connection connection) {
    this.connection = connection;
  }

  /**
   * Marks the replica invalid.
   *
   * @return {@code true} if this call made the transition, {@code false} if already invalid
   */
  boolean invalidate() {
    if (!valid) {
      return false;
    }
    valid = false;
    canRead = false;
    return true;
  }

  /** Readable in the most recent poll. */
  public boolean canRead() {
    return canRead;
  }

  void setCanRead(final boolean canRead) {
    this.canRead = canRead;
  }

  void advance() {
    nextPacketNumber++;
  }

  /** Ready in the last poll and still valid (validity may change between poll and pick). */
  public boolean isSelectable() {
    return valid && canRead;
  }

  @Override
  public String toString() {
    return String.format(
        "Replica[%s, valid=%s, canRead=%s, next=%d]",
        connection.getServerAddress(), valid, canRead, nextPacketNumber);
  }
}
