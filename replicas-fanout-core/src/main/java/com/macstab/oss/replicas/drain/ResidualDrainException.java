/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.drain;

import java.util.List;

import lombok.Getter;
import lombok.NonNull;

/**
 * Aggregate of the errors seen while draining replicas after a terminal packet.
 *
 * <p>Each failing replica contributes one suppressed exception: the {@link
 * com.macstab.oss.replicas.packet.ServerException} it sent, an {@link java.io.IOException} from
 * its socket, or an {@link IllegalStateException} describing an unrecognized packet.
 *
 * <p>Not thrown by the multiplexer. The drain runs while the terminal packet that triggered it is
 * still waiting to be returned to the caller, and throwing would lose that packet. The aggregate is
 * logged and kept on the replica set instead ({@code ReplicasConnections#getLastDrainFailure()}).
 */
public class ResidualDrainException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  @Getter private final List<String> failedReplicas;

  ResidualDrainException(
      @NonNull final List<String> failedReplicas, @NonNull final List<Throwable> causes) {
    super(
        "Residual drain finished with errors on "
            + failedReplicas.size()
            + " replica(s): "
            + String.join(";", failedReplicas),
        null,
        true,
        false);
    this.failedReplicas = List.copyOf(failedReplicas);
    causes.forEach(this::addSuppressed);
  }
}
