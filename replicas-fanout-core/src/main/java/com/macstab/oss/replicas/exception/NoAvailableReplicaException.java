/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.exception;

/**
 * No replica was both valid and readable after one readiness poll.
 *
 * <p>Recoverable: the caller may retry {@code receivePacket()} under its own overall query timeout.
 * Once every replica is invalid a retry fails again immediately, so callers must stop.
 */
public class NoAvailableReplicaException extends ReplicaException {

  private static final long serialVersionUID = 1L;

  public NoAvailableReplicaException(final int validReplicas) {
    super(
        ErrorCode.NO_AVAILABLE_REPLICA,
        ErrorCode.NO_AVAILABLE_REPLICA.getDefaultMessage()
            + " (valid replicas: "
            + validReplicas
            + ")");
  }
}
