/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.exception;

/**
 * The readiness poll reported a socket that belongs to no replica of the set.
 *
 * <p>Means replica bookkeeping is corrupt. Never retried.
 */
public class UnexpectedReplicaException extends ReplicaException {

  private static final long serialVersionUID = 1L;

  public UnexpectedReplicaException(final Object socket) {
    super(
        ErrorCode.UNEXPECTED_REPLICA,
        ErrorCode.UNEXPECTED_REPLICA.getDefaultMessage() + ": " + socket);
  }
}
