/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.exception;

import lombok.Getter;
import lombok.NonNull;

/** Base class of every caller-visible failure of the replica multiplexer. */
public abstract class ReplicaException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  @Getter private final ErrorCode errorCode;

  protected ReplicaException(@NonNull final ErrorCode errorCode, @NonNull final String message) {
    super(message);
    this.errorCode = errorCode;
  }
}
