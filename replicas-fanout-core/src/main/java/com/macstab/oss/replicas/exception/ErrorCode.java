/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.exception;

import lombok.Getter;

/** Error codes surfaced by the replica multiplexer. */
public enum ErrorCode {
  NO_AVAILABLE_REPLICA("No available replica"),
  UNEXPECTED_REPLICA("Unexpected replica"),
  MISMATCH_REPLICAS_DATA_SOURCES("Mismatch between replicas and data sources");

  @Getter private final String defaultMessage;

  ErrorCode(final String defaultMessage) {
    this.defaultMessage = defaultMessage;
  }
}
