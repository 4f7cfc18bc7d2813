/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.packet;

import lombok.Getter;
import lombok.NonNull;

/**
 * Exception reported by a replica server inside an {@link PacketType#EXCEPTION} packet.
 *
 * <p>Not thrown by the multiplexer itself. It travels as packet payload to the caller, who decides
 * whether to rethrow it, and is collected into a {@link
 * com.macstab.oss.replicas.drain.ResidualDrainException} when seen during a residual drain.
 */
@Getter
public class ServerException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final int code;
  private final String name;
  private final String serverAddress;

  public ServerException(
      final int code,
      @NonNull final String name,
      @NonNull final String message,
      @NonNull final String serverAddress) {
    super(String.format("Code: %d, %s: %s (from %s)", code, name, message, serverAddress));
    this.code = code;
    this.name = name;
    this.serverAddress = serverAddress;
  }
}
