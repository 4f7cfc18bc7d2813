/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.packet;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * One message unit read from a replica connection.
 *
 * <p>The multiplexer only looks at {@link #getType()}. The payload is whatever the connection's
 * decoder produced for that type (a data block, a progress record, ...) and is handed through to
 * the caller untouched. {@link PacketType#EXCEPTION} packets carry a {@link ServerException}; end
 * of stream carries nothing.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Packet {

  @NonNull PacketType type;
  Object payload;

  public static Packet of(@NonNull final PacketType type, final Object payload) {
    if (type == PacketType.EXCEPTION && !(payload instanceof ServerException)) {
      throw new IllegalArgumentException("EXCEPTION packet requires a ServerException payload");
    }
    return new Packet(type, payload);
  }

  public static Packet data(final Object block) {
    return new Packet(PacketType.DATA, block);
  }

  public static Packet endOfStream() {
    return new Packet(PacketType.END_OF_STREAM, null);
  }

  public static Packet exception(@NonNull final ServerException exception) {
    return new Packet(PacketType.EXCEPTION, exception);
  }

  /** Server exception carried by this packet, empty unless the type is EXCEPTION. */
  public Optional<ServerException> getException() {
    return type == PacketType.EXCEPTION ? Optional.of((ServerException) payload) : Optional.empty();
  }

  public PacketCategory getCategory() {
    return type.getCategory();
  }
}
