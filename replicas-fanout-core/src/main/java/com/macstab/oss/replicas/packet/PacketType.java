/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.packet;

import static com.macstab.oss.replicas.packet.PacketCategory.STREAMABLE;
import static com.macstab.oss.replicas.packet.PacketCategory.TERMINAL;
import static com.macstab.oss.replicas.packet.PacketCategory.UNRECOGNIZED;

import lombok.Getter;

/**
 * Server-to-client packet types of the native protocol.
 *
 * <p>Wire codes are the ones the server writes as the first varint of every packet. Any code not
 * listed here decodes to {@link #UNKNOWN}.
 *
 * <pre>
 * code  type          category
 * ----  ------------  ------------
 *   0   HELLO         UNRECOGNIZED (handshake only, never valid mid-query)
 *   1   DATA          STREAMABLE
 *   2   EXCEPTION     TERMINAL
 *   3   PROGRESS      STREAMABLE
 *   4   PONG          UNRECOGNIZED (ping reply, never valid mid-query)
 *   5   END_OF_STREAM TERMINAL
 *   6   PROFILE_INFO  STREAMABLE
 *   7   TOTALS        STREAMABLE
 *   8   EXTREMES      STREAMABLE
 *  -1   UNKNOWN       UNRECOGNIZED
 * </pre>
 */
public enum PacketType {
  HELLO(0, UNRECOGNIZED),
  DATA(1, STREAMABLE),
  EXCEPTION(2, TERMINAL),
  PROGRESS(3, STREAMABLE),
  PONG(4, UNRECOGNIZED),
  END_OF_STREAM(5, TERMINAL),
  PROFILE_INFO(6, STREAMABLE),
  TOTALS(7, STREAMABLE),
  EXTREMES(8, STREAMABLE),
  UNKNOWN(-1, UNRECOGNIZED);

  private static final PacketType[] BY_CODE = new PacketType[9];

  static {
    for (final var type : values()) {
      if (type.code >= 0) {
        BY_CODE[type.code] = type;
      }
    }
  }

  @Getter private final int code;
  @Getter private final PacketCategory category;

  PacketType(final int code, final PacketCategory category) {
    this.code = code;
    this.category = category;
  }

  /**
   * Decodes a wire code.
   *
   * @param code packet type code read from the wire
   * @return matching type, {@link #UNKNOWN} for codes outside the protocol
   */
  public static PacketType fromCode(final int code) {
    if (code < 0 || code >= BY_CODE.length) {
      return UNKNOWN;
    }
    return BY_CODE[code];
  }

  public boolean isStreamable() {
    return category == STREAMABLE;
  }

  public boolean isTerminal() {
    return category == TERMINAL;
  }
}
