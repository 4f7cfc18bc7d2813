/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.packet;

/**
 * How the replica multiplexer treats a packet type.
 *
 * <ul>
 *   <li>{@link #STREAMABLE}: part of the result stream, replica stays valid
 *   <li>{@link #TERMINAL}: ends the replica's contribution (end-of-stream or server exception)
 *   <li>{@link #UNRECOGNIZED}: not expected while a query is running, replica is considered broken
 * </ul>
 */
public enum PacketCategory {
  STREAMABLE,
  TERMINAL,
  UNRECOGNIZED
}
