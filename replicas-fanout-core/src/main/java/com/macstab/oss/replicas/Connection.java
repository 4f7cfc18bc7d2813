/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas;

import java.io.IOException;
import java.nio.channels.SelectableChannel;

import com.macstab.oss.replicas.packet.ExternalTablesData;
import com.macstab.oss.replicas.packet.Packet;
import com.macstab.oss.replicas.packet.QueryStage;

/**
 * One established connection to a replica server (native protocol codec).
 *
 * <p>Owned by the {@link ConnectionPool} that handed it out. {@link ReplicasConnections} only
 * borrows it for the duration of one query: it may call {@link #disconnect()} as part of tearing
 * the query down, but never as part of its own {@code close()}.
 *
 * <p><strong>Socket contract:</strong> {@link #getSocket()} must return the same channel for the
 * whole lifetime of the connection, and the channel must be in non-blocking mode so it can be
 * registered with a {@link java.nio.channels.Selector}. The channel identity is the replica's key
 * inside the replica set.
 */
public interface Connection {

  void sendQuery(
      String query, String queryId, QueryStage stage, Settings settings, boolean withPendingData)
      throws IOException;

  void sendCancel() throws IOException;

  /** Closes the underlying socket. Idempotent. */
  void disconnect();

  /**
   * Reads the next packet, blocking until it is fully decoded.
   *
   * @return decoded packet, {@link com.macstab.oss.replicas.packet.PacketType#UNKNOWN} for packet
   *     codes the decoder does not understand
   * @throws IOException if the socket fails or closes mid-packet
   */
  Packet receivePacket() throws IOException;

  void sendExternalTablesData(ExternalTablesData data) throws IOException;

  /** Address for diagnostics, {@code host:port}. */
  String getServerAddress();

  SelectableChannel getSocket();
}
