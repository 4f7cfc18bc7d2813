/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.drain;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.macstab.oss.replicas.Replica;
import com.macstab.oss.replicas.packet.PacketType;

import lombok.extern.slf4j.Slf4j;

/**
 * Flushes the remaining packets of every still-valid replica after the query was cancelled.
 *
 * <p><strong>Why drain at all (protocol desynchronization):</strong>
 *
 * <p>The native protocol has no request IDs. After a cancel, the server still sends whatever it had
 * in flight followed by a terminal packet. If those packets stay in the socket, the next reader of
 * the connection (the pool hands it to another query) decodes them as the answer to its own
 * request. Reading each stream up to its terminal packet leaves every socket on a packet boundary
 * with nothing buffered.
 *
 * <pre>
 * replica stream after cancel:  [Data] [Progress] [Data] [EndOfStream]
 *                                 discard  discard  discard  stop (clean)
 *
 * replica stream after cancel:  [Data] [Exception]
 *                                 discard  stop (failure recorded)
 * </pre>
 *
 * <p>Streamable packets are discarded. EndOfStream stops cleanly. Exception, any unrecognized type
 * or an {@link IOException} stops with a recorded failure; the drain moves on to the next replica
 * either way.
 *
 * <p>Validity and packet counters are left alone: the whole replica set is discarded on this path,
 * so bookkeeping no longer matters, and leaving it untouched keeps the drain a pure flush.
 *
 * <p>Blocks on {@link com.macstab.oss.replicas.Connection#receivePacket()}. Only call after a
 * cancel was sent, otherwise a long-running query keeps the drain busy until it completes.
 */
@Slf4j
public final class ResidualPacketDrainer {

  /**
   * Drains every valid replica in iteration order.
   *
   * @param replicas replica set, invalid entries are skipped
   * @return packet count and aggregated failures
   */
  public DrainResult drain(final Collection<Replica> replicas) {
    int drainedReplicas = 0;
    int drainedPackets = 0;
    final List<String> failedReplicas = new ArrayList<>();
    final List<Throwable> failures = new ArrayList<>();

    for (final var replica : replicas) {
      if (!replica.isValid()) {
        continue;
      }
      drainedReplicas++;

      final var connection = replica.getConnection();
      final var address = connection.getServerAddress();
      boolean again = true;

      while (again) {
        try {
          final var packet = connection.receivePacket();
          drainedPackets++;

          switch (packet.getCategory()) {
            case STREAMABLE:
              break;

            case TERMINAL:
              again = false;
              if (packet.getType() == PacketType.EXCEPTION) {
                failedReplicas.add(address);
                failures.add(packet.getException().orElseThrow());
              }
              break;

            default:
              again = false;
              failedReplicas.add(address);
              failures.add(
                  new IllegalStateException(
                      "Unexpected packet " + packet.getType() + " from replica " + address));
              break;
          }
        } catch (final IOException e) {
          again = false;
          failedReplicas.add(address);
          failures.add(e);
        }
      }
    }

    if (log.isDebugEnabled()) {
      log.debug(
          "Drained {} packets from {} replicas ({} failed)",
          drainedPackets,
          drainedReplicas,
          failedReplicas.size());
    }

    final Optional<ResidualDrainException> failure =
        failedReplicas.isEmpty()
            ? Optional.empty()
            : Optional.of(new ResidualDrainException(failedReplicas, failures));

    return new DrainResult(drainedReplicas, drainedPackets, failure);
  }
}
