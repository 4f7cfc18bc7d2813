/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.drain;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.replicas.FakeConnection;
import com.macstab.oss.replicas.ReplicaFixtures;
import com.macstab.oss.replicas.packet.Packet;
import com.macstab.oss.replicas.packet.PacketType;
import com.macstab.oss.replicas.packet.ServerException;

/**
 * Tests for {@link ResidualPacketDrainer}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("ResidualPacketDrainer")
class ResidualPacketDrainerTest {

  private final ResidualPacketDrainer drainer = new ResidualPacketDrainer();

  private FakeConnection first;
  private FakeConnection second;

  @BeforeEach
  void setUp() throws IOException {
    first = new FakeConnection("replica-1:9000");
    second = new FakeConnection("replica-2:9000");
  }

  @AfterEach
  void tearDown() throws IOException {
    first.close();
    second.close();
  }

  @Nested
  @DisplayName("Clean Drain")
  class CleanDrain {

    @Test
    @DisplayName("reads every stream up to its end-of-stream packet")
    void drainsToEndOfStream() throws IOException {
      // Arrange
      first.enqueue(
          Packet.data("a"), Packet.of(PacketType.PROGRESS, null), Packet.endOfStream());
      second.enqueue(Packet.endOfStream(), Packet.data("next-query"));

      // Act
      final var result =
          drainer.drain(
              List.of(
                  ReplicaFixtures.replica(first, 0, false),
                  ReplicaFixtures.replica(second, 0, false)));

      // Assert: stops at the terminal packet, nothing past it is read
      assertThat(result.isClean()).isTrue();
      assertThat(result.getDrainedReplicas()).isEqualTo(2);
      assertThat(result.getDrainedPackets()).isEqualTo(4);
      assertThat(first.pendingPackets()).isZero();
      assertThat(second.pendingPackets()).isEqualTo(1);
    }

    @Test
    @DisplayName("skips invalid replicas")
    void skipsInvalidReplicas() throws IOException {
      first.enqueue(Packet.data("a"));
      second.enqueue(Packet.endOfStream());

      final var result =
          drainer.drain(
              List.of(
                  ReplicaFixtures.invalidReplica(first, 1),
                  ReplicaFixtures.replica(second, 0, false)));

      assertThat(result.getDrainedReplicas()).isEqualTo(1);
      assertThat(first.getReceivedCount()).isZero();
      assertThat(result.isClean()).isTrue();
    }

    @Test
    @DisplayName("leaves validity and packet counters untouched")
    void leavesBookkeepingAlone() throws IOException {
      first.enqueue(Packet.data("a"), Packet.endOfStream());
      final var replica = ReplicaFixtures.replica(first, 7, false);

      drainer.drain(List.of(replica));

      assertThat(replica.isValid()).isTrue();
      assertThat(replica.getNextPacketNumber()).isEqualTo(7);
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("collects a server exception and keeps draining the other replicas")
    void collectsServerException() throws IOException {
      // Arrange
      final var error =
          new ServerException(394, "QUERY_WAS_CANCELLED", "Query was cancelled", "replica-1:9000");
      first.enqueue(Packet.data("a"), Packet.exception(error));
      second.enqueue(Packet.data("b"), Packet.endOfStream());

      // Act
      final var result =
          drainer.drain(
              List.of(
                  ReplicaFixtures.replica(first, 0, false),
                  ReplicaFixtures.replica(second, 0, false)));

      // Assert
      assertThat(second.pendingPackets()).isZero();
      assertThat(result.getFailure())
          .hasValueSatisfying(
              failure -> {
                assertThat(failure.getFailedReplicas()).containsExactly("replica-1:9000");
                assertThat(failure.getSuppressed()).containsExactly(error);
                assertThat(failure)
                    .hasMessage(
                        "Residual drain finished with errors on 1 replica(s): replica-1:9000");
              });
    }

    @Test
    @DisplayName("stops a replica on an unrecognized packet")
    void stopsOnUnrecognizedPacket() throws IOException {
      first.enqueue(Packet.of(PacketType.HELLO, null), Packet.endOfStream());

      final var result = drainer.drain(List.of(ReplicaFixtures.replica(first, 0, false)));

      assertThat(first.pendingPackets()).isEqualTo(1);
      assertThat(result.getFailure()).isPresent();
      assertThat(result.getFailure().get().getSuppressed()[0])
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("HELLO")
          .hasMessageContaining("replica-1:9000");
    }

    @Test
    @DisplayName("records I/O failures of every broken replica")
    void recordsIoFailures() {
      first.failReceiveWith(new IOException("connection reset"));
      second.failReceiveWith(new IOException("timeout"));

      final var result =
          drainer.drain(
              List.of(
                  ReplicaFixtures.replica(first, 0, false),
                  ReplicaFixtures.replica(second, 0, false)));

      assertThat(result.getDrainedPackets()).isZero();
      assertThat(result.getFailure().get().getFailedReplicas())
          .containsExactly("replica-1:9000", "replica-2:9000");
      assertThat(result.getFailure().get().getSuppressed())
          .extracting(Throwable::getMessage)
          .containsExactly("connection reset", "timeout");
    }
  }
}
