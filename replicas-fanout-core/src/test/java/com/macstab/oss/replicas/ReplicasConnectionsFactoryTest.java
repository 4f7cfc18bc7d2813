/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.replicas.exception.NoAvailableReplicaException;
import com.macstab.oss.replicas.metrics.ReplicasMetrics;
import com.macstab.oss.replicas.packet.Packet;
import com.macstab.oss.replicas.packet.PacketType;
import com.macstab.oss.replicas.packet.QueryStage;
import com.macstab.oss.replicas.strategy.LargestPacketNumberStrategy;

/**
 * Tests for {@link ReplicasConnectionsFactory}, end to end over the real NIO poller.
 *
 * <p>Replicas are pipe-backed {@link FakeConnection}s, so readiness comes from an actual {@link
 * java.nio.channels.Selector} rather than a script.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("ReplicasConnectionsFactory")
class ReplicasConnectionsFactoryTest {

  private static final Duration POLL = Duration.ofMillis(200);

  private FakeConnection r1;
  private FakeConnection r2;
  private List<Settings> requested;
  private ConnectionPool pool;

  @BeforeEach
  void setUp() throws IOException {
    r1 = new FakeConnection("replica-1:9000");
    r2 = new FakeConnection("replica-2:9000");
    requested = new ArrayList<>();
    pool =
        settings -> {
          requested.add(settings);
          return List.of(r1, r2);
        };
  }

  @AfterEach
  void tearDown() throws IOException {
    r1.close();
    r2.close();
  }

  @Nested
  @DisplayName("Opening")
  class Opening {

    @Test
    @DisplayName("asks the pool with the factory settings")
    void usesFactorySettings() {
      final var settings = Settings.builder().name("shard-1").pollInterval(POLL).build();
      final var factory = new ReplicasConnectionsFactory(pool, settings);

      try (var connections = factory.open()) {
        assertThat(connections.getReplicaCount()).isEqualTo(2);
        assertThat(requested).containsExactly(settings);
      }
    }

    @Test
    @DisplayName("asks the pool with per-query settings")
    void usesQuerySettings() {
      final var factory = new ReplicasConnectionsFactory(pool, Settings.defaults());
      final var querySettings = Settings.withPollInterval(POLL);

      try (var connections = factory.open(querySettings)) {
        assertThat(requested).containsExactly(querySettings);
      }
    }

    @Test
    @DisplayName("hands its metrics to every opened set")
    void passesMetrics() {
      final var metrics = mock(ReplicasMetrics.class);
      final var settings = Settings.builder().name("shard-1").pollInterval(POLL).build();
      final var factory =
          new ReplicasConnectionsFactory(
              pool, settings, new LargestPacketNumberStrategy(), Optional.of(metrics));

      factory.open().close();

      verify(metrics).recordReplicaSetOpened("shard-1", 2);
      verify(metrics).recordReplicaSetClosed("shard-1");
      assertThat(factory.getStrategyName()).isEqualTo(LargestPacketNumberStrategy.NAME);
    }
  }

  @Nested
  @DisplayName("Real Readiness")
  class RealReadiness {

    @Test
    @DisplayName("streams one query in order through the NIO poller")
    void streamsQuery() throws IOException {
      // Arrange: replica 2 streams, replica 1 stays silent until it is cancelled
      r2.enqueue(Packet.data("b0"), Packet.data("b1"), Packet.endOfStream());
      r1.respondToCancelWith(Packet.endOfStream());
      final var factory = new ReplicasConnectionsFactory(pool, Settings.withPollInterval(POLL));

      try (var connections = factory.open()) {
        connections.sendQuery("SELECT 1", "q-1", QueryStage.COMPLETE, factory.getSettings(), false);

        // Act
        final List<Packet> stream = new ArrayList<>();
        Packet packet;
        do {
          packet = connections.receivePacket();
          stream.add(packet);
        } while (!packet.getType().isTerminal());

        // Assert
        assertThat(stream)
            .extracting(Packet::getType)
            .containsExactly(PacketType.DATA, PacketType.DATA, PacketType.END_OF_STREAM);
        assertThat(r1.getQueries()).containsExactly("SELECT 1");
        assertThat(r1.getCancelCount()).isEqualTo(1);
        assertThat(r1.pendingPackets()).isZero();
        assertThat(connections.getLastDrainFailure()).isEmpty();
      }
    }

    @Test
    @DisplayName("times out when no replica sends anything")
    void timesOutOnSilence() {
      final var factory = new ReplicasConnectionsFactory(pool, Settings.withPollInterval(POLL));

      try (var connections = factory.open()) {
        assertThatThrownBy(connections::receivePacket)
            .isInstanceOf(NoAvailableReplicaException.class)
            .hasMessageContaining("valid replicas: 2");
      }
    }
  }
}
