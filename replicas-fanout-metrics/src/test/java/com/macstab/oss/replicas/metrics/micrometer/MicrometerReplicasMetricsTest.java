/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.metrics.micrometer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.replicas.metrics.ReplicasMetrics.InvalidationReason;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link MicrometerReplicasMetrics}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>{@link SimpleMeterRegistry} (in-memory, no export)
 *   <li>Meters looked up by name and tags after recording
 *   <li>AAA pattern (Arrange, Act, Assert)
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("MicrometerReplicasMetrics")
class MicrometerReplicasMetricsTest {

  private static final String SHARD = "shard-1";

  private SimpleMeterRegistry registry;
  private MicrometerReplicasMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new MicrometerReplicasMetrics(registry);
  }

  private double counter(final String name, final String... tags) {
    return registry.get(name).tags(tags).counter().count();
  }

  @Nested
  @DisplayName("Construction")
  class Construction {

    @Test
    @DisplayName("rejects a null registry")
    void rejectsNullRegistry() {
      assertThatNullPointerException().isThrownBy(() -> new MicrometerReplicasMetrics(null));
    }

    @Test
    @DisplayName("rejects a non-positive cache size")
    void rejectsInvalidCacheSize() {
      assertThatIllegalArgumentException()
          .isThrownBy(() -> new MicrometerReplicasMetrics(registry, 0))
          .withMessageContaining("maxCacheSize");
    }
  }

  @Nested
  @DisplayName("Receive Path")
  class ReceivePath {

    @Test
    @DisplayName("counts replica selections per replica and strategy")
    void countsSelections() {
      // Act
      metrics.recordReplicaSelection(SHARD, "replica-1:9000", "largest-packet-number");
      metrics.recordReplicaSelection(SHARD, "replica-1:9000", "largest-packet-number");
      metrics.recordReplicaSelection(SHARD, "replica-2:9000", "largest-packet-number");

      // Assert
      assertThat(
              counter(
                  MetricsConfiguration.REPLICA_SELECTIONS,
                  "connection.name",
                  SHARD,
                  "server.address",
                  "replica-1:9000",
                  "strategy.name",
                  "largest-packet-number"))
          .isEqualTo(2.0);
      assertThat(
              counter(
                  MetricsConfiguration.REPLICA_SELECTIONS, "server.address", "replica-2:9000"))
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("counts returned and discarded packets by type")
    void countsPackets() {
      metrics.recordPacketReturned(SHARD, "DATA");
      metrics.recordPacketReturned(SHARD, "END_OF_STREAM");
      metrics.recordPacketDiscarded(SHARD, "DATA");

      assertThat(counter(MetricsConfiguration.PACKETS_RETURNED, "packet.type", "DATA"))
          .isEqualTo(1.0);
      assertThat(counter(MetricsConfiguration.PACKETS_RETURNED, "packet.type", "END_OF_STREAM"))
          .isEqualTo(1.0);
      assertThat(counter(MetricsConfiguration.PACKETS_DISCARDED, "connection.name", SHARD))
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("tags invalidations with a lower-case reason")
    void tagsInvalidationReason() {
      metrics.recordReplicaInvalidated(SHARD, "replica-1:9000", InvalidationReason.MALFORMED);

      assertThat(counter(MetricsConfiguration.REPLICA_INVALIDATIONS, "reason", "malformed"))
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("counts empty polls")
    void countsEmptyPolls() {
      metrics.recordEmptyPoll(SHARD);
      metrics.recordEmptyPoll(SHARD);

      assertThat(counter(MetricsConfiguration.EMPTY_POLLS, "connection.name", SHARD))
          .isEqualTo(2.0);
    }

    @Test
    @DisplayName("tolerates missing tag values")
    void toleratesNullTags() {
      metrics.recordReplicaSelection(SHARD, null, "largest-packet-number");

      assertThat(counter(MetricsConfiguration.REPLICA_SELECTIONS, "server.address", "unknown"))
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Residual Drain")
  class ResidualDrain {

    @Test
    @DisplayName("accumulates runs, packets and failures")
    void accumulatesDrains() {
      metrics.recordResidualDrain(SHARD, 5, 0);
      metrics.recordResidualDrain(SHARD, 3, 1);

      assertThat(counter(MetricsConfiguration.DRAIN_RUNS, "connection.name", SHARD))
          .isEqualTo(2.0);
      assertThat(counter(MetricsConfiguration.DRAIN_PACKETS, "connection.name", SHARD))
          .isEqualTo(8.0);
      assertThat(counter(MetricsConfiguration.DRAIN_FAILURES, "connection.name", SHARD))
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("skips negative counts")
    void skipsNegativeCounts() {
      metrics.recordResidualDrain(SHARD, -1, 0);

      assertThat(registry.find(MetricsConfiguration.DRAIN_RUNS).counter()).isNull();
    }
  }

  @Nested
  @DisplayName("Replica Sets")
  class ReplicaSets {

    @Test
    @DisplayName("tracks open sets per name")
    void tracksActiveSets() {
      // Act
      metrics.recordReplicaSetOpened(SHARD, 3);
      metrics.recordReplicaSetOpened(SHARD, 2);
      metrics.recordReplicaSetOpened("shard-2", 3);
      metrics.recordReplicaSetClosed(SHARD);

      // Assert
      assertThat(
              registry
                  .get(MetricsConfiguration.SETS_ACTIVE)
                  .tag("connection.name", SHARD)
                  .gauge()
                  .value())
          .isEqualTo(1.0);
      assertThat(counter(MetricsConfiguration.SETS_OPENED, "connection.name", SHARD))
          .isEqualTo(2.0);
      assertThat(counter(MetricsConfiguration.SETS_REPLICAS, "connection.name", SHARD))
          .isEqualTo(5.0);
    }

    @Test
    @DisplayName("never drops the open-set gauge below zero")
    void gaugeNeverNegative() {
      metrics.recordReplicaSetClosed(SHARD);

      assertThat(registry.get(MetricsConfiguration.SETS_ACTIVE).gauge().value()).isZero();
    }
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("close(name) removes only that name's gauges")
    void closeByName() {
      metrics.recordReplicaSetOpened(SHARD, 1);
      metrics.recordReplicaSetOpened("shard-2", 1);

      metrics.close(SHARD);

      assertThat(
              registry
                  .find(MetricsConfiguration.SETS_ACTIVE)
                  .tag("connection.name", SHARD)
                  .gauge())
          .isNull();
      assertThat(
              registry
                  .find(MetricsConfiguration.SETS_ACTIVE)
                  .tag("connection.name", "shard-2")
                  .gauge())
          .isNotNull();
    }

    @Test
    @DisplayName("close() removes every gauge and ignores later calls")
    void closeAll() {
      metrics.recordReplicaSetOpened(SHARD, 1);

      metrics.close();
      metrics.close();
      metrics.recordEmptyPoll(SHARD);

      assertThat(registry.find(MetricsConfiguration.SETS_ACTIVE).gauge()).isNull();
      assertThat(registry.find(MetricsConfiguration.EMPTY_POLLS).counter()).isNull();
    }
  }
}
