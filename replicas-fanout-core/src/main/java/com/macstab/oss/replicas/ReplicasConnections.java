/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas;

import java.io.IOException;
import java.nio.channels.SelectableChannel;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

import com.macstab.oss.replicas.drain.ResidualDrainException;
import com.macstab.oss.replicas.drain.ResidualPacketDrainer;
import com.macstab.oss.replicas.exception.MismatchReplicasDataSourcesException;
import com.macstab.oss.replicas.exception.NoAvailableReplicaException;
import com.macstab.oss.replicas.exception.UnexpectedReplicaException;
import com.macstab.oss.replicas.metrics.ReplicasMetrics;
import com.macstab.oss.replicas.metrics.ReplicasMetrics.InvalidationReason;
import com.macstab.oss.replicas.packet.ExternalTablesData;
import com.macstab.oss.replicas.packet.Packet;
import com.macstab.oss.replicas.packet.QueryStage;
import com.macstab.oss.replicas.readiness.NioSocketPoller;
import com.macstab.oss.replicas.readiness.SocketPoller;
import com.macstab.oss.replicas.strategy.LargestPacketNumberStrategy;
import com.macstab.oss.replicas.strategy.ReplicaSelectionStrategy;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * One query sent to several replicas of a shard, read back as a single ordered packet stream.
 *
 * <p><strong>Ordering (sequence cursors):</strong>
 *
 * <p>Every replica runs the same query and produces the same packet sequence. Each {@link Replica}
 * counts the packets consumed from its socket; the set keeps a global cursor of packets returned
 * to the caller. A packet is returned only when its replica's counter equals the global cursor,
 * so the caller sees packet 0, 1, 2, ... exactly once, whichever replica it came from. Packets a
 * replica sends for positions already delivered are read and discarded.
 *
 * <pre>
 *                       global cursor: 2
 * replica A  [0][1][2][3]   next=2  ← picked (furthest ahead), packet 2 returned
 * replica B  [0][1]         next=0    would discard 0 and 1 before it can serve 2
 * </pre>
 *
 * <p><strong>Receive loop (explicit state machine):</strong>
 *
 * <pre>
 *   PICK ──poll + strategy──→ RECEIVE ──in turn, no retry──→ return packet
 *    ↑  └─ nothing usable → NoAvailableReplicaException
 *    │                          │
 *    └── replica invalid ───────┤ out of turn / retry: discard, counter+1
 *                               └── replica still valid → RECEIVE (same replica)
 * </pre>
 *
 * <p>Classification inside RECEIVE:
 *
 * <ul>
 *   <li><strong>Streamable</strong> (data, progress, profile info, totals, extremes): no state
 *       change
 *   <li><strong>Terminal</strong> (end of stream, exception): replica invalid, cancel sent to every
 *       other valid replica, their streams drained. The terminal packet itself is still returned
 *       when it is in turn; an exception packet reaches the caller as payload, not as a throw.
 *   <li><strong>Unrecognized</strong>: replica invalid; if other valid replicas remain, the packet
 *       is dropped and another replica is picked. No cancel, no drain.
 * </ul>
 *
 * <p>The loop ends either with a returned packet or with {@link NoAvailableReplicaException} from
 * PICK. Once every replica is invalid PICK fails without blocking, so the loop cannot spin.
 *
 * <p><strong>Threading (single owner):</strong>
 *
 * <p>Not thread-safe, by contract and by check: the thread that constructs the set owns it, and
 * every operation except {@link #close()} and the read-only diagnostics fails with {@link
 * IllegalStateException} on any other thread. The only blocking points are the readiness poll
 * (bounded by {@link Settings#getPollInterval()}) and {@link Connection#receivePacket()}.
 *
 * <p><strong>Ownership:</strong>
 *
 * <p>Connections are borrowed from the {@link ConnectionPool}. {@link #disconnect()} closes them
 * on request; {@link #close()} only releases the readiness poller and never touches a connection.
 */
@Slf4j
public final class ReplicasConnections implements AutoCloseable {

  private enum Step {
    PICK,
    RECEIVE
  }

  private final Settings settings;
  private final String name;
  private final Map<SelectableChannel, Replica> replicas;
  private final SocketPoller poller;
  private final ReplicaSelectionStrategy strategy;
  private final ResidualPacketDrainer drainer;
  private final ReplicasMetrics metrics;
  private final Thread owner;

  /** Number of replicas with {@code valid == true}. Updated with every validity transition. */
  @Getter private int validReplicasCount;

  /** Global cursor: packets returned to the caller so far. */
  @Getter private long nextPacketNumber;

  private Optional<ResidualDrainException> lastDrainFailure = Optional.empty();
  private boolean closed;

  /**
   * Creates a replica set with the default largest-packet-number strategy and no metrics.
   *
   * @param pool replica source (must not be null)
   * @param settings settings, {@code pollInterval} bounds every readiness wait (must not be null)
   */
  public ReplicasConnections(@NonNull final ConnectionPool pool, @NonNull final Settings settings) {
    this(pool, settings, new LargestPacketNumberStrategy(), Optional.empty());
  }

  /**
   * Creates a replica set with custom strategy and optional metrics, polling through NIO.
   *
   * @param pool replica source (must not be null)
   * @param settings settings (must not be null)
   * @param strategy replica selection strategy (must not be null)
   * @param metrics metrics collector (optional, defaults to NOOP if not present)
   */
  public ReplicasConnections(
      @NonNull final ConnectionPool pool,
      @NonNull final Settings settings,
      @NonNull final ReplicaSelectionStrategy strategy,
      @NonNull final Optional<ReplicasMetrics> metrics) {
    this(pool, settings, new NioSocketPoller(), strategy, metrics);
  }

  /**
   * Creates a replica set with an explicit readiness poller.
   *
   * <p>The set takes ownership of {@code poller} and closes it in {@link #close()}, also when this
   * constructor fails.
   *
   * @param pool replica source (must not be null)
   * @param settings settings (must not be null)
   * @param poller readiness primitive (must not be null)
   * @param strategy replica selection strategy (must not be null)
   * @param metrics metrics collector (optional, defaults to NOOP if not present)
   * @throws IllegalArgumentException if the pool returns no connection or a socket twice
   */
  public ReplicasConnections(
      @NonNull final ConnectionPool pool,
      @NonNull final Settings settings,
      @NonNull final SocketPoller poller,
      @NonNull final ReplicaSelectionStrategy strategy,
      @NonNull final Optional<ReplicasMetrics> metrics) {
    this.settings = settings;
    this.name = settings.getName();
    this.poller = poller;
    this.strategy = strategy;
    this.drainer = new ResidualPacketDrainer();
    this.metrics = metrics.orElse(ReplicasMetrics.NOOP);
    this.owner = Thread.currentThread();

    try {
      this.replicas = buildReplicas(pool.getMany(settings));
    } catch (final RuntimeException e) {
      poller.close();
      throw e;
    }
    this.validReplicasCount = replicas.size();

    this.metrics.recordReplicaSetOpened(name, validReplicasCount);

    if (log.isInfoEnabled()) {
      log.info(
          "Created ReplicasConnections with {} replicas using {} strategy (name: {})",
          validReplicasCount,
          strategy.getName(),
          name);
    }
  }

  // ==================== Receive ====================

  /**
   * Returns the next packet of the merged stream.
   *
   * <p>Blocks until some replica is readable (at most {@code pollInterval} per poll) and a packet
   * in turn has been read. Terminal and exception packets are returned like any other packet; the
   * caller inspects {@link Packet#getType()} to detect end of stream or a replica-reported error.
   *
   * @return next packet, its position equals {@link #getNextPacketNumber()} before the call
   * @throws NoAvailableReplicaException if a poll found no valid readable replica (retry is
   *     allowed while {@link #getValidReplicasCount()} is positive)
   * @throws UnexpectedReplicaException if the poller reported an unknown socket
   * @throws IOException if a connection or the poller fails
   */
  public Packet receivePacket() throws IOException {
    checkOwner();
    checkNotClosed();

    Replica replica = null;
    var step = Step.PICK;

    while (true) {
      switch (step) {
        case PICK:
          replica = pickConnection();
          step = Step.RECEIVE;
          break;

        case RECEIVE:
          {
            final var packet = replica.getConnection().receivePacket();
            final var retry = classify(replica, packet);

            if (!retry && replica.getNextPacketNumber() == nextPacketNumber) {
              replica.advance();
              nextPacketNumber++;
              metrics.recordPacketReturned(name, packet.getType().name());
              return packet;
            }

            if (log.isDebugEnabled()) {
              log.debug(
                  "Discarded {} packet #{} from {} (cursor: {}, retry: {})",
                  packet.getType(),
                  replica.getNextPacketNumber(),
                  replica.getConnection().getServerAddress(),
                  nextPacketNumber,
                  retry);
            }
            replica.advance();
            metrics.recordPacketDiscarded(name, packet.getType().name());

            step = replica.isValid() ? Step.RECEIVE : Step.PICK;
            break;
          }

        default:
          throw new IllegalStateException("Unknown receive step: " + step);
      }
    }
  }

  /**
   * Waits until some valid replica is readable and marks the readable ones.
   *
   * <p>Resets {@code canRead} on every replica, so the flags always describe the most recent poll.
   * With no valid replica left returns 0 immediately, without polling.
   *
   * @return number of readable replicas, 0 on timeout
   * @throws UnexpectedReplicaException if the poller reports a socket outside the set
   */
  int waitForReadEvent() throws IOException {
    checkOwner();
    checkNotClosed();

    if (validReplicasCount == 0) {
      return 0;
    }

    final List<SelectableChannel> readList = new ArrayList<>(validReplicasCount);
    for (final var replica : replicas.values()) {
      replica.setCanRead(false);
      if (replica.isValid()) {
        readList.add(replica.getConnection().getSocket());
      }
    }

    final var ready = poller.poll(readList, settings.getPollInterval());

    for (final var socket : ready) {
      final var replica = replicas.get(socket);
      if (replica == null) {
        throw new UnexpectedReplicaException(socket);
      }
      replica.setCanRead(true);
    }

    return ready.size();
  }

  /**
   * Polls once and lets the strategy pick a replica that is readable and still valid.
   *
   * @throws NoAvailableReplicaException if nothing is usable after this single poll
   */
  Replica pickConnection() throws IOException {
    final var ready = waitForReadEvent();

    final Optional<Replica> picked =
        ready > 0 ? strategy.select(replicas.values()) : Optional.empty();

    if (picked.isEmpty()) {
      // nothing was polled once every replica is invalid
      if (validReplicasCount > 0) {
        metrics.recordEmptyPoll(name);
      }
      throw new NoAvailableReplicaException(validReplicasCount);
    }

    final var replica = picked.get();
    metrics.recordReplicaSelection(
        name, replica.getConnection().getServerAddress(), strategy.getName());
    return replica;
  }

  // ==================== Broadcast ====================

  /**
   * Sends the query to every replica of the set, valid or not.
   *
   * <p>All replicas are live right after construction, which is when this is meant to be called.
   * The first failing send aborts the broadcast and propagates.
   */
  public void sendQuery(
      @NonNull final String query,
      @NonNull final String queryId,
      @NonNull final QueryStage stage,
      @NonNull final Settings querySettings,
      final boolean withPendingData)
      throws IOException {
    checkOwner();
    checkNotClosed();

    for (final var replica : replicas.values()) {
      replica.getConnection().sendQuery(query, queryId, stage, querySettings, withPendingData);
    }

    if (log.isDebugEnabled()) {
      log.debug("Sent query {} to {} replicas (name: {})", queryId, replicas.size(), name);
    }
  }

  /**
   * Sends external table data, one payload per replica.
   *
   * <p>Payloads pair with replicas in iteration order (pool order). Invalid replicas count too:
   * the list must match the full set.
   *
   * @param data one payload per replica
   * @throws MismatchReplicasDataSourcesException if the sizes differ (nothing is sent)
   */
  public void sendExternalTablesData(@NonNull final List<ExternalTablesData> data)
      throws IOException {
    checkOwner();
    checkNotClosed();

    if (data.size() != replicas.size()) {
      throw new MismatchReplicasDataSourcesException(replicas.size(), data.size());
    }

    final var it = data.iterator();
    for (final var replica : replicas.values()) {
      replica.getConnection().sendExternalTablesData(it.next());
    }
  }

  /**
   * Sends cancel to every valid replica. Invalid replicas are skipped.
   *
   * @throws IOException first failing send, remaining replicas are not cancelled
   */
  public void sendCancel() throws IOException {
    checkOwner();

    for (final var replica : replicas.values()) {
      if (replica.isValid()) {
        replica.getConnection().sendCancel();
      }
    }
  }

  /**
   * Disconnects every valid replica and marks it invalid.
   *
   * <p>Idempotent: a replica is disconnected at most once, because it is invalid afterwards and
   * invalid replicas are never touched again. Subsequent receives fail with {@link
   * NoAvailableReplicaException}.
   */
  public void disconnect() {
    checkOwner();

    for (final var replica : replicas.values()) {
      if (replica.isValid()) {
        replica.getConnection().disconnect();
        invalidate(replica, InvalidationReason.DISCONNECTED);
      }
    }
  }

  // ==================== Diagnostics ====================

  /**
   * Server addresses of the valid replicas, joined with {@code ';'}.
   *
   * @return e.g. {@code "replica-1:9000;replica-2:9000"}, empty string if no replica is valid
   */
  public String dumpAddresses() {
    final var joiner = new StringJoiner(";");
    for (final var replica : replicas.values()) {
      if (replica.isValid()) {
        joiner.add(replica.getConnection().getServerAddress());
      }
    }
    return joiner.toString();
  }

  /** Read-only view of all replicas in iteration order. */
  public Collection<Replica> getReplicas() {
    return Collections.unmodifiableCollection(replicas.values());
  }

  public int getReplicaCount() {
    return replicas.size();
  }

  /**
   * Failures collected by the most recent residual drain.
   *
   * <p>Empty if no drain ran yet or the last one finished cleanly.
   */
  public Optional<ResidualDrainException> getLastDrainFailure() {
    return lastDrainFailure;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Releases the readiness poller.
   *
   * <p>Never closes a connection: they belong to the pool. Call {@link #disconnect()} first when
   * the connections must not be reused. Idempotent, callable from any thread.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;

    try {
      poller.close();
      metrics.recordReplicaSetClosed(name);
      log.debug("Closed ReplicasConnections (name: {})", name);
    } catch (final Exception e) {
      log.error("Error during ReplicasConnections close", e);
    }
  }

  // ==================== Private Methods ====================

  private static Map<SelectableChannel, Replica> buildReplicas(final List<Connection> connections) {
    if (connections.isEmpty()) {
      throw new IllegalArgumentException("Connection pool returned no connections");
    }

    final Map<SelectableChannel, Replica> result = new LinkedHashMap<>(connections.size() * 2);
    for (final var connection : connections) {
      final var socket = connection.getSocket();
      if (result.putIfAbsent(socket, new Replica(connection)) != null) {
        throw new IllegalArgumentException(
            "Connection pool returned socket twice: " + connection.getServerAddress());
      }
    }
    return result;
  }

  /**
   * Applies the packet's category to the replica state.
   *
   * @return {@code true} if the packet must not be returned and another replica should serve
   */
  private boolean classify(final Replica replica, final Packet packet) {
    switch (packet.getCategory()) {
      case STREAMABLE:
        return false;

      case TERMINAL:
        invalidate(replica, InvalidationReason.TERMINAL);
        // nothing more is read from this replica, stop the others and flush what they still send
        cancelRemaining();
        drainResidualPackets();
        return false;

      default:
        log.warn(
            "Invalid {} packet from replica {}, {} valid replicas left",
            packet.getType(),
            replica.getConnection().getServerAddress(),
            validReplicasCount - 1);
        invalidate(replica, InvalidationReason.MALFORMED);
        return validReplicasCount > 0;
    }
  }

  private void invalidate(final Replica replica, final InvalidationReason reason) {
    if (replica.invalidate()) {
      validReplicasCount--;
      metrics.recordReplicaInvalidated(name, replica.getConnection().getServerAddress(), reason);
    }
  }

  /** Best effort: a replica whose cancel fails is still drained and reports its error there. */
  private void cancelRemaining() {
    for (final var replica : replicas.values()) {
      if (!replica.isValid()) {
        continue;
      }
      try {
        replica.getConnection().sendCancel();
      } catch (final IOException e) {
        log.warn(
            "Failed to cancel query on replica {}", replica.getConnection().getServerAddress(), e);
      }
    }
  }

  private void drainResidualPackets() {
    final var result = drainer.drain(replicas.values());
    final var failures = result.getFailure().map(f -> f.getFailedReplicas().size()).orElse(0);
    metrics.recordResidualDrain(name, result.getDrainedPackets(), failures);

    lastDrainFailure = result.getFailure();
    lastDrainFailure.ifPresent(
        failure ->
            log.warn("Residual drain of replica set '{}' finished with errors", name, failure));
  }

  private void checkOwner() {
    if (Thread.currentThread() != owner) {
      throw new IllegalStateException(
          "ReplicasConnections is owned by thread '"
              + owner.getName()
              + "', called from '"
              + Thread.currentThread().getName()
              + "'");
    }
  }

  private void checkNotClosed() {
    if (closed) {
      throw new IllegalStateException("ReplicasConnections has been closed");
    }
  }
}
