/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Pipe;
import java.nio.channels.SelectableChannel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.macstab.oss.replicas.packet.ExternalTablesData;
import com.macstab.oss.replicas.packet.Packet;
import com.macstab.oss.replicas.packet.QueryStage;

import lombok.Getter;

/**
 * In-memory replica connection backed by a real {@link Pipe}.
 *
 * <p>Every enqueued packet writes one byte into the pipe and every received packet consumes one,
 * so the source channel is readable exactly while packets are buffered. Works with both {@link
 * ScriptedSocketPoller} and the real NIO poller.
 *
 * <p>Receiving with nothing buffered fails with {@link IOException} instead of blocking, so a test
 * that reads too far fails fast.
 */
public final class FakeConnection implements Connection, AutoCloseable {

  @Getter private final String serverAddress;
  private final Pipe pipe;
  private final Deque<Packet> packets = new ArrayDeque<>();
  private final ByteBuffer marker = ByteBuffer.allocate(1);

  @Getter private final List<String> queries = new ArrayList<>();
  @Getter private final List<ExternalTablesData> externalTablesData = new ArrayList<>();
  @Getter private int cancelCount;
  @Getter private int disconnectCount;
  @Getter private int receivedCount;

  private IOException receiveFailure;
  private IOException cancelFailure;
  private Packet[] cancelResponse = new Packet[0];

  public FakeConnection(final String serverAddress) throws IOException {
    this.serverAddress = serverAddress;
    this.pipe = Pipe.open();
    this.pipe.source().configureBlocking(false);
  }

  public FakeConnection enqueue(final Packet... toEnqueue) throws IOException {
    for (final var packet : toEnqueue) {
      packets.add(packet);
      pipe.sink().write(ByteBuffer.wrap(new byte[] {1}));
    }
    return this;
  }

  public FakeConnection failReceiveWith(final IOException failure) {
    this.receiveFailure = failure;
    return this;
  }

  public FakeConnection failCancelWith(final IOException failure) {
    this.cancelFailure = failure;
    return this;
  }

  /** Packets the server sends once it sees the cancel (usually a final end-of-stream). */
  public FakeConnection respondToCancelWith(final Packet... response) {
    this.cancelResponse = response;
    return this;
  }

  public int pendingPackets() {
    return packets.size();
  }

  public boolean isDisconnected() {
    return disconnectCount > 0;
  }

  @Override
  public void sendQuery(
      final String query,
      final String queryId,
      final QueryStage stage,
      final Settings settings,
      final boolean withPendingData) {
    queries.add(query);
  }

  @Override
  public void sendCancel() throws IOException {
    if (cancelFailure != null) {
      throw cancelFailure;
    }
    cancelCount++;
    enqueue(cancelResponse);
  }

  @Override
  public void disconnect() {
    disconnectCount++;
  }

  @Override
  public Packet receivePacket() throws IOException {
    if (receiveFailure != null) {
      throw receiveFailure;
    }
    final var packet = packets.poll();
    if (packet == null) {
      throw new IOException("No packet buffered on " + serverAddress);
    }
    marker.clear();
    pipe.source().read(marker);
    receivedCount++;
    return packet;
  }

  @Override
  public void sendExternalTablesData(final ExternalTablesData data) {
    externalTablesData.add(data);
  }

  @Override
  public SelectableChannel getSocket() {
    return pipe.source();
  }

  @Override
  public void close() throws IOException {
    pipe.sink().close();
    pipe.source().close();
  }

  @Override
  public String toString() {
    return "FakeConnection[" + serverAddress + "]";
  }
}
