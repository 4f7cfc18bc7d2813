/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas;

import java.nio.channels.SelectableChannel;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.macstab.oss.replicas.readiness.SocketPoller;

import lombok.Getter;

/**
 * Deterministic {@link SocketPoller} for ordering tests.
 *
 * <p>Scripted ready sets are returned first, one per poll, verbatim (a script may even report a
 * socket that was not watched). Once the script is used up, a poll reports every watched socket
 * whose {@link FakeConnection} still has buffered packets.
 */
public final class ScriptedSocketPoller implements SocketPoller {

  private final Map<SelectableChannel, FakeConnection> connections = new HashMap<>();
  private final Deque<Set<SelectableChannel>> script = new ArrayDeque<>();
  @Getter private final List<Set<SelectableChannel>> watchSets = new ArrayList<>();
  @Getter private boolean closed;

  public ScriptedSocketPoller(final FakeConnection... fakes) {
    for (final var fake : fakes) {
      connections.put(fake.getSocket(), fake);
    }
  }

  public ScriptedSocketPoller thenReady(final FakeConnection... ready) {
    final Set<SelectableChannel> sockets = new LinkedHashSet<>();
    Arrays.stream(ready).forEach(fake -> sockets.add(fake.getSocket()));
    script.add(sockets);
    return this;
  }

  public ScriptedSocketPoller thenReadySockets(final SelectableChannel... ready) {
    script.add(new LinkedHashSet<>(Arrays.asList(ready)));
    return this;
  }

  public int getPollCount() {
    return watchSets.size();
  }

  @Override
  public Set<SelectableChannel> poll(
      final Collection<SelectableChannel> sockets, final Duration timeout) {
    if (closed) {
      throw new IllegalStateException("poller closed");
    }
    watchSets.add(new LinkedHashSet<>(sockets));

    if (!script.isEmpty()) {
      return script.poll();
    }

    final Set<SelectableChannel> ready = new LinkedHashSet<>();
    for (final var socket : sockets) {
      final var fake = connections.get(socket);
      if (fake != null && fake.pendingPackets() > 0) {
        ready.add(socket);
      }
    }
    return ready;
  }

  @Override
  public void close() {
    closed = true;
  }
}
