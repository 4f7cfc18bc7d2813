/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.readiness;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.SelectableChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link SocketPoller} on top of a {@link Selector} (epoll on Linux, kqueue on macOS).
 *
 * <p>Channels are registered for {@link SelectionKey#OP_READ} the first time they are watched and
 * stay registered while they keep appearing in the watch set. A channel dropped from the watch set
 * has its key cancelled, so a replica that went invalid is never reported again even though its
 * socket may still hold unread bytes.
 *
 * <p><strong>Level-triggered:</strong> a socket with buffered but unread data is reported again on
 * the next poll. The multiplexer relies on this: it reads one packet per pick and comes back.
 *
 * <p>Channels must already be in non-blocking mode. Switching them is the connection's business,
 * not the poller's, because it changes how the connection's own reads behave.
 */
@Slf4j
public final class NioSocketPoller implements SocketPoller {

  private final Selector selector;
  private final Map<SelectableChannel, SelectionKey> registrations = new HashMap<>();
  private boolean closed;

  public NioSocketPoller() {
    try {
      this.selector = Selector.open();
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to open selector", e);
    }
  }

  @Override
  public Set<SelectableChannel> poll(
      @NonNull final Collection<SelectableChannel> sockets, @NonNull final Duration timeout)
      throws IOException {
    if (closed) {
      throw new IllegalStateException("NioSocketPoller has been closed");
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0, got: " + timeout);
    }

    updateRegistrations(sockets);

    selector.selectedKeys().clear();
    final int selected = selector.select(selectMillis(timeout));

    final Set<SelectableChannel> ready = new LinkedHashSet<>();
    for (final var key : selector.selectedKeys()) {
      if (key.isValid() && key.isReadable()) {
        ready.add(key.channel());
      }
    }
    selector.selectedKeys().clear();

    if (log.isTraceEnabled()) {
      log.trace(
          "Poll over {} sockets: {} selected, {} readable", sockets.size(), selected, ready.size());
    }
    return ready;
  }

  /**
   * Converts a poll timeout to the millisecond argument of {@link Selector#select(long)}.
   *
   * <p>Sub-millisecond timeouts round up to 1 since {@code select(0)} blocks forever. Durations
   * beyond {@code Long.MAX_VALUE} milliseconds saturate.
   */
  static long selectMillis(final Duration timeout) {
    if (timeout.getSeconds() >= Long.MAX_VALUE / 1000) {
      return Long.MAX_VALUE;
    }
    return Math.max(1L, timeout.toMillis());
  }

  int registeredCount() {
    return registrations.size();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    registrations.clear();
    try {
      // deregisters all channels without closing them
      selector.close();
    } catch (final IOException e) {
      log.error("Error closing selector", e);
    }
  }

  private void updateRegistrations(final Collection<SelectableChannel> sockets) throws IOException {
    final Set<SelectableChannel> watched = new HashSet<>(sockets);

    boolean cancelled = false;
    final var it = registrations.entrySet().iterator();
    while (it.hasNext()) {
      final var entry = it.next();
      if (!watched.contains(entry.getKey())) {
        entry.getValue().cancel();
        it.remove();
        cancelled = true;
      }
    }
    if (cancelled) {
      // flush cancelled keys so a channel can be registered again later
      selector.selectNow();
    }

    for (final var socket : watched) {
      if (registrations.containsKey(socket)) {
        continue;
      }
      if (socket.isBlocking()) {
        throw new IllegalArgumentException("Socket must be in non-blocking mode: " + socket);
      }
      registrations.put(socket, socket.register(selector, SelectionKey.OP_READ));
    }
  }
}
