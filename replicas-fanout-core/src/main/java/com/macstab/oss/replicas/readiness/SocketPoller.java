/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.readiness;

import java.io.IOException;
import java.nio.channels.SelectableChannel;
import java.time.Duration;
import java.util.Collection;
import java.util.Set;

/**
 * Socket readiness primitive: waits until some of the given sockets are readable.
 *
 * <p>The only OS-level operation the replica multiplexer depends on. One poller serves one replica
 * set and is driven from that set's owner thread; implementations need no synchronization.
 */
public interface SocketPoller extends AutoCloseable {

  /**
   * Waits until at least one socket is readable or {@code timeout} elapses.
   *
   * <p>The watch set may shrink between calls (replicas become invalid); sockets missing from
   * {@code sockets} must not be reported, even if they still have buffered data.
   *
   * @param sockets sockets to watch, never empty
   * @param timeout upper bound of the wait, positive
   * @return readable subset, empty on timeout
   * @throws IOException if the underlying wait fails
   */
  Set<SelectableChannel> poll(Collection<SelectableChannel> sockets, Duration timeout)
      throws IOException;

  /** Releases OS resources of the poller. Never closes the watched sockets. Idempotent. */
  @Override
  void close();
}
