/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas;

import java.util.List;

/**
 * Replica discovery: hands out already-connected replicas of one shard.
 *
 * <p>The pool keeps ownership of the returned connections. It decides how many to hand out (see
 * {@link Settings#getMaxParallelReplicas()}) and fails with its own exception when too few
 * replicas are reachable.
 */
@FunctionalInterface
public interface ConnectionPool {

  /**
   * Connections to distinct replicas, in the order the pool prefers them.
   *
   * @param settings query settings
   * @return at least one connection, no socket appears twice
   */
  List<Connection> getMany(Settings settings);
}
