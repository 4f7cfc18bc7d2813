/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.drain;

import java.util.Optional;

import lombok.Value;

/** Outcome of one residual drain over a replica set. */
@Value
public class DrainResult {

  /** Replicas that were drained (valid at drain time). */
  int drainedReplicas;

  /** Packets read and thrown away, terminal packets included. */
  int drainedPackets;

  /** Present when at least one replica's stream ended with an error. */
  Optional<ResidualDrainException> failure;

  public boolean isClean() {
    return failure.isEmpty();
  }
}
