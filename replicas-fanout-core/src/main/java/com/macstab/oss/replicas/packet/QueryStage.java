/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.packet;

/** How far a replica should process the query before streaming results back. */
public enum QueryStage {
  /** Only read the requested columns. */
  FETCH_COLUMNS,
  /** Stop at intermediate aggregation state, merged by the initiator. */
  WITH_MERGEABLE_STATE,
  /** Fully processed result. */
  COMPLETE
}
