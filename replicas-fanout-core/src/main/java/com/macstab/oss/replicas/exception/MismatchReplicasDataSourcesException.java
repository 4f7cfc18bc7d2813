/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.exception;

/** External table payload count differs from the number of replicas in the set. */
public class MismatchReplicasDataSourcesException extends ReplicaException {

  private static final long serialVersionUID = 1L;

  public MismatchReplicasDataSourcesException(final int replicas, final int dataSources) {
    super(
        ErrorCode.MISMATCH_REPLICAS_DATA_SOURCES,
        String.format(
            "%s: %d replicas, %d data sources",
            ErrorCode.MISMATCH_REPLICAS_DATA_SOURCES.getDefaultMessage(), replicas, dataSources));
  }
}
