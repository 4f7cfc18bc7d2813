/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.packet;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Temporary tables shipped to one replica right after the query (e.g. the right side of a
 * {@code GLOBAL IN}).
 *
 * <p>Each replica gets its own instance because every replica consumes the block stream of its
 * source independently.
 */
@Value
public class ExternalTablesData {

  @NonNull List<ExternalTable> tables;

  public ExternalTablesData(@NonNull final List<ExternalTable> tables) {
    this.tables = List.copyOf(tables);
  }

  public static ExternalTablesData empty() {
    return new ExternalTablesData(List.of());
  }

  public boolean isEmpty() {
    return tables.isEmpty();
  }

  /** Named table with opaque, already encoded blocks. */
  @Value
  public static class ExternalTable {
    @NonNull String name;
    @NonNull List<Object> blocks;
  }
}
