/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import com.luisppb16.mycat.storage.Row;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import lombok.Builder;
import lombok.Getter;

/**
 * A pending change to one row: the unit a {@link ModificationCommandBatch} admits, renders and
 * reconciles.
 *
 * <p>Commands are created by the change-tracking layer before a flush. The batch only mutates
 * them through {@link #propagateResults(Row)}, {@link #propagateNonKeyResults(Row)} and {@link
 * #assignGeneratedKey(int, long)} once the store has answered.
 */
@Getter
public final class ModificationCommand {

  private final String tableName;
  private final String schema;
  private final EntityState entityState;
  private final List<ColumnModification> columnModifications;
  private final Object entry;

  @Builder
  private ModificationCommand(
      String tableName,
      String schema,
      EntityState entityState,
      List<ColumnModification> columnModifications,
      Object entry) {
    this.tableName = Objects.requireNonNull(tableName, "Table name cannot be null.");
    this.schema = schema;
    this.entityState = Objects.requireNonNull(entityState, "Entity state cannot be null.");
    this.columnModifications =
        List.copyOf(Objects.requireNonNull(columnModifications, "Column list cannot be null."));
    this.entry = entry;
  }

  public boolean requiresResultPropagation() {
    return columnModifications.stream().anyMatch(ColumnModification::isRead);
  }

  public List<String> writeColumnNames() {
    return columnModifications.stream()
        .filter(ColumnModification::isWrite)
        .map(ColumnModification::getColumnName)
        .toList();
  }

  public List<String> readColumnNames() {
    return columnModifications.stream()
        .filter(ColumnModification::isRead)
        .map(ColumnModification::getColumnName)
        .toList();
  }

  /** Read columns other than keys: the defaults and computed values an INSERT reads back. */
  public List<String> nonKeyReadColumnNames() {
    return columnModifications.stream()
        .filter(c -> c.isRead() && !c.isKey())
        .map(ColumnModification::getColumnName)
        .toList();
  }

  /** Copies every read column from {@code row}. Fails when the row lacks one of them. */
  public void propagateResults(Row row) {
    propagate(row, ColumnModification::isRead);
  }

  /**
   * Copies the non-key read columns from {@code row}, leaving generated keys to {@link
   * #assignGeneratedKey(int, long)}.
   */
  public void propagateNonKeyResults(Row row) {
    propagate(row, c -> c.isRead() && !c.isKey());
  }

  private void propagate(Row row, Predicate<ColumnModification> filter) {
    Objects.requireNonNull(row, "Row cannot be null.");
    for (ColumnModification column : columnModifications) {
      if (!filter.test(column)) {
        continue;
      }
      String label =
          row.label(column.getColumnName())
              .orElseThrow(
                  () ->
                      new IllegalStateException(
                          "Column '"
                              + column.getColumnName()
                              + "' of table '"
                              + tableName
                              + "' is missing from the returned row "
                              + row.values().keySet()));
      column.setValue(row.get(label));
    }
  }

  /**
   * Stores a store-generated identity into the key column at {@code columnIndex}, converted to
   * the column's property type when it is a narrower integral type.
   *
   * @throws IllegalArgumentException if the column at {@code columnIndex} is not a key
   * @throws ArithmeticException if the identity does not fit the property type
   */
  public void assignGeneratedKey(int columnIndex, long identity) {
    ColumnModification column = columnModifications.get(columnIndex);
    if (!column.isKey()) {
      throw new IllegalArgumentException(
          "Column '" + column.getColumnName() + "' of table '" + tableName + "' is not a key.");
    }
    column.setValue(convertIdentity(identity, column.getPropertyType()));
  }

  private static Object convertIdentity(long identity, Class<?> type) {
    if (type == Integer.class || type == int.class) {
      return Math.toIntExact(identity);
    }
    if (type == Short.class || type == short.class) {
      if (identity < Short.MIN_VALUE || identity > Short.MAX_VALUE) {
        throw new ArithmeticException("short overflow: " + identity);
      }
      return (short) identity;
    }
    if (type == Byte.class || type == byte.class) {
      if (identity < Byte.MIN_VALUE || identity > Byte.MAX_VALUE) {
        throw new ArithmeticException("byte overflow: " + identity);
      }
      return (byte) identity;
    }
    return identity;
  }

  @Override
  public String toString() {
    return "ModificationCommand{"
        + entityState
        + " "
        + (Objects.isNull(schema) ? "" : schema + ".")
        + tableName
        + '}';
  }
}
