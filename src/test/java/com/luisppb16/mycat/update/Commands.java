/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import com.luisppb16.mycat.storage.ParameterNameGenerator;
import java.util.List;

/** Builds modification commands the way the change tracker would, with unique parameter names. */
final class Commands {

  private final ParameterNameGenerator names = new ParameterNameGenerator();

  /** Insert of {@code column} whose {@code id} key is generated by the store. */
  ModificationCommand insertWithIdentity(String table, String column, Object value) {
    return insertWithIdentity(table, Long.class, column, value);
  }

  ModificationCommand insertWithIdentity(
      String table, Class<?> keyType, String column, Object value) {
    return ModificationCommand.builder()
        .tableName(table)
        .entityState(EntityState.ADDED)
        .columnModifications(
            List.of(
                ColumnModification.builder()
                    .columnName("id")
                    .propertyType(keyType)
                    .key(true)
                    .read(true)
                    .build(),
                written(column, value)))
        .entry(table + ":" + value)
        .build();
  }

  /** Insert with a client-supplied key; nothing to read back. */
  ModificationCommand insert(String table, long id, String column, Object value) {
    return ModificationCommand.builder()
        .tableName(table)
        .entityState(EntityState.ADDED)
        .columnModifications(
            List.of(
                ColumnModification.builder()
                    .columnName("id")
                    .propertyType(Long.class)
                    .key(true)
                    .write(true)
                    .parameterName(names.generateNext())
                    .value(id)
                    .build(),
                written(column, value)))
        .build();
  }

  /** Insert with a client-supplied key whose {@code computedColumn} is filled by the store. */
  ModificationCommand insertReadingBack(
      String table, long id, String column, Object value, String computedColumn) {
    return ModificationCommand.builder()
        .tableName(table)
        .entityState(EntityState.ADDED)
        .columnModifications(
            List.of(
                ColumnModification.builder()
                    .columnName("id")
                    .propertyType(Long.class)
                    .key(true)
                    .write(true)
                    .parameterName(names.generateNext())
                    .value(id)
                    .build(),
                written(column, value),
                ColumnModification.builder().columnName(computedColumn).read(true).build()))
        .build();
  }

  /** Insert with a generated {@code id} whose {@code computedColumn} is filled by the store. */
  ModificationCommand insertWithIdentityReadingBack(
      String table, String column, Object value, String computedColumn) {
    return ModificationCommand.builder()
        .tableName(table)
        .entityState(EntityState.ADDED)
        .columnModifications(
            List.of(
                ColumnModification.builder()
                    .columnName("id")
                    .propertyType(Long.class)
                    .key(true)
                    .read(true)
                    .build(),
                written(column, value),
                ColumnModification.builder().columnName(computedColumn).read(true).build()))
        .build();
  }

  ModificationCommand update(String table, long id, String column, Object value) {
    return ModificationCommand.builder()
        .tableName(table)
        .entityState(EntityState.MODIFIED)
        .columnModifications(List.of(written(column, value), keyCondition(id)))
        .entry(table + "#" + id)
        .build();
  }

  /** Update whose {@code computedColumn} is recomputed by the store and read back. */
  ModificationCommand updateReadingBack(
      String table, long id, String column, Object value, String computedColumn) {
    return ModificationCommand.builder()
        .tableName(table)
        .entityState(EntityState.MODIFIED)
        .columnModifications(
            List.of(
                written(column, value),
                keyCondition(id),
                ColumnModification.builder().columnName(computedColumn).read(true).build()))
        .build();
  }

  ModificationCommand delete(String table, long id) {
    return ModificationCommand.builder()
        .tableName(table)
        .entityState(EntityState.DELETED)
        .columnModifications(List.of(keyCondition(id)))
        .build();
  }

  ColumnModification written(String column, Object value) {
    return ColumnModification.builder()
        .columnName(column)
        .write(true)
        .parameterName(names.generateNext())
        .value(value)
        .build();
  }

  ColumnModification keyCondition(long id) {
    return ColumnModification.builder()
        .columnName("id")
        .propertyType(Long.class)
        .key(true)
        .condition(true)
        .parameterName(names.generateNext())
        .value(id)
        .build();
  }
}
