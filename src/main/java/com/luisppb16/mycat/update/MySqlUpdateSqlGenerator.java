/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import com.luisppb16.mycat.storage.SqlGenerationHelper;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * MySQL statement text for modification commands.
 *
 * <p>Identifiers are delimited and parameter markers named through the {@link
 * SqlGenerationHelper}. Each statement forms one result set in the reply:
 *
 * <ul>
 *   <li>INSERT: the affected-row count together with the generated identity, followed by a
 *       {@code SELECT} of the non-key read columns when the row has defaults or computed columns
 *   <li>multi-row INSERT: one count for the whole group; such rows read back nothing but keys
 *   <li>UPDATE: the count, followed by a {@code SELECT} of the read columns guarded by {@code
 *       ROW_COUNT() = 1} when the row has computed columns
 *   <li>DELETE: the count
 * </ul>
 */
public class MySqlUpdateSqlGenerator implements UpdateSqlGenerator {

  private final SqlGenerationHelper sqlGenerationHelper;

  public MySqlUpdateSqlGenerator(SqlGenerationHelper sqlGenerationHelper) {
    this.sqlGenerationHelper =
        Objects.requireNonNull(sqlGenerationHelper, "SQL generation helper cannot be null");
  }

  @Override
  public void appendBatchHeader(StringBuilder commandStringBuilder) {
    commandStringBuilder.append(sqlGenerationHelper.batchHeader());
  }

  @Override
  public ResultSetMapping appendInsertOperation(
      StringBuilder commandStringBuilder, ModificationCommand command, int commandPosition) {
    appendBulkInsertOperation(commandStringBuilder, List.of(command), commandPosition + 1);
    return ResultSetMapping.LAST_IN_RESULT_SET;
  }

  @Override
  public ResultSetMapping appendBulkInsertOperation(
      StringBuilder commandStringBuilder, List<ModificationCommand> commands, int commandPosition) {
    if (commands.isEmpty()) {
      throw new IllegalArgumentException("A bulk insert needs at least one command.");
    }
    ModificationCommand first = commands.get(0);
    List<String> readBackColumns = first.nonKeyReadColumnNames();
    if (!readBackColumns.isEmpty() && commands.size() > 1) {
      throw new IllegalArgumentException(
          "Computed columns cannot be read back from a multi-row INSERT into " + table(first));
    }
    List<ColumnModification> writeColumns =
        first.getColumnModifications().stream().filter(ColumnModification::isWrite).toList();

    appendInsertCommandHeader(commandStringBuilder, first, writeColumns);
    commandStringBuilder.append("VALUES ");
    String separator = sqlGenerationHelper.batchRowSeparator();
    for (int i = 0; i < commands.size(); i++) {
      if (i > 0) {
        commandStringBuilder.append(separator);
      }
      appendValues(commandStringBuilder, commands.get(i));
    }
    appendTerminator(commandStringBuilder);

    if (!readBackColumns.isEmpty()) {
      appendSelect(
          commandStringBuilder,
          first,
          readBackColumns,
          first.getColumnModifications().stream()
              .filter(ColumnModification::isKey)
              .map(this::insertedKeyCondition)
              .toList());
      return ResultSetMapping.LAST_IN_RESULT_SET;
    }
    return ResultSetMapping.NOT_LAST_IN_RESULT_SET;
  }

  @Override
  public ResultSetMapping appendUpdateOperation(
      StringBuilder commandStringBuilder, ModificationCommand command, int commandPosition) {
    List<ColumnModification> writeColumns =
        command.getColumnModifications().stream().filter(ColumnModification::isWrite).toList();
    if (writeColumns.isEmpty()) {
      throw new IllegalArgumentException(
          "Cannot render an UPDATE without written columns for " + command);
    }

    commandStringBuilder
        .append("UPDATE ")
        .append(table(command))
        .append(" SET ")
        .append(
            writeColumns.stream()
                .map(
                    c ->
                        sqlGenerationHelper.delimitIdentifier(c.getColumnName())
                            + " = "
                            + sqlGenerationHelper.generateParameterName(c.getParameterName()))
                .collect(Collectors.joining(", ")))
        .append('\n');
    appendWhereClause(commandStringBuilder, command);
    appendTerminator(commandStringBuilder);

    if (command.requiresResultPropagation()) {
      appendSelectAffected(commandStringBuilder, command);
    }
    return ResultSetMapping.LAST_IN_RESULT_SET;
  }

  @Override
  public ResultSetMapping appendDeleteOperation(
      StringBuilder commandStringBuilder, ModificationCommand command, int commandPosition) {
    commandStringBuilder.append("DELETE FROM ").append(table(command)).append('\n');
    appendWhereClause(commandStringBuilder, command);
    appendTerminator(commandStringBuilder);
    return ResultSetMapping.LAST_IN_RESULT_SET;
  }

  private void appendInsertCommandHeader(
      StringBuilder sb, ModificationCommand command, List<ColumnModification> writeColumns) {
    sb.append("INSERT INTO ")
        .append(table(command))
        .append(" (")
        .append(
            writeColumns.stream()
                .map(c -> sqlGenerationHelper.delimitIdentifier(c.getColumnName()))
                .collect(Collectors.joining(", ")))
        .append(")\n");
  }

  private void appendValues(StringBuilder sb, ModificationCommand command) {
    sb.append('(')
        .append(
            command.getColumnModifications().stream()
                .filter(ColumnModification::isWrite)
                .map(c -> sqlGenerationHelper.generateParameterName(c.getParameterName()))
                .collect(Collectors.joining(", ")))
        .append(')');
  }

  private void appendWhereClause(StringBuilder sb, ModificationCommand command) {
    List<ColumnModification> conditions =
        command.getColumnModifications().stream().filter(ColumnModification::isCondition).toList();
    if (conditions.isEmpty()) {
      throw new IllegalArgumentException(
          "Cannot render a WHERE clause without conditions for " + command);
    }
    sb.append("WHERE ")
        .append(conditions.stream().map(this::condition).collect(Collectors.joining(" AND ")));
  }

  private void appendSelectAffected(StringBuilder sb, ModificationCommand command) {
    appendSelect(
        sb,
        command,
        command.readColumnNames(),
        command.getColumnModifications().stream()
            .filter(ColumnModification::isKey)
            .map(this::condition)
            .toList());
  }

  private void appendSelect(
      StringBuilder sb, ModificationCommand command, List<String> columns, List<String> keys) {
    sb.append("SELECT ")
        .append(
            columns.stream()
                .map(sqlGenerationHelper::delimitIdentifier)
                .collect(Collectors.joining(", ")))
        .append('\n')
        .append("FROM ")
        .append(table(command))
        .append('\n')
        .append("WHERE ROW_COUNT() = 1");
    keys.forEach(key -> sb.append(" AND ").append(key));
    appendTerminator(sb);
  }

  /** Locates the row just inserted: generated keys by the last identity, others by value. */
  private String insertedKeyCondition(ColumnModification column) {
    String name = sqlGenerationHelper.delimitIdentifier(column.getColumnName());
    if (column.isRead()) {
      return name + " = " + sqlGenerationHelper.lastInsertIdFunction();
    }
    if (Objects.isNull(column.getValue())) {
      return name + " IS NULL";
    }
    if (Objects.isNull(column.getParameterName())) {
      throw new IllegalArgumentException(
          "Key column '" + column.getColumnName() + "' has no parameter name.");
    }
    return name + " = " + sqlGenerationHelper.generateParameterName(column.getParameterName());
  }

  private String condition(ColumnModification column) {
    String name = sqlGenerationHelper.delimitIdentifier(column.getColumnName());
    boolean original = column.usesOriginalValueParameter();
    Object comparedValue = original ? column.getOriginalValue() : column.getValue();
    String parameterName = original ? column.getOriginalParameterName() : column.getParameterName();
    if (Objects.isNull(comparedValue)) {
      return name + " IS NULL";
    }
    if (Objects.isNull(parameterName)) {
      throw new IllegalArgumentException(
          "Condition column '" + column.getColumnName() + "' has no parameter name.");
    }
    return name + " = " + sqlGenerationHelper.generateParameterName(parameterName);
  }

  private String table(ModificationCommand command) {
    return sqlGenerationHelper.delimitIdentifier(command.getTableName(), command.getSchema());
  }

  private void appendTerminator(StringBuilder sb) {
    sb.append(sqlGenerationHelper.statementTerminator()).append('\n');
  }
}
