/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import com.luisppb16.mycat.config.IdentityPropagation;
import com.luisppb16.mycat.config.MyCatConfigurationException;
import com.luisppb16.mycat.config.MyCatOptions;
import com.luisppb16.mycat.storage.CancellationSignal;
import com.luisppb16.mycat.storage.ResultStream;
import com.luisppb16.mycat.storage.Row;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import lombok.extern.slf4j.Slf4j;

/**
 * MyCat batch: merges runs of compatible inserts into multi-row INSERT statements, keeps the
 * script under the server's row, parameter and length ceilings, and reconciles the reply with
 * its commands.
 *
 * <p>Admission ({@link #canAddCommand}) bounds the command count by {@code min(maxBatchSize,
 * maxRowCount)} and keeps the parameter count, which starts at 1 for the command text itself,
 * strictly below {@code maxParameterCount}.
 *
 * <p>Consecutive {@link EntityState#ADDED} commands for the same table with the same ordered
 * written and read column names are held back as a pending group and rendered together once the
 * group closes. The pending group's text is rendered at most once per membership and reused.
 * Inserts that read back columns other than their generated key stay on their own, since each
 * needs a {@code SELECT} of the row it inserted.
 *
 * <p>Measuring the script on every admission would cost a full render per command, so the length
 * is only checked when a countdown runs out. After each check the countdown restarts at a quarter
 * of the number of average-sized commands that would still fit, and never below one. The check
 * runs as soon as the countdown reaches zero rather than once it goes negative, so once fewer
 * than four such commands fit every admission is measured and the script cannot pass the ceiling
 * by an unmeasured command.
 *
 * <p>Reconciliation walks the result sets in step with {@link #commandResultSet}. Result sets of
 * commands that read values back are propagated row by row. Inserts take their generated keys
 * from the identity the server reported for the statement and their other read columns from the
 * row it returned. Insert result sets and those of commands that read nothing back are checked
 * against the number of commands they cover and raise {@link DbUpdateConcurrencyException} on a
 * mismatch.
 */
@Slf4j
public class MyCatModificationCommandBatch extends ReaderModificationCommandBatch {

  private final int maxBatchSize;
  private final BatchLimits limits;
  private final IdentityPropagation identityPropagation;
  private final int identityIncrement;
  private final List<ModificationCommand> bulkInsertCommands = new ArrayList<>();

  private String bulkInsertCommandText;
  private int parameterCount = 1;
  private int commandsLeftToLengthCheck;

  public MyCatModificationCommandBatch(
      UpdateSqlGenerator updateSqlGenerator, MyCatOptions options, BatchLimits limits) {
    super(updateSqlGenerator);
    Objects.requireNonNull(options, "Options cannot be null");
    this.limits = Objects.requireNonNull(limits, "Batch limits cannot be null");

    Integer configured = options.maxBatchSize();
    if (Objects.nonNull(configured) && configured <= 0) {
      throw new MyCatConfigurationException(
          "The specified 'maxBatchSize' value is not valid. It must be a positive number, but was "
              + configured
              + ".");
    }
    this.maxBatchSize =
        Math.min(Objects.requireNonNullElse(configured, Integer.MAX_VALUE), limits.maxRowCount());
    this.identityPropagation = options.identityPropagation();
    this.identityIncrement = options.identityIncrement();
    this.commandsLeftToLengthCheck = limits.initialLengthCheckInterval();
  }

  public MyCatModificationCommandBatch(
      UpdateSqlGenerator updateSqlGenerator, MyCatOptions options) {
    this(updateSqlGenerator, options, BatchLimits.defaults());
  }

  int getMaxBatchSize() {
    return maxBatchSize;
  }

  int getParameterCount() {
    return parameterCount;
  }

  List<ResultSetMapping> getCommandResultSet() {
    return List.copyOf(commandResultSet);
  }

  @Override
  protected boolean canAddCommand(ModificationCommand command) {
    if (maxBatchSize <= getModificationCommands().size()) {
      return false;
    }

    int additionalParameterCount = countParameters(command);
    if (parameterCount + additionalParameterCount >= limits.maxParameterCount()) {
      return false;
    }

    parameterCount += additionalParameterCount;
    return true;
  }

  @Override
  protected void onCommandRemoved(ModificationCommand command) {
    parameterCount -= countParameters(command);
  }

  private static int countParameters(ModificationCommand command) {
    int count = 0;
    for (ColumnModification column : command.getColumnModifications()) {
      if (Objects.nonNull(column.getParameterName())) {
        count++;
      }
      if (Objects.nonNull(column.getOriginalParameterName())) {
        count++;
      }
    }
    return count;
  }

  @Override
  protected void resetCommandText() {
    super.resetCommandText();
    bulkInsertCommands.clear();
    bulkInsertCommandText = null;
  }

  @Override
  protected boolean isCommandTextValid() {
    if (--commandsLeftToLengthCheck <= 0) {
      int commandTextLength = getCommandText().length();
      if (commandTextLength >= limits.maxScriptLength()) {
        log.debug(
            "Batch full at {} commands: script of {} chars reached the limit of {}",
            getModificationCommands().size(),
            commandTextLength,
            limits.maxScriptLength());
        return false;
      }

      int averageCommandLength =
          Math.max(1, commandTextLength / getModificationCommands().size());
      int expectedAdditionalCommandCapacity =
          (limits.maxScriptLength() - commandTextLength) / averageCommandLength;
      commandsLeftToLengthCheck = Math.max(1, expectedAdditionalCommandCapacity / 4);
    }
    return true;
  }

  @Override
  protected String getCommandText() {
    return super.getCommandText() + getBulkInsertCommandText(getModificationCommands().size());
  }

  private String getBulkInsertCommandText(int lastIndex) {
    if (bulkInsertCommands.isEmpty()) {
      return "";
    }
    if (Objects.nonNull(bulkInsertCommandText)) {
      return bulkInsertCommandText;
    }

    StringBuilder sb = new StringBuilder();
    ResultSetMapping grouping =
        updateSqlGenerator.appendBulkInsertOperation(sb, bulkInsertCommands, lastIndex);
    for (int i = lastIndex - bulkInsertCommands.size(); i < lastIndex; i++) {
      commandResultSet.set(i, grouping);
    }
    if (grouping != ResultSetMapping.NO_RESULT_SET) {
      commandResultSet.set(lastIndex - 1, ResultSetMapping.LAST_IN_RESULT_SET);
    }

    bulkInsertCommandText = sb.toString();
    return bulkInsertCommandText;
  }

  private void flushBulkInsertCommands(int commandPosition) {
    cachedCommandText.append(getBulkInsertCommandText(commandPosition));
    bulkInsertCommands.clear();
    bulkInsertCommandText = null;
  }

  @Override
  protected void updateCachedCommandText(int commandPosition) {
    ModificationCommand newCommand = getModificationCommands().get(commandPosition);

    if (newCommand.getEntityState() == EntityState.ADDED) {
      if (!bulkInsertCommands.isEmpty()
          && !canBeInsertedInSameStatement(bulkInsertCommands.get(0), newCommand)) {
        flushBulkInsertCommands(commandPosition);
      }
      bulkInsertCommands.add(newCommand);
      bulkInsertCommandText = null;

      lastCachedCommandIndex = commandPosition;
    } else {
      flushBulkInsertCommands(commandPosition);
      super.updateCachedCommandText(commandPosition);
    }
  }

  static boolean canBeInsertedInSameStatement(
      ModificationCommand firstCommand, ModificationCommand secondCommand) {
    return Objects.equals(firstCommand.getTableName(), secondCommand.getTableName())
        && Objects.equals(firstCommand.getSchema(), secondCommand.getSchema())
        && firstCommand.writeColumnNames().equals(secondCommand.writeColumnNames())
        && firstCommand.readColumnNames().equals(secondCommand.readColumnNames())
        && firstCommand.nonKeyReadColumnNames().isEmpty();
  }

  @Override
  protected void consume(ResultStream reader, CancellationSignal signal) {
    List<ModificationCommand> commands = getModificationCommands();
    int commandIndex = 0;
    int resultSetCount = 0;

    try {
      do {
        while (commandIndex < commandResultSet.size()
            && commandResultSet.get(commandIndex) == ResultSetMapping.NO_RESULT_SET) {
          commandIndex++;
        }

        if (commandIndex < commandResultSet.size()) {
          commandIndex =
              commands.get(commandIndex).requiresResultPropagation()
                  ? consumeResultSetWithPropagation(commandIndex, reader, signal)
                  : checkRowCount(commandIndex, reader);
          resultSetCount++;
        }
      } while (commandIndex < commandResultSet.size() && reader.nextResultSet());

      if (commandResultSet.subList(commandIndex, commandResultSet.size()).stream()
          .anyMatch(mapping -> mapping != ResultSetMapping.NO_RESULT_SET)) {
        log.warn(
            "Reply ended after {} result sets; commands from index {} were not reconciled",
            resultSetCount,
            commandIndex);
      } else {
        log.debug("Reconciled {} commands over {} result sets", commands.size(), resultSetCount);
      }
    } catch (DbUpdateException | CancellationException e) {
      throw e;
    } catch (SQLException | RuntimeException e) {
      ModificationCommand active = commands.get(Math.min(commandIndex, commands.size() - 1));
      log.error("Reading the reply failed at {}: {}", active, e.getMessage(), e);
      throw new DbUpdateException(DbUpdateException.UPDATE_STORE_EXCEPTION, e, List.of(active));
    }
  }

  private int consumeResultSetWithPropagation(
      int commandIndex, ResultStream reader, CancellationSignal signal) throws SQLException {
    // one affected row per inserted record, whatever the result set reads back
    if (getModificationCommands().get(commandIndex).getEntityState() == EntityState.ADDED) {
      checkRowCount(commandIndex, reader);
    }

    int rowsAffected = 0;
    int insertedInResultSet = 0;
    do {
      signal.throwIfCancelled();
      ModificationCommand command = getModificationCommands().get(commandIndex);

      if (command.getEntityState() == EntityState.ADDED) {
        if (!command.nonKeyReadColumnNames().isEmpty()) {
          Optional<Row> row = reader.readRow();
          if (row.isEmpty()) {
            throw concurrencyException(commandIndex, commandIndex + 1, 1, 0);
          }
          command.propagateNonKeyResults(row.get());
        }
        propagateIdentity(command, reader, insertedInResultSet++);
      } else {
        Optional<Row> row = reader.readRow();
        if (row.isEmpty()) {
          int failedIndex = commandIndex;
          int expectedRowsAffected = rowsAffected + 1;
          while (++commandIndex < commandResultSet.size()
              && commandResultSet.get(commandIndex - 1)
                  == ResultSetMapping.NOT_LAST_IN_RESULT_SET) {
            expectedRowsAffected++;
          }
          throw concurrencyException(failedIndex, commandIndex, expectedRowsAffected, rowsAffected);
        }
        command.propagateResults(row.get());
      }
      rowsAffected++;
    } while (++commandIndex < commandResultSet.size()
        && commandResultSet.get(commandIndex - 1) == ResultSetMapping.NOT_LAST_IN_RESULT_SET);

    return commandIndex;
  }

  /**
   * Compares the affected-row count with the commands of the result set starting at {@code
   * commandIndex} and returns the index just past them.
   */
  private int checkRowCount(int commandIndex, ResultStream reader) throws SQLException {
    int firstIndex = commandIndex;
    int expectedRowsAffected = 1;
    while (++commandIndex < commandResultSet.size()
        && commandResultSet.get(commandIndex - 1) == ResultSetMapping.NOT_LAST_IN_RESULT_SET) {
      expectedRowsAffected++;
    }

    long rowsAffected = reader.affectedRowCount();
    if (rowsAffected != expectedRowsAffected) {
      throw concurrencyException(firstIndex, commandIndex, expectedRowsAffected, rowsAffected);
    }
    return commandIndex;
  }

  /**
   * Writes the statement's reported identity into every read key column of {@code command}, the
   * {@code position}-th insert of its result set.
   */
  private void propagateIdentity(ModificationCommand command, ResultStream reader, int position)
      throws SQLException {
    List<ColumnModification> columns = command.getColumnModifications();
    OptionalLong identity = null;
    for (int i = 0; i < columns.size(); i++) {
      ColumnModification column = columns.get(i);
      if (!column.isKey() || !column.isRead()) {
        continue;
      }
      if (Objects.isNull(identity)) {
        identity = reader.lastGeneratedIdentity();
      }
      if (identity.isEmpty()) {
        throw new DbUpdateException(
            "The server did not report a generated identity for " + command, List.of(command));
      }
      command.assignGeneratedKey(i, identityFor(identity.getAsLong(), position));
    }
  }

  private long identityFor(long reported, int position) {
    if (identityPropagation == IdentityPropagation.SAME_VALUE) {
      return reported;
    }
    return Math.addExact(reported, Math.multiplyExact((long) position, identityIncrement));
  }

  private DbUpdateConcurrencyException concurrencyException(
      int commandIndex, int endIndex, long expectedRows, long actualRows) {
    List<ModificationCommand> affected =
        getModificationCommands().subList(commandIndex, Math.max(commandIndex + 1, endIndex));
    log.warn(
        "Concurrency conflict at command {} ({}): expected {} row(s), got {}",
        commandIndex,
        affected.get(0),
        expectedRows,
        actualRows);
    return new DbUpdateConcurrencyException(commandIndex, expectedRows, actualRows, affected);
  }
}
