/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import com.luisppb16.mycat.storage.CancellationSignal;
import com.luisppb16.mycat.storage.RawSqlCommand;
import com.luisppb16.mycat.storage.ResultStream;
import com.luisppb16.mycat.storage.SqlScriptExecutor;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Batch that renders its commands into one script, sends it, and hands the reply to {@link
 * #consume(ResultStream, CancellationSignal)}.
 *
 * <p>The script is built lazily and cached: {@link #getCommandText()} only renders the commands
 * admitted since the previous call. {@link #commandResultSet} holds one {@link ResultSetMapping}
 * per admitted command, filled in as commands are rendered.
 */
@Slf4j
public abstract class ReaderModificationCommandBatch extends ModificationCommandBatch {

  private final List<ModificationCommand> modificationCommands = new ArrayList<>();

  protected final UpdateSqlGenerator updateSqlGenerator;
  protected final List<ResultSetMapping> commandResultSet = new ArrayList<>();
  protected StringBuilder cachedCommandText;
  protected int lastCachedCommandIndex;

  protected ReaderModificationCommandBatch(UpdateSqlGenerator updateSqlGenerator) {
    this.updateSqlGenerator =
        Objects.requireNonNull(updateSqlGenerator, "Update SQL generator cannot be null");
    this.cachedCommandText = new StringBuilder();
    updateSqlGenerator.appendBatchHeader(cachedCommandText);
    this.lastCachedCommandIndex = -1;
  }

  @Override
  public List<ModificationCommand> getModificationCommands() {
    return Collections.unmodifiableList(modificationCommands);
  }

  @Override
  public boolean addCommand(ModificationCommand command) {
    Objects.requireNonNull(command, "Modification command cannot be null");
    if (modificationCommands.isEmpty()) {
      resetCommandText();
    }

    if (!canAddCommand(command)) {
      return false;
    }

    modificationCommands.add(command);
    commandResultSet.add(
        command.requiresResultPropagation()
            ? ResultSetMapping.LAST_IN_RESULT_SET
            : ResultSetMapping.NO_RESULT_SET);

    if (!isCommandTextValid()) {
      resetCommandText();
      int last = modificationCommands.size() - 1;
      modificationCommands.remove(last);
      commandResultSet.remove(last);
      onCommandRemoved(command);
      return false;
    }
    return true;
  }

  /** Admission check, run before {@code command} joins the batch. */
  protected abstract boolean canAddCommand(ModificationCommand command);

  /** Checked right after a command joined; {@code false} takes it out again. */
  protected abstract boolean isCommandTextValid();

  /** Undo whatever {@link #canAddCommand} recorded for a command taken out again. */
  protected void onCommandRemoved(ModificationCommand command) {}

  /** Walks the reply in step with {@link #getModificationCommands()}. */
  protected abstract void consume(ResultStream reader, CancellationSignal signal);

  protected void resetCommandText() {
    cachedCommandText = new StringBuilder();
    updateSqlGenerator.appendBatchHeader(cachedCommandText);
    lastCachedCommandIndex = -1;
  }

  protected String getCommandText() {
    for (int i = lastCachedCommandIndex + 1; i < modificationCommands.size(); i++) {
      updateCachedCommandText(i);
    }
    return cachedCommandText.toString();
  }

  protected void updateCachedCommandText(int commandPosition) {
    ModificationCommand command = modificationCommands.get(commandPosition);
    ResultSetMapping mapping =
        switch (command.getEntityState()) {
          case ADDED -> updateSqlGenerator.appendInsertOperation(
              cachedCommandText, command, commandPosition);
          case MODIFIED -> updateSqlGenerator.appendUpdateOperation(
              cachedCommandText, command, commandPosition);
          case DELETED -> updateSqlGenerator.appendDeleteOperation(
              cachedCommandText, command, commandPosition);
        };
    commandResultSet.set(commandPosition, mapping);
    lastCachedCommandIndex = commandPosition;
  }

  /** The script plus the current and original values of every parameter it names. */
  protected RawSqlCommand createStoreCommand() {
    String commandText = getCommandText();
    if (commandResultSet.size() != modificationCommands.size()) {
      throw new IllegalStateException(
          "Batch has "
              + modificationCommands.size()
              + " commands but "
              + commandResultSet.size()
              + " result set mappings");
    }

    Map<String, Object> parameterValues = new LinkedHashMap<>();
    for (ModificationCommand command : modificationCommands) {
      for (ColumnModification column : command.getColumnModifications()) {
        if (Objects.nonNull(column.getParameterName())) {
          putParameter(parameterValues, column.getParameterName(), column.getValue());
        }
        if (column.usesOriginalValueParameter()) {
          putParameter(
              parameterValues, column.getOriginalParameterName(), column.getOriginalValue());
        }
      }
    }
    return new RawSqlCommand(commandText, parameterValues);
  }

  private static void putParameter(Map<String, Object> values, String name, Object value) {
    if (values.containsKey(name) && !Objects.equals(values.get(name), value)) {
      throw new IllegalStateException("Parameter '" + name + "' is bound to two different values");
    }
    values.put(name, value);
  }

  @Override
  public void execute(SqlScriptExecutor executor) {
    execute(executor, CancellationSignal.none());
  }

  @Override
  public CompletableFuture<Void> executeAsync(SqlScriptExecutor executor, Executor asyncExecutor) {
    Objects.requireNonNull(asyncExecutor, "Async executor cannot be null");
    CancellationSignal signal = new CancellationSignal();
    CompletableFuture<Void> future = new CompletableFuture<>();
    future.whenComplete(
        (ignored, failure) -> {
          if (future.isCancelled()) {
            signal.cancel();
          }
        });

    try {
      asyncExecutor.execute(
          () -> {
            if (future.isDone()) {
              return;
            }
            try {
              execute(executor, signal);
              future.complete(null);
            } catch (Throwable t) {
              future.completeExceptionally(t);
            }
          });
    } catch (RejectedExecutionException e) {
      future.completeExceptionally(e);
    }
    return future;
  }

  private void execute(SqlScriptExecutor executor, CancellationSignal signal) {
    Objects.requireNonNull(executor, "Script executor cannot be null");
    if (modificationCommands.isEmpty()) {
      log.debug("Nothing to execute, batch is empty");
      return;
    }
    RawSqlCommand storeCommand = createStoreCommand();
    log.debug(
        "Executing batch of {} commands, {} parameters, {} chars",
        modificationCommands.size(),
        storeCommand.parameterValues().size(),
        storeCommand.commandText().length());

    try (ResultStream reader = executor.execute(storeCommand, signal)) {
      consume(reader, signal);
    } catch (DbUpdateException | CancellationException e) {
      throw e;
    } catch (SQLException | RuntimeException e) {
      if (signal.isCancelled()) {
        CancellationException cancelled =
            new CancellationException("Batch execution was cancelled.");
        cancelled.initCause(e);
        throw cancelled;
      }
      log.error("Batch of {} commands failed: {}", modificationCommands.size(), e.getMessage(), e);
      throw new DbUpdateException(
          DbUpdateException.UPDATE_STORE_EXCEPTION, e, modificationCommands);
    } finally {
      signal.clear();
    }
  }
}
