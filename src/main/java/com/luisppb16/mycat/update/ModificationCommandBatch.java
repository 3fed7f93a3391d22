/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import com.luisppb16.mycat.storage.SqlScriptExecutor;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A group of modification commands sent to the store in one round trip. A batch serves a single
 * flush cycle and is discarded afterwards.
 */
public abstract class ModificationCommandBatch {

  /** The admitted commands, in execution order. */
  public abstract List<ModificationCommand> getModificationCommands();

  /**
   * Admits {@code command} when the batch still has room for it.
   *
   * @return {@code false} when the batch is full; the batch is then left as it was
   */
  public abstract boolean addCommand(ModificationCommand command);

  /** Runs the batch and reconciles the reply with the admitted commands. */
  public abstract void execute(SqlScriptExecutor executor);

  /**
   * Runs the batch on {@code asyncExecutor}. Cancelling the returned future aborts the statement
   * in flight and stops propagation into the remaining commands.
   */
  public abstract CompletableFuture<Void> executeAsync(
      SqlScriptExecutor executor, Executor asyncExecutor);
}
