/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import com.luisppb16.mycat.storage.SqlScriptExecutor;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs prepared batches one after another on the same script executor and stops at the first
 * failure. Connection and transaction handling belong to the caller.
 */
@Slf4j
public class BatchExecutor {

  /** @return the number of commands executed */
  public int execute(List<? extends ModificationCommandBatch> batches, SqlScriptExecutor executor) {
    Objects.requireNonNull(batches, "Batch list cannot be null");
    int executed = 0;
    for (ModificationCommandBatch batch : batches) {
      batch.execute(executor);
      executed += batch.getModificationCommands().size();
    }
    log.debug("Executed {} batches, {} commands", batches.size(), executed);
    return executed;
  }

  /**
   * Asynchronous form of {@link #execute}. Each batch starts once the previous one completed;
   * cancelling the returned future cancels the batch in flight and skips the rest.
   */
  public CompletableFuture<Integer> executeAsync(
      List<? extends ModificationCommandBatch> batches,
      SqlScriptExecutor executor,
      Executor asyncExecutor) {
    Objects.requireNonNull(batches, "Batch list cannot be null");
    CompletableFuture<Integer> result = new CompletableFuture<>();
    AtomicReference<CompletableFuture<Void>> inFlight = new AtomicReference<>();
    result.whenComplete(
        (ignored, failure) -> {
          CompletableFuture<Void> running = inFlight.get();
          if (result.isCancelled() && Objects.nonNull(running)) {
            running.cancel(true);
          }
        });
    executeNext(batches, 0, 0, executor, asyncExecutor, result, inFlight);
    return result;
  }

  private void executeNext(
      List<? extends ModificationCommandBatch> batches,
      int index,
      int executed,
      SqlScriptExecutor executor,
      Executor asyncExecutor,
      CompletableFuture<Integer> result,
      AtomicReference<CompletableFuture<Void>> inFlight) {
    if (result.isDone()) {
      return;
    }
    if (index == batches.size()) {
      log.debug("Executed {} batches, {} commands", batches.size(), executed);
      result.complete(executed);
      return;
    }

    ModificationCommandBatch batch = batches.get(index);
    CompletableFuture<Void> running = batch.executeAsync(executor, asyncExecutor);
    inFlight.set(running);
    if (result.isCancelled()) {
      running.cancel(true);
    }
    running.whenComplete(
        (ignored, failure) -> {
          if (Objects.nonNull(failure)) {
            result.completeExceptionally(unwrap(failure));
          } else {
            executeNext(
                batches,
                index + 1,
                executed + batch.getModificationCommands().size(),
                executor,
                asyncExecutor,
                result,
                inFlight);
          }
        });
  }

  private static Throwable unwrap(Throwable failure) {
    return failure instanceof CompletionException && Objects.nonNull(failure.getCause())
        ? failure.getCause()
        : failure;
  }
}
