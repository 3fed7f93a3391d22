/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import lombok.extern.slf4j.Slf4j;

/**
 * Carries a cancellation request from the thread that owns an asynchronous flush to the thread
 * blocked on the store.
 *
 * <p>The executor registers how to abort its in-flight statement with {@link #onCancel}; a
 * {@link #cancel()} arriving before registration is replayed as soon as the canceller is set.
 */
@Slf4j
public final class CancellationSignal {

  /** Aborts a running statement, typically {@link java.sql.Statement#cancel()}. */
  @FunctionalInterface
  public interface Canceller {
    void cancel() throws SQLException;
  }

  private volatile boolean cancelled;
  private volatile Canceller canceller;

  /** A signal nobody can cancel, for blocking callers. */
  public static CancellationSignal none() {
    return new CancellationSignal();
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public void cancel() {
    cancelled = true;
    invoke(canceller);
  }

  public void onCancel(Canceller canceller) {
    this.canceller = canceller;
    if (cancelled) {
      invoke(canceller);
    }
  }

  public void clear() {
    this.canceller = null;
  }

  public void throwIfCancelled() {
    if (cancelled) {
      throw new CancellationException("The operation was cancelled.");
    }
  }

  private static void invoke(Canceller target) {
    if (Objects.isNull(target)) {
      return;
    }
    try {
      target.cancel();
    } catch (SQLException e) {
      log.warn("Could not abort the running statement: {}", e.getMessage(), e);
    }
  }
}
