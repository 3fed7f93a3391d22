/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

import java.sql.SQLException;

/** Runs a batch script and hands back its multi-result reply. */
@FunctionalInterface
public interface SqlScriptExecutor {

  /**
   * Sends {@code command} and returns the reply positioned on its first result set. The
   * implementation registers with {@code signal} how to abort the statement while it runs.
   */
  ResultStream execute(RawSqlCommand command, CancellationSignal signal) throws SQLException;

  default ResultStream execute(RawSqlCommand command) throws SQLException {
    return execute(command, CancellationSignal.none());
  }
}
