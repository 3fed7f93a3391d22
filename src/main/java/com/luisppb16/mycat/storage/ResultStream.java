/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

import java.sql.SQLException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Forward-only view of the reply to one batch script, positioned on its first logical result set
 * when returned by {@link SqlScriptExecutor#execute(RawSqlCommand)}.
 *
 * <p>A logical result set is what one statement (or one statement plus the SELECT that reads
 * back its computed columns) produced: an affected-row count, returned rows, or both.
 */
public interface ResultStream extends AutoCloseable {

  /** Rows affected by the current result set, or {@code -1} when it only returned rows. */
  long affectedRowCount() throws SQLException;

  /** The first identity value the store generated for the current result set, if any. */
  OptionalLong lastGeneratedIdentity() throws SQLException;

  /** Reads the next row of the current result set. */
  Optional<Row> readRow() throws SQLException;

  /** Moves to the next logical result set; {@code false} when the reply is exhausted. */
  boolean nextResultSet() throws SQLException;

  @Override
  void close() throws SQLException;
}
