/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import java.util.List;

/**
 * A result set affected a different number of rows than the commands it covers. Usually the rows
 * were modified or deleted by someone else since they were loaded.
 */
public class DbUpdateConcurrencyException extends DbUpdateException {

  private final int commandIndex;
  private final long expectedRows;
  private final long actualRows;

  public DbUpdateConcurrencyException(
      int commandIndex, long expectedRows, long actualRows, List<ModificationCommand> commands) {
    super(
        "Database operation expected to affect "
            + expectedRows
            + " row(s) but actually affected "
            + actualRows
            + " row(s). Data may have been modified or deleted since entities were loaded.",
        commands);
    this.commandIndex = commandIndex;
    this.expectedRows = expectedRows;
    this.actualRows = actualRows;
  }

  /** Position, within its batch, of the first command the mismatch was detected on. */
  public int getCommandIndex() {
    return commandIndex;
  }

  public long getExpectedRows() {
    return expectedRows;
  }

  public long getActualRows() {
    return actualRows;
  }
}
