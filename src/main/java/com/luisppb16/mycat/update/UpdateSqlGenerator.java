/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import java.util.List;

/**
 * Renders modification commands as SQL text. Every {@code append*Operation} method reports how
 * what it appended shows up in the reply.
 */
public interface UpdateSqlGenerator {

  /** Appended once at the start of every batch script. */
  void appendBatchHeader(StringBuilder commandStringBuilder);

  ResultSetMapping appendInsertOperation(
      StringBuilder commandStringBuilder, ModificationCommand command, int commandPosition);

  ResultSetMapping appendUpdateOperation(
      StringBuilder commandStringBuilder, ModificationCommand command, int commandPosition);

  ResultSetMapping appendDeleteOperation(
      StringBuilder commandStringBuilder, ModificationCommand command, int commandPosition);

  /**
   * Renders {@code commands}, inserts into one table with identical column shapes, as a single
   * multi-row statement. {@code commandPosition} is the batch position just past the last of them.
   */
  ResultSetMapping appendBulkInsertOperation(
      StringBuilder commandStringBuilder, List<ModificationCommand> commands, int commandPosition);
}
