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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Records the scripts it receives and answers each with the next queued reply. */
final class RecordingScriptExecutor implements SqlScriptExecutor {

  private final Deque<ResultStream> replies = new ArrayDeque<>();
  private final List<RawSqlCommand> executed = new ArrayList<>();

  RecordingScriptExecutor reply(ResultStream stream) {
    replies.add(stream);
    return this;
  }

  @Override
  public ResultStream execute(RawSqlCommand command, CancellationSignal signal)
      throws SQLException {
    executed.add(command);
    if (replies.isEmpty()) {
      throw new SQLException("No reply queued for script " + command.commandText());
    }
    return replies.poll();
  }

  List<RawSqlCommand> executed() {
    return executed;
  }

  RawSqlCommand lastExecuted() {
    return executed.get(executed.size() - 1);
  }
}
