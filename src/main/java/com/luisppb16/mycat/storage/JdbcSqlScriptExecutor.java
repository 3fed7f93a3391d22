/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs batch scripts on a JDBC {@link Connection} as a single {@link PreparedStatement}.
 *
 * <p>Scripts holding several statements need a driver that accepts them in one call (for
 * MySQL Connector/J, {@code allowMultiQueries=true}). The connection is borrowed: opening,
 * closing and transaction scoping stay with the caller.
 */
@Slf4j
public class JdbcSqlScriptExecutor implements SqlScriptExecutor {

  private final Connection connection;
  private final SqlGenerationHelper sqlGenerationHelper;

  public JdbcSqlScriptExecutor(Connection connection, SqlGenerationHelper sqlGenerationHelper) {
    this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
    this.sqlGenerationHelper =
        Objects.requireNonNull(sqlGenerationHelper, "SQL generation helper cannot be null");
  }

  @Override
  public ResultStream execute(RawSqlCommand command, CancellationSignal signal)
      throws SQLException {
    final NamedParameters.Expanded expanded =
        NamedParameters.expand(
            command.commandText(),
            command.parameterValues(),
            sqlGenerationHelper.parameterPrefix());
    log.debug(
        "Executing script of {} chars with {} parameters",
        expanded.sql().length(),
        expanded.values().size());

    final PreparedStatement statement =
        connection.prepareStatement(expanded.sql(), Statement.RETURN_GENERATED_KEYS);
    try {
      bind(statement, expanded.values());
      signal.onCancel(statement::cancel);
      signal.throwIfCancelled();
      final boolean firstIsResultSet = statement.execute();
      return new JdbcResultStream(statement, firstIsResultSet);
    } catch (SQLException | RuntimeException e) {
      closeAfterFailure(statement, e);
      throw e;
    }
  }

  private static void bind(PreparedStatement statement, List<Object> values) throws SQLException {
    for (int i = 0; i < values.size(); i++) {
      statement.setObject(i + 1, values.get(i));
    }
  }

  private static void closeAfterFailure(Statement statement, Exception failure) {
    try {
      statement.close();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }
}
