/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link ResultStream} over the results of one JDBC {@link Statement}.
 *
 * <p>JDBC reports one result per statement. An update count that is immediately followed by a
 * row-returning result is folded with it into one logical result set: that is the shape of an
 * UPDATE followed by the SELECT reading back its computed columns. Generated keys are captured
 * as soon as the stream lands on an update count, before the statement moves on.
 */
public class JdbcResultStream implements ResultStream {

  private static final int NO_MORE_RESULTS = -1;

  private final Statement statement;

  private ResultSet rows;
  private long affectedRowCount = NO_MORE_RESULTS;
  private OptionalLong identity = OptionalLong.empty();
  private boolean exhausted;
  private boolean hasLookahead;
  private int lookaheadCount;

  JdbcResultStream(Statement statement, boolean firstIsResultSet) throws SQLException {
    this.statement = Objects.requireNonNull(statement, "Statement cannot be null");
    if (firstIsResultSet) {
      positionOnRows();
    } else {
      positionOnCount(statement.getUpdateCount());
    }
  }

  @Override
  public long affectedRowCount() {
    return affectedRowCount;
  }

  @Override
  public OptionalLong lastGeneratedIdentity() {
    return identity;
  }

  @Override
  public Optional<Row> readRow() throws SQLException {
    if (Objects.isNull(rows) || !rows.next()) {
      return Optional.empty();
    }
    final ResultSetMetaData meta = rows.getMetaData();
    final Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 1; i <= meta.getColumnCount(); i++) {
      values.put(meta.getColumnLabel(i), rows.getObject(i));
    }
    return Optional.of(new Row(values));
  }

  @Override
  public boolean nextResultSet() throws SQLException {
    if (exhausted) {
      return false;
    }
    if (hasLookahead) {
      hasLookahead = false;
      positionOnCount(lookaheadCount);
    } else if (statement.getMoreResults()) {
      positionOnRows();
    } else {
      positionOnCount(statement.getUpdateCount());
    }
    return !exhausted;
  }

  @Override
  public void close() throws SQLException {
    try {
      if (Objects.nonNull(rows)) {
        rows.close();
      }
    } finally {
      statement.close();
    }
  }

  private void positionOnRows() throws SQLException {
    rows = statement.getResultSet();
    affectedRowCount = NO_MORE_RESULTS;
    identity = OptionalLong.empty();
  }

  private void positionOnCount(int count) throws SQLException {
    rows = null;
    identity = OptionalLong.empty();
    if (count == NO_MORE_RESULTS) {
      affectedRowCount = NO_MORE_RESULTS;
      exhausted = true;
      return;
    }
    affectedRowCount = count;
    identity = readGeneratedIdentity();

    if (statement.getMoreResults()) {
      rows = statement.getResultSet();
    } else {
      hasLookahead = true;
      lookaheadCount = statement.getUpdateCount();
    }
  }

  private OptionalLong readGeneratedIdentity() throws SQLException {
    try (ResultSet keys = statement.getGeneratedKeys()) {
      if (Objects.nonNull(keys) && keys.next() && keys.getObject(1) instanceof Number n) {
        return OptionalLong.of(n.longValue());
      }
    }
    return OptionalLong.empty();
  }
}
