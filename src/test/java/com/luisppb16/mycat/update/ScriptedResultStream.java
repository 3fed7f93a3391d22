/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import com.luisppb16.mycat.storage.ResultStream;
import com.luisppb16.mycat.storage.Row;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/** A reply replayed from a fixed list of result sets. */
final class ScriptedResultStream implements ResultStream {

  record Result(long affectedRows, OptionalLong identity, List<Row> rows) {

    static Result affected(long rows) {
      return new Result(rows, OptionalLong.empty(), List.of());
    }

    static Result inserted(long rows, long identity) {
      return new Result(rows, OptionalLong.of(identity), List.of());
    }

    @SafeVarargs
    static Result returning(Map<String, ?>... rows) {
      return new Result(
          rows.length,
          OptionalLong.empty(),
          Arrays.stream(rows).map(row -> new Row(new LinkedHashMap<String, Object>(row))).toList());
    }
  }

  private final List<Result> results;
  private int current;
  private int rowIndex;
  private boolean closed;
  private int rowsRead;

  ScriptedResultStream(Result... results) {
    this.results = new ArrayList<>(List.of(results));
  }

  @Override
  public long affectedRowCount() {
    return currentResult().affectedRows();
  }

  @Override
  public OptionalLong lastGeneratedIdentity() {
    return currentResult().identity();
  }

  @Override
  public Optional<Row> readRow() {
    List<Row> rows = currentResult().rows();
    if (rowIndex >= rows.size()) {
      return Optional.empty();
    }
    rowsRead++;
    return Optional.of(rows.get(rowIndex++));
  }

  @Override
  public boolean nextResultSet() {
    if (current + 1 >= results.size()) {
      current = results.size();
      return false;
    }
    current++;
    rowIndex = 0;
    return true;
  }

  @Override
  public void close() {
    closed = true;
  }

  boolean isClosed() {
    return closed;
  }

  int rowsRead() {
    return rowsRead;
  }

  private Result currentResult() {
    if (current >= results.size()) {
      throw new IllegalStateException("No current result set");
    }
    return results.get(current);
  }
}
