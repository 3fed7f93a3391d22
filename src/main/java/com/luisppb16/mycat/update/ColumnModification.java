/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import java.util.Objects;
import lombok.Builder;
import lombok.Getter;

/**
 * One column of a {@link ModificationCommand}.
 *
 * <p>A column is independently flagged as written (its current value is sent through
 * {@link #getParameterName()}), read (the store computes it and it is propagated back after the
 * batch runs), key (it identifies the row) and condition (it appears in the WHERE clause, through
 * {@link #getOriginalParameterName()} when the original value is compared). Only {@link #getValue()}
 * is mutable: it is overwritten by result propagation.
 */
@Getter
public final class ColumnModification {

  private final String columnName;
  private final Class<?> propertyType;
  private final String parameterName;
  private final String originalParameterName;
  private final boolean read;
  private final boolean write;
  private final boolean key;
  private final boolean condition;
  private final Object originalValue;
  private Object value;

  @Builder(toBuilder = true)
  private ColumnModification(
      String columnName,
      Class<?> propertyType,
      String parameterName,
      String originalParameterName,
      boolean read,
      boolean write,
      boolean key,
      boolean condition,
      Object originalValue,
      Object value) {
    this.columnName = Objects.requireNonNull(columnName, "Column name cannot be null.");
    this.propertyType = Objects.requireNonNullElse(propertyType, Object.class);
    this.parameterName = parameterName;
    this.originalParameterName = originalParameterName;
    this.read = read;
    this.write = write;
    this.key = key;
    this.condition = condition;
    this.originalValue = originalValue;
    this.value = value;

    if (write && Objects.isNull(parameterName)) {
      throw new IllegalArgumentException(
          "Column '" + columnName + "' is written but has no parameter name.");
    }
  }

  void setValue(Object value) {
    this.value = value;
  }

  /** Whether the WHERE clause compares this column to its original value. */
  public boolean usesOriginalValueParameter() {
    return Objects.nonNull(originalParameterName);
  }

  @Override
  public String toString() {
    return "ColumnModification{"
        + columnName
        + (read ? ", read" : "")
        + (write ? ", write" : "")
        + (key ? ", key" : "")
        + (condition ? ", condition" : "")
        + '}';
  }
}
