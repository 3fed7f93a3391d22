/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.valuegeneration;

/**
 * Produces key values on the client before a row reaches the store.
 *
 * @param <T> type of the generated values
 */
public abstract class ValueGenerator<T> {

  public abstract T next();

  /**
   * Whether the values are placeholders the store replaces on insert, as opposed to values that
   * are saved as they are.
   */
  public abstract boolean generatesTemporaryValues();
}
