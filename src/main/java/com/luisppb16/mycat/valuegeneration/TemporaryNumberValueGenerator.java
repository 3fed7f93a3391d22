/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.valuegeneration;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out negative placeholders for store-generated integral keys, so added rows can be told
 * apart before the store assigns the real identity.
 */
public class TemporaryNumberValueGenerator extends ValueGenerator<Number> {

  private final Class<?> type;
  private final AtomicLong current;

  public TemporaryNumberValueGenerator(Class<?> type) {
    this.type = Objects.requireNonNull(type, "Type cannot be null");
    this.current = new AtomicLong(startFor(type));
  }

  static boolean supports(Class<?> type) {
    return type == Integer.class
        || type == int.class
        || type == Long.class
        || type == long.class
        || type == Short.class
        || type == short.class;
  }

  private static long startFor(Class<?> type) {
    if (type == Long.class || type == long.class) {
      return Long.MIN_VALUE + 1000;
    }
    if (type == Integer.class || type == int.class) {
      return Integer.MIN_VALUE + 1000;
    }
    if (type == Short.class || type == short.class) {
      return Short.MIN_VALUE + 100;
    }
    throw new IllegalArgumentException("No temporary values for " + type.getName());
  }

  @Override
  public Number next() {
    final long value = current.incrementAndGet();
    if (value >= 0) {
      throw new IllegalStateException("Ran out of temporary values for " + type.getName());
    }
    if (type == Integer.class || type == int.class) {
      return (int) value;
    }
    if (type == Short.class || type == short.class) {
      return (short) value;
    }
    return value;
  }

  @Override
  public boolean generatesTemporaryValues() {
    return true;
  }
}
