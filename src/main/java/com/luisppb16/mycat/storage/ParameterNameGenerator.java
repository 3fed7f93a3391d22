/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

/** Hands out {@code p0}, {@code p1}, ... for the parameters of one flush. Not thread-safe. */
public class ParameterNameGenerator {

  private int count;

  public String generateNext() {
    return "p" + count++;
  }
}
