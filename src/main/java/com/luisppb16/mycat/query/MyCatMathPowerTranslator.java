/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.query;

/** {@code Math.pow(a, b)} as {@code POWER(a, b)}. */
public class MyCatMathPowerTranslator extends SingleOverloadStaticMethodCallTranslator {

  public MyCatMathPowerTranslator() {
    super(Math.class, "pow", "POWER");
  }
}
