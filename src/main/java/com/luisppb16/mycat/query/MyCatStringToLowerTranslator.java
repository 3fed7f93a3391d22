/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.query;

public class MyCatStringToLowerTranslator extends ParameterlessInstanceMethodCallTranslator {

  public MyCatStringToLowerTranslator() {
    super(String.class, "toLowerCase", "LOWER");
  }
}
