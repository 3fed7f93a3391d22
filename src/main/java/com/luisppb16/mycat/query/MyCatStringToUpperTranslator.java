/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.query;

public class MyCatStringToUpperTranslator extends ParameterlessInstanceMethodCallTranslator {

  public MyCatStringToUpperTranslator() {
    super(String.class, "toUpperCase", "UPPER");
  }
}
