/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.valuegeneration;

import java.util.UUID;

public class TemporaryGuidValueGenerator extends ValueGenerator<UUID> {

  @Override
  public UUID next() {
    return UUID.randomUUID();
  }

  @Override
  public boolean generatesTemporaryValues() {
    return true;
  }
}
