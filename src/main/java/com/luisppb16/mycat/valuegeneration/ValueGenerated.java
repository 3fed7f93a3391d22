/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.valuegeneration;

/** When the store generates a value for a property. */
public enum ValueGenerated {
  NEVER,
  ON_ADD,
  ON_ADD_OR_UPDATE
}
