/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

/** Where the SQL rendered for one command lands in the result stream of its batch. */
public enum ResultSetMapping {
  NO_RESULT_SET,
  NOT_LAST_IN_RESULT_SET,
  LAST_IN_RESULT_SET
}
