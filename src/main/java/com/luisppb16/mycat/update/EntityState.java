/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

/** The kind of change a {@link ModificationCommand} applies to its row. */
public enum EntityState {
  /** A new row; rendered as an INSERT. */
  ADDED,
  /** An existing row with changed columns; rendered as an UPDATE. */
  MODIFIED,
  /** An existing row to remove; rendered as a DELETE. */
  DELETED
}
