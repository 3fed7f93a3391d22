/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.config;

/**
 * How the identity reported for a multi-row INSERT is spread over the rows of that statement.
 *
 * <p>MySQL allocates a contiguous block of auto-increment values for a single multi-row INSERT
 * and reports the first one. {@link #CONTIGUOUS} follows that rule; {@link #SAME_VALUE} keeps the
 * older provider behaviour of copying the reported value into every row of the group.
 */
public enum IdentityPropagation {
  CONTIGUOUS,
  SAME_VALUE
}
