/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

/** Creates an empty batch for each flush cycle. */
@FunctionalInterface
public interface ModificationCommandBatchFactory {

  ModificationCommandBatch create();
}
