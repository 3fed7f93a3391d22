/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import lombok.Builder;

/**
 * Ceilings a {@link MyCatModificationCommandBatch} keeps below.
 *
 * @param maxRowCount most commands in one batch
 * @param maxParameterCount parameter count a batch must stay strictly under, the command text
 *     container counting as one
 * @param maxScriptLength script length, in characters, a batch must stay under
 * @param initialLengthCheckInterval admissions before the script length is first measured
 */
@Builder(toBuilder = true)
public record BatchLimits(
    int maxRowCount, int maxParameterCount, int maxScriptLength, int initialLengthCheckInterval) {

  public static final int DEFAULT_NETWORK_PACKET_SIZE_BYTES = 4096;
  public static final int DEFAULT_MAX_SCRIPT_LENGTH = 65536 * DEFAULT_NETWORK_PACKET_SIZE_BYTES / 2;
  public static final int DEFAULT_MAX_PARAMETER_COUNT = 2100;
  public static final int DEFAULT_MAX_ROW_COUNT = 1000;
  public static final int DEFAULT_LENGTH_CHECK_INTERVAL = 50;

  public BatchLimits {
    if (maxRowCount <= 0
        || maxParameterCount <= 1
        || maxScriptLength <= 0
        || initialLengthCheckInterval < 0) {
      throw new IllegalArgumentException(
          "Batch limits out of range: rows="
              + maxRowCount
              + ", parameters="
              + maxParameterCount
              + ", scriptLength="
              + maxScriptLength
              + ", lengthCheckInterval="
              + initialLengthCheckInterval);
    }
  }

  public static BatchLimits defaults() {
    return new BatchLimits(
        DEFAULT_MAX_ROW_COUNT,
        DEFAULT_MAX_PARAMETER_COUNT,
        DEFAULT_MAX_SCRIPT_LENGTH,
        DEFAULT_LENGTH_CHECK_INTERVAL);
  }
}
