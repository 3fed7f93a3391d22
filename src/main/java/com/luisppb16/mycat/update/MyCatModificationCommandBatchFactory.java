/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import com.luisppb16.mycat.config.MyCatOptions;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds {@link MyCatModificationCommandBatch} instances from provider options. The options are
 * validated here, so an invalid {@code maxBatchSize} fails before any batch exists.
 */
@Slf4j
public class MyCatModificationCommandBatchFactory implements ModificationCommandBatchFactory {

  private final UpdateSqlGenerator updateSqlGenerator;
  private final MyCatOptions options;
  private final BatchLimits limits;

  public MyCatModificationCommandBatchFactory(
      UpdateSqlGenerator updateSqlGenerator, MyCatOptions options) {
    this(updateSqlGenerator, options, BatchLimits.defaults());
  }

  public MyCatModificationCommandBatchFactory(
      UpdateSqlGenerator updateSqlGenerator, MyCatOptions options, BatchLimits limits) {
    this.updateSqlGenerator =
        Objects.requireNonNull(updateSqlGenerator, "Update SQL generator cannot be null");
    this.options = Objects.requireNonNull(options, "Options cannot be null").validate();
    this.limits = Objects.requireNonNull(limits, "Batch limits cannot be null");
    log.debug("Batch factory ready with {} and {}", options, limits);
  }

  @Override
  public ModificationCommandBatch create() {
    return new MyCatModificationCommandBatch(updateSqlGenerator, options, limits);
  }
}
