/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.config;

import java.util.Objects;
import lombok.Builder;

@Builder(toBuilder = true)
public record MyCatOptions(
    Integer maxBatchSize, IdentityPropagation identityPropagation, Integer identityIncrement) {

  public static final int DEFAULT_IDENTITY_INCREMENT = 1;

  public MyCatOptions {
    identityPropagation =
        Objects.requireNonNullElse(identityPropagation, IdentityPropagation.CONTIGUOUS);
    identityIncrement = Objects.requireNonNullElse(identityIncrement, DEFAULT_IDENTITY_INCREMENT);
  }

  public static MyCatOptions defaults() {
    return MyCatOptions.builder().build();
  }

  /** Fails with {@link MyCatConfigurationException} when any option is out of range. */
  public MyCatOptions validate() {
    if (Objects.nonNull(maxBatchSize) && maxBatchSize <= 0) {
      throw new MyCatConfigurationException(
          "The specified 'maxBatchSize' value is not valid. It must be a positive number, but was "
              + maxBatchSize
              + ".");
    }
    if (identityIncrement < 1) {
      throw new MyCatConfigurationException(
          "The specified 'identityIncrement' value must be at least 1, but was "
              + identityIncrement
              + ".");
    }
    return this;
  }
}
