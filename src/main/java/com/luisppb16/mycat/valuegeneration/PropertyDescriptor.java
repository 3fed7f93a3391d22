/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.valuegeneration;

import java.util.Objects;
import lombok.Builder;

@Builder(toBuilder = true)
public record PropertyDescriptor(
    String entityName,
    String name,
    Class<?> type,
    ValueGenerated valueGenerated,
    String defaultValueSql) {

  public PropertyDescriptor {
    Objects.requireNonNull(name, "Property name cannot be null.");
    Objects.requireNonNull(type, "Property type cannot be null.");
    valueGenerated = Objects.requireNonNullElse(valueGenerated, ValueGenerated.NEVER);
  }
}
