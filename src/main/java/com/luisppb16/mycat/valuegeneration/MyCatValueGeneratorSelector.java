/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.valuegeneration;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses, and caches per property, the client-side generator for key values.
 *
 * <ul>
 *   <li>UUID properties get random temporary values when the store never generates them or has a
 *       default SQL expression for them, and sequential UUIDs otherwise
 *   <li>store-generated integral properties get negative temporary placeholders
 *   <li>anything else has no client-side generator
 * </ul>
 */
@Slf4j
public class MyCatValueGeneratorSelector {

  private final Map<String, ValueGenerator<?>> cache = new ConcurrentHashMap<>();

  public Optional<ValueGenerator<?>> select(PropertyDescriptor property) {
    Objects.requireNonNull(property, "Property cannot be null");
    return Optional.ofNullable(
        cache.computeIfAbsent(key(property), k -> create(property).orElse(null)));
  }

  Optional<ValueGenerator<?>> create(PropertyDescriptor property) {
    if (property.type() == UUID.class) {
      ValueGenerator<?> generator =
          property.valueGenerated() == ValueGenerated.NEVER
                  || Objects.nonNull(property.defaultValueSql())
              ? new TemporaryGuidValueGenerator()
              : new SequentialGuidValueGenerator();
      log.debug(
          "{} for {}.{}",
          generator.getClass().getSimpleName(),
          property.entityName(),
          property.name());
      return Optional.of(generator);
    }
    if (property.valueGenerated() != ValueGenerated.NEVER
        && TemporaryNumberValueGenerator.supports(property.type())) {
      return Optional.of(new TemporaryNumberValueGenerator(property.type()));
    }
    return Optional.empty();
  }

  private static String key(PropertyDescriptor property) {
    return property.entityName() + "." + property.name();
  }
}
