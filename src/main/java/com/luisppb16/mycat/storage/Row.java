/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** One row read back from the store, keyed by column label in select-list order. */
public record Row(Map<String, Object> values) {

  public Row {
    Objects.requireNonNull(values, "Row values cannot be null.");
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Resolves the label under which {@code columnName} was returned: the exact label first, then
   * ignoring case, since drivers differ in how they report unquoted labels.
   */
  public Optional<String> label(String columnName) {
    if (values.containsKey(columnName)) {
      return Optional.of(columnName);
    }
    String wanted = columnName.toLowerCase(Locale.ROOT);
    return values.keySet().stream()
        .filter(label -> label.toLowerCase(Locale.ROOT).equals(wanted))
        .findFirst();
  }

  public Object get(String label) {
    return values.get(label);
  }
}
