/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A script ready to send: the command text plus the value of every named parameter it
 * references, keyed by parameter name without prefix.
 */
public record RawSqlCommand(String commandText, Map<String, Object> parameterValues) {

  public RawSqlCommand {
    Objects.requireNonNull(commandText, "Command text cannot be null.");
    Objects.requireNonNull(parameterValues, "Parameter values cannot be null.");
    parameterValues = Collections.unmodifiableMap(new LinkedHashMap<>(parameterValues));
  }
}
