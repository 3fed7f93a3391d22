/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.config;

/**
 * Thrown when provider options are invalid, such as a non-positive maximum batch size or a
 * malformed options file.
 */
public class MyCatConfigurationException extends RuntimeException {

  public MyCatConfigurationException(String message) {
    super(message);
  }

  public MyCatConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
