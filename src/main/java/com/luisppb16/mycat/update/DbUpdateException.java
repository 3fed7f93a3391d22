/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import java.util.List;
import java.util.Objects;

/**
 * Saving a batch of changes failed. Carries the commands that were being processed when the
 * failure happened, so the caller can tell which rows were affected.
 */
public class DbUpdateException extends RuntimeException {

  public static final String UPDATE_STORE_EXCEPTION =
      "An error occurred while updating the entries. See the inner exception for details.";

  private final transient List<ModificationCommand> commands;

  public DbUpdateException(String message, List<ModificationCommand> commands) {
    super(message);
    this.commands = List.copyOf(commands);
  }

  public DbUpdateException(String message, Throwable cause, List<ModificationCommand> commands) {
    super(message, cause);
    this.commands = List.copyOf(commands);
  }

  public List<ModificationCommand> getCommands() {
    return commands;
  }

  /** The tracked objects behind {@link #getCommands()}, for commands that carry one. */
  public List<Object> getEntries() {
    return commands.stream().map(ModificationCommand::getEntry).filter(Objects::nonNull).toList();
  }
}
