/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.update;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits the commands of one flush into batches, keeping their order. A batch that refuses a
 * command is closed and the command opens the next one.
 */
@Slf4j
public class CommandBatchPreparer {

  private final ModificationCommandBatchFactory batchFactory;

  public CommandBatchPreparer(ModificationCommandBatchFactory batchFactory) {
    this.batchFactory = Objects.requireNonNull(batchFactory, "Batch factory cannot be null");
  }

  public List<ModificationCommandBatch> batch(List<ModificationCommand> commands) {
    Objects.requireNonNull(commands, "Command list cannot be null");
    List<ModificationCommandBatch> batches = new ArrayList<>();
    ModificationCommandBatch current = batchFactory.create();

    for (ModificationCommand command : commands) {
      if (current.addCommand(command)) {
        continue;
      }
      if (current.getModificationCommands().isEmpty()) {
        throw new DbUpdateException(
            "Command does not fit in an empty batch: " + command, List.of(command));
      }
      batches.add(current);
      current = batchFactory.create();
      if (!current.addCommand(command)) {
        throw new DbUpdateException(
            "Command does not fit in an empty batch: " + command, List.of(command));
      }
    }

    if (!current.getModificationCommands().isEmpty()) {
      batches.add(current);
    }
    log.debug("Prepared {} commands into {} batches", commands.size(), batches.size());
    return batches;
  }
}
