package com.scholary.transcriber.task;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a transcription task.
 *
 * <p>Transitions only move forward: {@code CREATED -> SUBMITTED -> PROCESSING -> COMPLETED |
 * FAILED}. A submitted task may complete or fail on its first poll, and a task that never made it
 * past submission goes straight to {@code FAILED}.
 */
public enum TaskStatus {
  CREATED,
  SUBMITTED,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** Whether the task is still being watched by the poll loop. */
  public boolean isActive() {
    return this == SUBMITTED || this == PROCESSING;
  }

  public boolean canTransitionTo(TaskStatus next) {
    return allowedTargets().contains(next);
  }

  private Set<TaskStatus> allowedTargets() {
    return switch (this) {
      case CREATED -> EnumSet.of(SUBMITTED, FAILED);
      case SUBMITTED -> EnumSet.of(PROCESSING, COMPLETED, FAILED);
      // repeated progress updates keep the task in PROCESSING
      case PROCESSING -> EnumSet.of(PROCESSING, COMPLETED, FAILED);
      case COMPLETED, FAILED -> EnumSet.noneOf(TaskStatus.class);
    };
  }
}
