package com.scholary.transcriber.task;

/** Thrown when an operation names a task id that is not in the store. */
public class TaskNotFoundException extends RuntimeException {

  private final String taskId;

  public TaskNotFoundException(String taskId) {
    super("Task not found: " + taskId);
    this.taskId = taskId;
  }

  public String getTaskId() {
    return taskId;
  }
}
