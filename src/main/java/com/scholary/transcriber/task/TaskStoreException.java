package com.scholary.transcriber.task;

/**
 * Thrown when the local task store cannot read or write a record.
 *
 * <p>Never swallowed: a state transition that could not be persisted must reach the caller of the
 * operation that triggered it.
 */
public class TaskStoreException extends RuntimeException {

  public TaskStoreException(String message) {
    super(message);
  }

  public TaskStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
