package com.scholary.transcriber.remote;

/** Thrown when the remote service has no audio for a task (never kept, or already deleted). */
public class AudioNotAvailableException extends RemoteServiceException {

  public AudioNotAvailableException(String taskId) {
    super("No remote audio available for task: " + taskId);
  }
}
