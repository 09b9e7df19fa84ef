package com.scholary.transcriber.remote;

/** Thrown when the remote service does not accept a new job. */
public class SubmissionException extends RemoteServiceException {

  public SubmissionException(String message) {
    super(message);
  }

  public SubmissionException(String message, Throwable cause) {
    super(message, cause);
  }
}
