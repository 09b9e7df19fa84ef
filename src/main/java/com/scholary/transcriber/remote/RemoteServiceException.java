package com.scholary.transcriber.remote;

/**
 * Base exception for calls to the remote transcription service.
 *
 * <p>Subclasses tell the caller how to react: {@link SubmissionException} ends a task,
 * {@link TransientRemoteException} is retried on the next tick.
 */
public class RemoteServiceException extends RuntimeException {

  public RemoteServiceException(String message) {
    super(message);
  }

  public RemoteServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
