package com.scholary.transcriber.remote;

/**
 * Thrown for recoverable faults: connection errors, timeouts, unexpected HTTP statuses or bodies.
 *
 * <p>Never turns a task into a failure on its own; the caller retries on its next tick.
 */
public class TransientRemoteException extends RemoteServiceException {

  public TransientRemoteException(String message) {
    super(message);
  }

  public TransientRemoteException(String message, Throwable cause) {
    super(message, cause);
  }
}
