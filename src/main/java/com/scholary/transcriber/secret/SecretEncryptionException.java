package com.scholary.transcriber.secret;

/** Thrown by a {@link SecretProvider} that cannot encrypt a payload. */
public class SecretEncryptionException extends RuntimeException {

  public SecretEncryptionException(String message) {
    super(message);
  }

  public SecretEncryptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
