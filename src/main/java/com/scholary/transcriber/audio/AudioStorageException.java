package com.scholary.transcriber.audio;

/** Thrown when a local audio file cannot be written or removed. */
public class AudioStorageException extends RuntimeException {

  public AudioStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
