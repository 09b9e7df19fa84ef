package com.scholary.transcriber.task;

/**
 * Timing of a single content character of a transcript, in milliseconds.
 *
 * <p>The remote service returns one pair per non-space, non-punctuation character, in the order
 * those characters appear in the transcript.
 */
public record CharTimestamp(long startMs, long endMs) {

  public CharTimestamp {
    if (startMs < 0 || endMs < startMs) {
      throw new IllegalArgumentException(
          String.format("Invalid character timing: start=%d, end=%d", startMs, endMs));
    }
  }
}
