package com.scholary.transcriber.subtitle;

/**
 * A single timed subtitle entry.
 *
 * @param index 1-based position in the cue sequence
 */
public record SubtitleCue(int index, String text, long startMs, long endMs) {

  public SubtitleCue {
    if (startMs > endMs) {
      throw new IllegalArgumentException(
          String.format("Cue %d starts after it ends: %d > %d", index, startMs, endMs));
    }
  }
}
