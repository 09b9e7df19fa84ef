package com.scholary.transcriber.subtitle;

import java.util.Locale;

/** Output formats for rendered subtitles. */
public enum SubtitleFormat {
  /** SubRip: numbered cues with {@code HH:MM:SS,mmm} time ranges. */
  SRT(".srt", "application/x-subrip"),
  /** Plain text, one cue per line, no timing. */
  TXT(".txt", "text/plain");

  private final String extension;
  private final String contentType;

  SubtitleFormat(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String extension() {
    return extension;
  }

  public String contentType() {
    return contentType;
  }

  /** Case-insensitive lookup, e.g. {@code "srt"} or {@code "TXT"}. */
  public static SubtitleFormat parse(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unsupported subtitle format: " + value, e);
    }
  }
}
