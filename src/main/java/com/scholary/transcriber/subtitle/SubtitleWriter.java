package com.scholary.transcriber.subtitle;

import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes subtitle cues in various formats.
 *
 * <p>Supports SRT (SubRip subtitle format) and plain text.
 */
@Component
public class SubtitleWriter {

  public String write(List<SubtitleCue> cues, SubtitleFormat format) {
    return switch (format) {
      case SRT -> writeSrt(cues);
      case TXT -> writeText(cues);
    };
  }

  /**
   * Write cues as SRT (SubRip subtitle format).
   *
   * <p>Format:
   *
   * <pre>
   * 1
   * 00:00:00,000 --> 00:00:00,700
   * 你好，世界。
   *
   * 2
   * 00:00:00,800 --> 00:00:01,500
   * 今天天气不错
   * </pre>
   */
  public String writeSrt(List<SubtitleCue> cues) {
    StringBuilder srt = new StringBuilder();

    for (SubtitleCue cue : cues) {
      srt.append(cue.index()).append("\n");
      srt.append(formatTimestamp(cue.startMs()))
          .append(" --> ")
          .append(formatTimestamp(cue.endMs()))
          .append("\n");
      srt.append(cue.text()).append("\n");
      srt.append("\n");
    }

    return srt.toString();
  }

  /** Write the cue texts only, one per line. */
  public String writeText(List<SubtitleCue> cues) {
    StringBuilder text = new StringBuilder();
    for (SubtitleCue cue : cues) {
      text.append(cue.text()).append("\n");
    }
    return text.toString();
  }

  /**
   * Format milliseconds as an SRT timecode.
   *
   * <p>Format: HH:MM:SS,mmm (hours:minutes:seconds,milliseconds). Hours are not wrapped at 24.
   */
  public static String formatTimestamp(long milliseconds) {
    long totalSeconds = milliseconds / 1000;
    long millis = milliseconds % 1000;
    long hours = totalSeconds / 3600;
    long minutes = (totalSeconds % 3600) / 60;
    long secs = totalSeconds % 60;

    return String.format("%02d:%02d:%02d,%03d", hours, minutes, secs, millis);
  }
}
