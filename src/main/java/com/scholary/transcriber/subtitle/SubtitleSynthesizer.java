package com.scholary.transcriber.subtitle;

import com.scholary.transcriber.task.CharTimestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a transcript and its per-character timing into subtitle cues.
 *
 * <p>The remote recognizer returns one {@code (start, end)} pair per content character, that is
 * every character that is neither punctuation from the break sets nor whitespace. The scan walks
 * the text once, hands timing to content characters in order, and cuts cues at punctuation:
 *
 * <ul>
 *   <li>Hard breaks (sentence terminators and newline) always end the current cue.
 *   <li>Soft breaks (commas, enumeration comma, whitespace) end the cue only once it holds at
 *       least {@code minLength} characters, trigger included. Shorter runs absorb the soft break.
 * </ul>
 *
 * <p>Cues are trimmed and empty ones are dropped. A cue that consumed no timing (a run of pure
 * punctuation) starts at the last known end time. When the timing list is shorter than the
 * content, the surplus characters simply get no timing of their own.
 *
 * <p>Stateless and deterministic: the same input always yields the same cues.
 */
@Component
public class SubtitleSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleSynthesizer.class);

  public static final int DEFAULT_MIN_LENGTH = 10;

  private static final Set<Integer> HARD_BREAKS = codePoints("。？！；：?!;:\n");
  private static final Set<Integer> SOFT_BREAKS = codePoints(".，、, ");

  /**
   * Segment a transcript into cues.
   *
   * @param text the transcript
   * @param timestamps one timing pair per content character, in order
   * @param minLength minimum cue length (in characters) before a soft break may end a cue
   * @return cues numbered from 1 in scan order
   */
  public List<SubtitleCue> synthesize(String text, List<CharTimestamp> timestamps, int minLength) {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(timestamps, "timestamps");

    List<SubtitleCue> cues = new ArrayList<>();
    StringBuilder buffer = new StringBuilder();
    int bufferLength = 0;
    long cueStart = -1;
    long lastEnd = 0;
    int cursor = 0;
    int unmatched = 0;

    int offset = 0;
    while (offset < text.length()) {
      int ch = text.codePointAt(offset);
      offset += Character.charCount(ch);

      if (isContent(ch)) {
        if (cursor < timestamps.size()) {
          CharTimestamp ts = timestamps.get(cursor++);
          if (cueStart < 0) {
            cueStart = ts.startMs();
          }
          lastEnd = ts.endMs();
        } else {
          unmatched++;
        }
      }

      buffer.appendCodePoint(ch);
      bufferLength++;

      boolean flush = HARD_BREAKS.contains(ch) || (isSoftBreak(ch) && bufferLength >= minLength);
      if (flush) {
        emit(cues, buffer, cueStart, lastEnd);
        buffer.setLength(0);
        bufferLength = 0;
        cueStart = -1;
      }
    }

    emit(cues, buffer, cueStart, lastEnd);

    if (unmatched > 0) {
      LOGGER.debug(
          "Timing list shorter than content: {} characters without timing, {} pairs available",
          unmatched,
          timestamps.size());
    }
    return cues;
  }

  /** Whether the character consumes a timing pair. */
  public static boolean isContent(int ch) {
    return !HARD_BREAKS.contains(ch) && !SOFT_BREAKS.contains(ch) && !isSpace(ch);
  }

  private static boolean isSoftBreak(int ch) {
    return SOFT_BREAKS.contains(ch) || (isSpace(ch) && !HARD_BREAKS.contains(ch));
  }

  /** Whitespace including the no-break spaces that {@link Character#isWhitespace} excludes. */
  static boolean isSpace(int ch) {
    return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
  }

  private static String trimSpaces(CharSequence text) {
    int start = 0;
    int end = text.length();
    while (start < end) {
      int ch = Character.codePointAt(text, start);
      if (!isSpace(ch)) {
        break;
      }
      start += Character.charCount(ch);
    }
    while (end > start) {
      int ch = Character.codePointBefore(text, end);
      if (!isSpace(ch)) {
        break;
      }
      end -= Character.charCount(ch);
    }
    return text.subSequence(start, end).toString();
  }

  private static void emit(
      List<SubtitleCue> cues, StringBuilder buffer, long cueStart, long lastEnd) {
    String cueText = trimSpaces(buffer);
    if (cueText.isEmpty()) {
      return;
    }
    long start = cueStart >= 0 ? cueStart : lastEnd;
    // out-of-order timing must not produce an inverted cue
    long end = Math.max(start, lastEnd);
    cues.add(new SubtitleCue(cues.size() + 1, cueText, start, end));
  }

  private static Set<Integer> codePoints(String chars) {
    return Set.copyOf(chars.codePoints().boxed().toList());
  }
}
