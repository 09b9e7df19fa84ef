package com.scholary.transcriber.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.transcriber.task.CharTimestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Raw status payload from the remote service.
 *
 * <p>The payload shape depends on the job state. {@link #toPollResult()} turns it into a typed
 * {@link PollResult}; nothing past the client sees this record.
 *
 * <pre>
 * {
 *   "status": "completed",
 *   "progress": "done",
 *   "result": {
 *     "transcription": "...",
 *     "timestamp": [[0, 120], [120, 260]],
 *     "audio_url": "/api/audio/abc"
 *   }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StatusResponse(
    String status, String progress, String message, String error, Result result) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Result(
      String transcription,
      String text,
      @JsonProperty("timestamp") List<List<Long>> timestamps,
      @JsonProperty("audio_url") String audioUrl) {}

  /**
   * Decode into a typed result.
   *
   * <p>A completed payload without a transcript field or with malformed timing is reported as a
   * remote failure, since polling again would return the same payload. An empty transcript is
   * accepted.
   *
   * @throws TransientRemoteException if the payload carries no status at all
   */
  public PollResult toPollResult() {
    if (status == null || status.isBlank()) {
      throw new TransientRemoteException("Status response without a status field");
    }

    switch (status.toLowerCase(Locale.ROOT)) {
      case "completed":
        return decodeCompleted();
      case "failed":
        return new PollResult.Failed(firstNonBlank(error, message, progress, "Remote task failed"));
      default:
        return new PollResult.Processing(firstNonBlank(progress, message, status));
    }
  }

  private PollResult decodeCompleted() {
    String transcript = null;
    if (result != null) {
      transcript = firstNonBlank(result.transcription(), result.text());
      if (transcript == null) {
        // An empty transcript is a valid result, e.g. a video with no speech.
        transcript = result.transcription() != null ? result.transcription() : result.text();
      }
    }
    if (transcript == null) {
      return new PollResult.Failed("Remote task completed without a transcript");
    }

    List<CharTimestamp> decoded = new ArrayList<>();
    if (result.timestamps() != null) {
      for (List<Long> pair : result.timestamps()) {
        if (pair == null || pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
          return new PollResult.Failed("Malformed timestamp entry in remote result: " + pair);
        }
        try {
          decoded.add(new CharTimestamp(pair.get(0), pair.get(1)));
        } catch (IllegalArgumentException e) {
          return new PollResult.Failed(e.getMessage());
        }
      }
    }

    String audioUrl = result.audioUrl();
    return new PollResult.Completed(
        transcript,
        decoded,
        firstNonBlank(progress, "Completed"),
        audioUrl == null || audioUrl.isBlank() ? Optional.empty() : Optional.of(audioUrl));
  }

  private static String firstNonBlank(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate;
      }
    }
    return null;
  }
}
