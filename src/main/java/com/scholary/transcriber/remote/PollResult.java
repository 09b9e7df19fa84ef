package com.scholary.transcriber.remote;

import com.scholary.transcriber.task.CharTimestamp;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a single status query, decoded once at the client boundary.
 *
 * <p>Exactly one of three shapes: still running, finished with a transcript, or failed.
 */
public sealed interface PollResult
    permits PollResult.Processing, PollResult.Completed, PollResult.Failed {

  /** The job is still running; {@code progress} is the remote status line. */
  record Processing(String progress) implements PollResult {}

  /**
   * The job finished.
   *
   * @param audioRef location of the retained audio on the remote side, if it kept any
   */
  record Completed(
      String transcript, List<CharTimestamp> timestamps, String progress, Optional<String> audioRef)
      implements PollResult {

    public Completed {
      timestamps = List.copyOf(timestamps);
      audioRef = audioRef != null ? audioRef : Optional.empty();
    }
  }

  /** The remote service reported the job as failed. */
  record Failed(String errorMessage) implements PollResult {}
}
