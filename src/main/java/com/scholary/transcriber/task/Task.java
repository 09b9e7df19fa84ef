package com.scholary.transcriber.task;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A transcription task tracked end-to-end, locally and on the remote service.
 *
 * <p>Instances are immutable. Every lifecycle step returns a new instance, so a task handed to
 * another thread or kept in the in-memory history can never be observed half-updated. The
 * canonical constructor enforces the record-level invariants:
 *
 * <ul>
 *   <li>{@code transcript} and {@code subtitleSource} are both present or both absent, and present
 *       exactly when the task is {@link TaskStatus#COMPLETED}
 *   <li>{@code errorMessage} only appears on {@link TaskStatus#FAILED} tasks
 *   <li>{@code audioLocalPath} only appears on completed tasks that asked to keep their audio
 * </ul>
 */
public record Task(
    String id,
    String sourceUrl,
    TaskStatus status,
    String progress,
    boolean keepAudio,
    String transcript,
    List<CharTimestamp> subtitleSource,
    String audioLocalPath,
    String errorMessage,
    Instant createdAt,
    Instant updatedAt) {

  private static final String LOCAL_ID_PREFIX = "local-";

  public Task {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourceUrl, "sourceUrl");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    if (updatedAt == null) {
      updatedAt = createdAt;
    }
    if (subtitleSource != null) {
      subtitleSource = List.copyOf(subtitleSource);
    }

    if ((transcript == null) != (subtitleSource == null)) {
      throw new IllegalArgumentException(
          "Task " + id + ": transcript and subtitle source must be set together");
    }
    if ((transcript != null) != (status == TaskStatus.COMPLETED)) {
      throw new IllegalArgumentException(
          "Task " + id + ": transcript is only allowed on completed tasks, status=" + status);
    }
    if (errorMessage != null && status != TaskStatus.FAILED) {
      throw new IllegalArgumentException(
          "Task " + id + ": error message is only allowed on failed tasks, status=" + status);
    }
    if (audioLocalPath != null && !(keepAudio && status == TaskStatus.COMPLETED)) {
      throw new IllegalArgumentException(
          "Task " + id + ": audio path requires keepAudio and a completed task");
    }
  }

  /** Create a fresh local record, before it has been handed to the remote service. */
  public static Task created(String sourceUrl, boolean keepAudio, Instant now) {
    return new Task(
        LOCAL_ID_PREFIX + UUID.randomUUID(),
        sourceUrl,
        TaskStatus.CREATED,
        "Task created",
        keepAudio,
        null,
        null,
        null,
        null,
        now,
        now);
  }

  /** Adopt the remote-assigned id after a successful submission. */
  public Task submitted(String remoteId, String message, Instant now) {
    checkTransition(TaskStatus.SUBMITTED);
    return new Task(
        remoteId,
        sourceUrl,
        TaskStatus.SUBMITTED,
        message,
        keepAudio,
        null,
        null,
        null,
        null,
        createdAt,
        now);
  }

  public Task processing(String newProgress, Instant now) {
    checkTransition(TaskStatus.PROCESSING);
    return new Task(
        id,
        sourceUrl,
        TaskStatus.PROCESSING,
        newProgress,
        keepAudio,
        null,
        null,
        null,
        null,
        createdAt,
        now);
  }

  public Task completed(
      String newTranscript, List<CharTimestamp> timestamps, String newProgress, Instant now) {
    checkTransition(TaskStatus.COMPLETED);
    return new Task(
        id,
        sourceUrl,
        TaskStatus.COMPLETED,
        newProgress,
        keepAudio,
        Objects.requireNonNull(newTranscript, "transcript"),
        Objects.requireNonNull(timestamps, "timestamps"),
        null,
        null,
        createdAt,
        now);
  }

  public Task failed(String error, Instant now) {
    checkTransition(TaskStatus.FAILED);
    return new Task(
        id,
        sourceUrl,
        TaskStatus.FAILED,
        error,
        keepAudio,
        null,
        null,
        null,
        error,
        createdAt,
        now);
  }

  /** Replace the progress line without changing status, e.g. to note a failed audio fetch. */
  public Task withProgress(String newProgress, Instant now) {
    return new Task(
        id,
        sourceUrl,
        status,
        newProgress,
        keepAudio,
        transcript,
        subtitleSource,
        audioLocalPath,
        errorMessage,
        createdAt,
        now);
  }

  /** Set or clear ({@code null}) the local audio file. Status is never touched. */
  public Task withAudioLocalPath(String path, Instant now) {
    return new Task(
        id,
        sourceUrl,
        status,
        progress,
        keepAudio,
        transcript,
        subtitleSource,
        path,
        errorMessage,
        createdAt,
        now);
  }

  public boolean hasTranscript() {
    return transcript != null;
  }

  public boolean hasAudio() {
    return audioLocalPath != null;
  }

  private void checkTransition(TaskStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          String.format("Task %s cannot move from %s to %s", id, status, next));
    }
  }
}
