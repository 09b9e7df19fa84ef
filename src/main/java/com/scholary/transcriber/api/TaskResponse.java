package com.scholary.transcriber.api;

import com.scholary.transcriber.task.Task;
import com.scholary.transcriber.task.TaskStatus;
import java.time.Instant;

/** A task as shown to API clients. */
public record TaskResponse(
    String id,
    String sourceUrl,
    TaskStatus status,
    String progress,
    boolean keepAudio,
    String transcript,
    int timestampCount,
    String audioLocalPath,
    String errorMessage,
    boolean polling,
    Instant createdAt,
    Instant updatedAt) {

  public static TaskResponse from(Task task, boolean polling) {
    return new TaskResponse(
        task.id(),
        task.sourceUrl(),
        task.status(),
        task.progress(),
        task.keepAudio(),
        task.transcript(),
        task.subtitleSource() != null ? task.subtitleSource().size() : 0,
        task.audioLocalPath(),
        task.errorMessage(),
        polling,
        task.createdAt(),
        task.updatedAt());
  }
}
