package com.scholary.transcriber.task;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of task records.
 *
 * <p>All operations are synchronous and safe to call from concurrent pollers. Writes to the same
 * id are serialized; a reader never observes a partially written record.
 *
 * @see JdbcTaskStore
 */
public interface TaskStore {

  /** Hard cap on {@link #listRecent(int)}. */
  int MAX_RECENT = 100;

  /**
   * Insert or fully replace the record keyed by {@code task.id()}.
   *
   * @throws TaskStoreException if the write fails
   */
  void upsert(Task task);

  Optional<Task> get(String id);

  /**
   * Most recently created tasks, newest first.
   *
   * @param limit maximum number of records; clamped to {@link #MAX_RECENT}
   */
  List<Task> listRecent(int limit);

  /** Tasks in any of the given states, oldest first. */
  List<Task> findByStatus(Collection<TaskStatus> statuses);

  /**
   * Clear the local audio path of a task, leaving status and transcript untouched.
   *
   * @return true if a record was updated
   */
  boolean deleteAudioReference(String id);

  /** @return true if a record was removed */
  boolean delete(String id);

  /**
   * Remove every record created before the cutoff.
   *
   * @return number of removed records
   */
  int deleteOlderThan(Instant cutoff);
}
