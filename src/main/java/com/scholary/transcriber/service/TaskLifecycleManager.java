package com.scholary.transcriber.service;

import com.scholary.transcriber.audio.AudioStorageException;
import com.scholary.transcriber.audio.LocalAudioStore;
import com.scholary.transcriber.config.TaskProperties;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.remote.PollResult;
import com.scholary.transcriber.remote.RemoteServiceException;
import com.scholary.transcriber.remote.RemoteTaskClient;
import com.scholary.transcriber.remote.TransientRemoteException;
import com.scholary.transcriber.secret.SecretEncryptionException;
import com.scholary.transcriber.secret.SecretProvider;
import com.scholary.transcriber.task.KeyedLocks;
import com.scholary.transcriber.task.Task;
import com.scholary.transcriber.task.TaskHistory;
import com.scholary.transcriber.task.TaskNotFoundException;
import com.scholary.transcriber.task.TaskStatus;
import com.scholary.transcriber.task.TaskStore;
import com.scholary.transcriber.task.TaskStoreException;
import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Drives tasks from submission to a terminal state.
 *
 * <p>Each in-flight task owns one entry in the polling registry: a fixed-delay job on the polling
 * scheduler. Removing the entry is what stops polling, so abandoning a task and reaching a terminal
 * state go through the same path. Poll results are applied under the task's lock and only while the
 * task is still registered, which means a result that races with an abandon is dropped.
 *
 * <p>Transient remote faults never change a task; the next tick simply tries again. The audio phase
 * runs after completion and can fail without touching the task's status.
 */
@Service
public class TaskLifecycleManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskLifecycleManager.class);

  static final String AUDIO_FETCH_FAILED_PREFIX = "Audio fetch failed (retry available): ";

  private static final Set<TaskStatus> IN_FLIGHT =
      EnumSet.of(TaskStatus.SUBMITTED, TaskStatus.PROCESSING);

  private final TaskStore taskStore;
  private final TaskHistory taskHistory;
  private final RemoteTaskClient remoteClient;
  private final Optional<SecretProvider> secretProvider;
  private final LocalAudioStore audioStore;
  private final KeyedLocks keyedLocks;
  private final TaskScheduler pollingScheduler;
  private final Duration pollInterval;
  private final boolean resumeOnStartup;
  private final Clock clock;
  private final StructuredLogger structuredLogger;

  private final ConcurrentHashMap<String, ScheduledFuture<?>> pollingRegistry =
      new ConcurrentHashMap<>();

  public TaskLifecycleManager(
      TaskStore taskStore,
      TaskHistory taskHistory,
      RemoteTaskClient remoteClient,
      Optional<SecretProvider> secretProvider,
      LocalAudioStore audioStore,
      KeyedLocks keyedLocks,
      @Qualifier("pollingScheduler") TaskScheduler pollingScheduler,
      TaskProperties properties,
      Clock clock) {
    this.taskStore = taskStore;
    this.taskHistory = taskHistory;
    this.remoteClient = remoteClient;
    this.secretProvider = secretProvider;
    this.audioStore = audioStore;
    this.keyedLocks = keyedLocks;
    this.pollingScheduler = pollingScheduler;
    this.pollInterval = properties.pollInterval();
    this.resumeOnStartup = properties.resumeOnStartup();
    this.clock = clock;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /**
   * Submit a new task to the remote service and start polling it.
   *
   * <p>Submission failures are not thrown: the task is persisted as {@link TaskStatus#FAILED} under
   * its local id and returned, so the caller always gets a record to show.
   *
   * @param sourceUrl media URL to transcribe
   * @param keepAudio whether the remote should keep the extracted audio for download
   * @param secretPayload optional plaintext credential payload, encrypted before it leaves
   * @return the persisted task, {@code SUBMITTED} or {@code FAILED}
   */
  public Task createTask(String sourceUrl, boolean keepAudio, String secretPayload) {
    if (sourceUrl == null || sourceUrl.isBlank()) {
      throw new IllegalArgumentException("Source URL must not be blank");
    }
    Task created = Task.created(sourceUrl.strip(), keepAudio, clock.instant());

    String remoteId;
    try {
      String encrypted = encryptSecret(secretPayload);
      remoteId = remoteClient.submit(created.sourceUrl(), keepAudio, encrypted);
    } catch (RemoteServiceException | SecretEncryptionException e) {
      LOGGER.warn("Submission failed for {}: {}", created.sourceUrl(), e.getMessage());
      Task failed = created.failed("Submission failed: " + e.getMessage(), clock.instant());
      keyedLocks.runWithLock(failed.id(), () -> save(created, failed));
      return failed;
    }

    Task submitted = created.submitted(remoteId, "Task submitted", clock.instant());
    try {
      keyedLocks.runWithLock(remoteId, () -> save(created, submitted));
    } catch (TaskStoreException e) {
      LOGGER.error("Remote task {} was accepted but could not be saved locally", remoteId, e);
      throw e;
    }
    startPolling(remoteId);
    return submitted;
  }

  /**
   * Run one poll cycle for a task. Invoked by the polling scheduler.
   *
   * <p>Does nothing when the task is no longer registered for polling.
   */
  void pollOnce(String taskId) {
    if (!pollingRegistry.containsKey(taskId)) {
      return;
    }
    StructuredLogger.setTaskContext(taskId);
    try {
      PollResult result;
      try {
        result = remoteClient.poll(taskId);
      } catch (TransientRemoteException e) {
        structuredLogger.logTransientFault(
            taskId, "poll", e.getClass().getSimpleName(), e.getMessage());
        return;
      }

      boolean fetchAudio = keyedLocks.withLock(taskId, () -> applyPollResult(taskId, result));
      if (fetchAudio) {
        scheduleAudioFetch(taskId);
      }
    } finally {
      StructuredLogger.clearTaskContext();
    }
  }

  /**
   * Download the task's audio from the remote service and store it locally.
   *
   * <p>On success the remote copy is deleted. On failure the task stays {@code COMPLETED} and its
   * progress line says a retry is available.
   *
   * @return the updated task
   * @throws TaskNotFoundException if the task does not exist
   * @throws IllegalStateException if the task is not a completed task that kept its audio
   */
  public Task requestAudioFetch(String taskId) {
    Task task = getTaskOrThrow(taskId);
    if (task.status() != TaskStatus.COMPLETED || !task.keepAudio()) {
      throw new IllegalStateException(
          String.format(
              "Audio is only available for completed tasks that kept it: %s is %s, keepAudio=%s",
              taskId, task.status(), task.keepAudio()));
    }

    long startTime = System.currentTimeMillis();
    Path path;
    long size;
    try {
      byte[] audio = remoteClient.fetchAudio(taskId);
      size = audio.length;
      path = audioStore.write(taskId, audio);
    } catch (RemoteServiceException | AudioStorageException e) {
      structuredLogger.logAudioFetchFailed(taskId, e.getClass().getSimpleName(), e.getMessage());
      return keyedLocks.withLock(
          taskId,
          () -> {
            Task latest = loadForUpdate(taskId);
            Task noted =
                latest.withProgress(AUDIO_FETCH_FAILED_PREFIX + e.getMessage(), clock.instant());
            save(latest, noted);
            return noted;
          });
    }
    structuredLogger.logAudioFetched(taskId, size, System.currentTimeMillis() - startTime);

    Task updated;
    try {
      updated =
          keyedLocks.withLock(
              taskId,
              () -> {
                Task latest = loadForUpdate(taskId);
                Task withAudio =
                    latest
                        .withAudioLocalPath(path.toString(), clock.instant())
                        .withProgress("Audio saved locally", clock.instant());
                save(latest, withAudio);
                return withAudio;
              });
    } catch (TaskNotFoundException e) {
      LOGGER.warn("Task {} was deleted while its audio downloaded, removing {}", taskId, path);
      audioStore.delete(path);
      throw e;
    }

    try {
      remoteClient.deleteAudio(taskId);
    } catch (RemoteServiceException e) {
      LOGGER.warn("Remote audio cleanup failed for {}: {}", taskId, e.getMessage());
    }
    return updated;
  }

  /**
   * Remove a task's local audio file and ask the remote service to drop its copy.
   *
   * <p>Safe to repeat: a missing file or an already cleaned remote copy is not an error.
   */
  public Task deleteAudio(String taskId) {
    Task cleared =
        keyedLocks.withLock(
            taskId,
            () -> {
              Task task = loadForUpdate(taskId);
              if (task.audioLocalPath() != null) {
                audioStore.delete(Path.of(task.audioLocalPath()));
              }
              taskStore.deleteAudioReference(taskId);
              Task latest = loadForUpdate(taskId);
              taskHistory.put(latest);
              return latest;
            });

    try {
      remoteClient.deleteAudio(taskId);
    } catch (RemoteServiceException e) {
      LOGGER.warn("Remote audio cleanup failed for {}: {}", taskId, e.getMessage());
    }
    return cleared;
  }

  /**
   * Ask the remote service to delete everything older than the given age.
   *
   * @return number of remote tasks deleted, never negative
   */
  public int bulkCleanup(int maxAgeHours) {
    if (maxAgeHours < 0) {
      throw new IllegalArgumentException("maxAgeHours must not be negative: " + maxAgeHours);
    }
    int deleted = Math.max(0, remoteClient.cleanup(maxAgeHours));
    LOGGER.info("Remote cleanup removed {} tasks older than {}h", deleted, maxAgeHours);
    return deleted;
  }

  /**
   * Stop polling a task without changing its record.
   *
   * @return whether the task was being polled
   */
  public boolean abandonTask(String taskId) {
    getTaskOrThrow(taskId);
    boolean wasPolling = keyedLocks.withLock(taskId, () -> stopPolling(taskId));
    if (wasPolling) {
      LOGGER.info("Stopped polling task {}", taskId);
    }
    return wasPolling;
  }

  /** Delete a task locally, together with its audio file. The remote task is left alone. */
  public void deleteTask(String taskId) {
    keyedLocks.runWithLock(
        taskId,
        () -> {
          stopPolling(taskId);
          Task task = taskStore.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
          if (task.audioLocalPath() != null) {
            audioStore.delete(Path.of(task.audioLocalPath()));
          }
          taskStore.delete(taskId);
          taskHistory.remove(taskId);
        });
    LOGGER.info("Deleted task {}", taskId);
  }

  /**
   * Delete local records created more than {@code days} days ago.
   *
   * @return number of records deleted
   */
  public int purgeTasksOlderThan(int days) {
    if (days < 0) {
      throw new IllegalArgumentException("days must not be negative: " + days);
    }
    Instant cutoff = clock.instant().minus(Duration.ofDays(days));
    int deleted = taskStore.deleteOlderThan(cutoff);
    for (Task task : taskHistory.snapshot()) {
      if (task.createdAt().isBefore(cutoff)) {
        taskHistory.remove(task.id());
        stopPolling(task.id());
      }
    }
    return deleted;
  }

  /**
   * Restart polling for every task persisted as in flight.
   *
   * @return number of tasks picked up
   */
  public int resumeInFlightTasks() {
    List<Task> inFlight = taskStore.findByStatus(IN_FLIGHT);
    for (Task task : inFlight) {
      startPolling(task.id());
    }
    if (!inFlight.isEmpty()) {
      LOGGER.info("Resumed polling for {} in-flight tasks", inFlight.size());
    }
    return inFlight.size();
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!resumeOnStartup) {
      LOGGER.info("Resume on startup disabled, in-flight tasks stay idle");
      return;
    }
    try {
      resumeInFlightTasks();
    } catch (TaskStoreException e) {
      LOGGER.error("Could not resume in-flight tasks", e);
    }
  }

  /**
   * Look up a task, preferring the in-memory history.
   *
   * <p>A miss is filled from the store under the task lock, so a slow read can never put an older
   * record back after a newer save.
   */
  public Optional<Task> getTask(String taskId) {
    Optional<Task> cached = taskHistory.findById(taskId);
    if (cached.isPresent()) {
      return cached;
    }
    return keyedLocks.withLock(
        taskId,
        () -> {
          Optional<Task> stored = taskStore.get(taskId);
          stored.ifPresent(taskHistory::put);
          return stored;
        });
  }

  public Task getTaskOrThrow(String taskId) {
    return getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  public List<Task> listRecentTasks(int limit) {
    return taskStore.listRecent(limit);
  }

  public boolean isPolling(String taskId) {
    return pollingRegistry.containsKey(taskId);
  }

  public Set<String> pollingTaskIds() {
    return Set.copyOf(pollingRegistry.keySet());
  }

  @PreDestroy
  public void shutdown() {
    int count = pollingRegistry.size();
    pollingRegistry.keySet().forEach(this::stopPolling);
    LOGGER.info("Cancelled polling for {} tasks", count);
  }

  private boolean applyPollResult(String taskId, PollResult result) {
    if (!pollingRegistry.containsKey(taskId)) {
      LOGGER.info("Discarding poll result for task {}: polling was stopped", taskId);
      return false;
    }
    Optional<Task> stored = taskStore.get(taskId);
    if (stored.isEmpty()) {
      LOGGER.warn("Task {} disappeared from the store, stopping its polling", taskId);
      stopPolling(taskId);
      return false;
    }
    Task current = stored.get();
    if (current.status().isTerminal()) {
      stopPolling(taskId);
      return false;
    }

    Instant now = clock.instant();
    if (result instanceof PollResult.Processing processing) {
      save(current, current.processing(processing.progress(), now));
      return false;
    }
    if (result instanceof PollResult.Completed completed) {
      Task done =
          current.completed(completed.transcript(), completed.timestamps(), completed.progress(), now);
      save(current, done);
      stopPolling(taskId);
      return done.keepAudio() && completed.audioRef().isPresent();
    }
    if (result instanceof PollResult.Failed failed) {
      save(current, current.failed(failed.errorMessage(), now));
      stopPolling(taskId);
      return false;
    }
    throw new IllegalStateException("Unknown poll result: " + result);
  }

  private void startPolling(String taskId) {
    pollingRegistry.computeIfAbsent(
        taskId,
        id ->
            pollingScheduler.scheduleWithFixedDelay(
                () -> pollSafely(id), clock.instant().plus(pollInterval), pollInterval));
    LOGGER.debug("Polling task {} every {}", taskId, pollInterval);
  }

  private boolean stopPolling(String taskId) {
    ScheduledFuture<?> future = pollingRegistry.remove(taskId);
    if (future == null) {
      return false;
    }
    future.cancel(false);
    return true;
  }

  private void pollSafely(String taskId) {
    try {
      pollOnce(taskId);
    } catch (RuntimeException e) {
      // state is unchanged, the next tick retries
      LOGGER.error("Poll cycle failed for task {}", taskId, e);
    }
  }

  private void scheduleAudioFetch(String taskId) {
    pollingScheduler.schedule(
        () -> {
          try {
            requestAudioFetch(taskId);
          } catch (RuntimeException e) {
            LOGGER.error("Automatic audio fetch failed for task {}", taskId, e);
          }
        },
        clock.instant());
  }

  private String encryptSecret(String secretPayload) {
    if (secretPayload == null || secretPayload.isBlank()) {
      return null;
    }
    SecretProvider provider =
        secretProvider.orElseThrow(
            () -> new SecretEncryptionException("No secret provider is configured"));
    return provider.encrypt(secretPayload);
  }

  /** Read for a read-modify-write. Callers hold the task lock; the history is bypassed. */
  private Task loadForUpdate(String taskId) {
    return taskStore.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  /** Persist and mirror into the history. Callers hold the task lock. */
  private void save(Task previous, Task next) {
    taskStore.upsert(next);
    taskHistory.put(next);
    if (previous.status() != next.status()) {
      structuredLogger.logTransition(
          next.id(), previous.status().name(), next.status().name(), next.progress());
    }
  }
}
