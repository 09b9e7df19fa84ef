package com.scholary.transcriber.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.audio.LocalAudioStore;
import com.scholary.transcriber.config.TaskProperties;
import com.scholary.transcriber.remote.AudioNotAvailableException;
import com.scholary.transcriber.remote.PollResult;
import com.scholary.transcriber.remote.RemoteTaskClient;
import com.scholary.transcriber.remote.SubmissionException;
import com.scholary.transcriber.remote.TransientRemoteException;
import com.scholary.transcriber.secret.SecretProvider;
import com.scholary.transcriber.task.CharTimestamp;
import com.scholary.transcriber.task.JdbcTaskStore;
import com.scholary.transcriber.task.KeyedLocks;
import com.scholary.transcriber.task.Task;
import com.scholary.transcriber.task.TaskHistory;
import com.scholary.transcriber.task.TaskNotFoundException;
import com.scholary.transcriber.task.TaskStatus;
import com.scholary.transcriber.task.TaskStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.scheduling.TaskScheduler;

/**
 * Tests for TaskLifecycleManager.
 *
 * <p>The store is a real H2-backed store; the remote service and the scheduler are mocked, and
 * poll cycles are driven directly through {@code pollOnce}.
 */
@ExtendWith(MockitoExtension.class)
class TaskLifecycleManagerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final String URL = "https://example.com/video/1";

  @Mock private RemoteTaskClient remoteClient;
  @Mock private TaskScheduler scheduler;
  @Mock private ScheduledFuture<Object> pollingFuture;
  @Mock private SecretProvider secretProvider;

  @TempDir Path tempDir;

  private JdbcTaskStore store;
  private KeyedLocks locks;
  private TaskHistory history;
  private LocalAudioStore audioStore;
  private TaskProperties properties;
  private TaskLifecycleManager manager;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource dataSource =
        new DriverManagerDataSource(
            "jdbc:h2:mem:manager-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
    new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
    locks = new KeyedLocks();
    store = new JdbcTaskStore(new JdbcTemplate(dataSource), new ObjectMapper(), locks);

    properties =
        new TaskProperties(
            Duration.ofSeconds(5),
            1,
            tempDir.resolve("audio").toString(),
            tempDir.resolve("export").toString(),
            100,
            100,
            false,
            10);
    history = new TaskHistory(properties);
    audioStore = new LocalAudioStore(properties);

    lenient()
        .doReturn(pollingFuture)
        .when(scheduler)
        .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));

    manager = newManager(store, Optional.empty());
  }

  @Test
  void createTask_shouldPersistSubmittedTaskAndStartPolling() {
    when(remoteClient.submit(URL, false, null)).thenReturn("r1");

    Task task = manager.createTask(URL, false, null);

    assertThat(task.id()).isEqualTo("r1");
    assertThat(task.status()).isEqualTo(TaskStatus.SUBMITTED);
    assertThat(task.createdAt()).isEqualTo(NOW);
    assertThat(store.get("r1")).contains(task);
    assertThat(manager.isPolling("r1")).isTrue();
    verify(scheduler)
        .scheduleWithFixedDelay(
            any(Runnable.class), eq(NOW.plusSeconds(5)), eq(Duration.ofSeconds(5)));
  }

  @Test
  void createTask_shouldPersistFailedTaskWhenSubmissionFails() {
    when(remoteClient.submit(anyString(), anyBoolean(), isNull()))
        .thenThrow(new SubmissionException("Remote service rejected submission"));

    Task task = manager.createTask(URL, true, null);

    assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
    assertThat(task.id()).startsWith("local-");
    assertThat(task.errorMessage()).contains("rejected");
    assertThat(task.transcript()).isNull();
    assertThat(store.get(task.id())).contains(task);
    assertThat(manager.isPolling(task.id())).isFalse();
  }

  @Test
  void createTask_shouldFailWhenSecretCannotBeEncrypted() {
    Task task = manager.createTask(URL, false, "session=abc");

    assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
    assertThat(task.errorMessage()).contains("secret provider");
    verify(remoteClient, never()).submit(anyString(), anyBoolean(), any());
  }

  @Test
  void createTask_shouldForwardEncryptedSecretOnly() {
    manager = newManager(store, Optional.of(secretProvider));
    when(secretProvider.encrypt("session=abc")).thenReturn("ciphertext");
    when(remoteClient.submit(URL, false, "ciphertext")).thenReturn("r1");

    Task task = manager.createTask(URL, false, "session=abc");

    assertThat(task.status()).isEqualTo(TaskStatus.SUBMITTED);
  }

  @Test
  void createTask_shouldRejectBlankUrl() {
    assertThatThrownBy(() -> manager.createTask(" ", false, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void pollOnce_shouldRecordProgress() {
    submit("r1", false);
    when(remoteClient.poll("r1")).thenReturn(new PollResult.Processing("Transcribing 40%"));

    manager.pollOnce("r1");

    Task task = store.get("r1").orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.PROCESSING);
    assertThat(task.progress()).isEqualTo("Transcribing 40%");
    assertThat(history.findById("r1")).contains(task);
    assertThat(manager.isPolling("r1")).isTrue();
  }

  @Test
  void pollOnce_shouldCompleteTaskAndStopPolling() {
    submit("r1", false);
    when(remoteClient.poll("r1")).thenReturn(completed(Optional.empty()));

    manager.pollOnce("r1");

    Task task = store.get("r1").orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
    assertThat(task.transcript()).isEqualTo("你好。");
    assertThat(task.subtitleSource()).hasSize(2);
    assertThat(manager.isPolling("r1")).isFalse();
    verify(pollingFuture).cancel(false);
    verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
  }

  @Test
  void pollOnce_shouldFetchAudioAfterCompletionWhenKept() throws Exception {
    submit("r1", true);
    when(remoteClient.poll("r1")).thenReturn(completed(Optional.of("/api/audio/r1")));
    when(remoteClient.fetchAudio("r1")).thenReturn(new byte[] {1, 2, 3});

    manager.pollOnce("r1");
    runScheduledAudioFetch();

    Task task = store.get("r1").orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
    assertThat(task.audioLocalPath()).isNotNull();
    assertThat(Files.readAllBytes(Path.of(task.audioLocalPath()))).containsExactly(1, 2, 3);
    verify(remoteClient).deleteAudio("r1");
  }

  @Test
  void pollOnce_shouldMarkTaskFailedAndNeverPollAgain() {
    submit("r1", false);
    when(remoteClient.poll("r1")).thenReturn(new PollResult.Failed("Download blocked"));

    manager.pollOnce("r1");
    manager.pollOnce("r1");

    Task task = store.get("r1").orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
    assertThat(task.errorMessage()).isEqualTo("Download blocked");
    assertThat(task.transcript()).isNull();
    assertThat(manager.isPolling("r1")).isFalse();
    verify(remoteClient, times(1)).poll("r1");
  }

  @Test
  void pollOnce_shouldCompleteTaskWithEmptyTranscript() {
    submit("r1", false);
    when(remoteClient.poll("r1"))
        .thenReturn(new PollResult.Completed("", List.of(), "Completed", Optional.empty()));

    manager.pollOnce("r1");

    Task task = store.get("r1").orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
    assertThat(task.transcript()).isEmpty();
    assertThat(task.subtitleSource()).isEmpty();
    assertThat(task.errorMessage()).isNull();
  }

  @Test
  void pollOnce_shouldNeverRevertCompletedTaskUnderConcurrentPolls() throws Exception {
    submit("r1", false);
    AtomicInteger polls = new AtomicInteger();
    when(remoteClient.poll("r1"))
        .thenAnswer(
            invocation ->
                polls.incrementAndGet() == 20
                    ? completed(Optional.empty())
                    : new PollResult.Processing("working"));

    ExecutorService executor = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int p = 0; p < 4; p++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < 25; i++) {
                    manager.pollOnce("r1");
                  }
                  return null;
                }));
      }
      for (int r = 0; r < 4; r++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  boolean sawCompleted = false;
                  for (int i = 0; i < 200; i++) {
                    if (i % 10 == 0) {
                      history.remove("r1");
                    }
                    Task seen = manager.getTask("r1").orElseThrow();
                    if (seen.status() == TaskStatus.COMPLETED) {
                      assertThat(seen.transcript()).isEqualTo("你好。");
                      sawCompleted = true;
                    } else {
                      assertThat(sawCompleted).as("completed task went back to " + seen).isFalse();
                      assertThat(seen.transcript()).isNull();
                    }
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    Task stored = store.get("r1").orElseThrow();
    assertThat(stored.status()).isEqualTo(TaskStatus.COMPLETED);
    assertThat(stored.transcript()).isEqualTo("你好。");
    assertThat(manager.getTask("r1")).contains(stored);
    assertThat(manager.isPolling("r1")).isFalse();
  }

  @Test
  void pollOnce_shouldLeaveTaskUnchangedOnTransientFault() {
    Task submitted = submit("r1", false);
    when(remoteClient.poll("r1")).thenThrow(new TransientRemoteException("connection refused"));

    manager.pollOnce("r1");

    assertThat(store.get("r1")).contains(submitted);
    assertThat(manager.isPolling("r1")).isTrue();
  }

  @Test
  void pollOnce_shouldDiscardResultArrivingAfterAbandon() {
    Task submitted = submit("r1", false);
    when(remoteClient.poll("r1"))
        .thenAnswer(
            invocation -> {
              manager.abandonTask("r1");
              return completed(Optional.empty());
            });

    manager.pollOnce("r1");

    assertThat(store.get("r1")).contains(submitted);
    assertThat(manager.isPolling("r1")).isFalse();
  }

  @Test
  void requestAudioFetch_shouldKeepTaskCompletedWhenDownloadFails() {
    submit("r1", true);
    when(remoteClient.poll("r1")).thenReturn(completed(Optional.of("/api/audio/r1")));
    when(remoteClient.fetchAudio("r1")).thenThrow(new AudioNotAvailableException("r1"));

    manager.pollOnce("r1");
    runScheduledAudioFetch();

    Task task = store.get("r1").orElseThrow();
    assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
    assertThat(task.audioLocalPath()).isNull();
    assertThat(task.progress()).startsWith(TaskLifecycleManager.AUDIO_FETCH_FAILED_PREFIX);
    verify(remoteClient, never()).deleteAudio("r1");
  }

  @Test
  void requestAudioFetch_shouldSucceedOnRetryAfterFailure() {
    submit("r1", true);
    when(remoteClient.poll("r1")).thenReturn(completed(Optional.of("/api/audio/r1")));
    when(remoteClient.fetchAudio("r1"))
        .thenThrow(new TransientRemoteException("timed out"))
        .thenReturn(new byte[] {7});
    manager.pollOnce("r1");
    runScheduledAudioFetch();

    Task task = manager.requestAudioFetch("r1");

    assertThat(task.hasAudio()).isTrue();
    assertThat(task.progress()).doesNotStartWith(TaskLifecycleManager.AUDIO_FETCH_FAILED_PREFIX);
  }

  @Test
  void requestAudioFetch_shouldKeepSavedAudioWhenSlowReadRefillsHistory() throws Exception {
    GatedTaskStore gated = new GatedTaskStore(store);
    manager = newManager(gated, Optional.empty());
    submit("r1", true);
    when(remoteClient.poll("r1")).thenReturn(completed(Optional.of("/api/audio/r1")));
    manager.pollOnce("r1");
    when(remoteClient.fetchAudio("r1"))
        .thenReturn(new byte[] {1, 2})
        .thenThrow(new TransientRemoteException("timed out"));
    history.remove("r1");

    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      gated.pauseNextGet();
      Future<Optional<Task>> slowRead = executor.submit(() -> manager.getTask("r1"));
      assertThat(gated.paused.await(10, TimeUnit.SECONDS)).isTrue();

      CountDownLatch fetchDone = new CountDownLatch(1);
      Future<Task> fetch =
          executor.submit(
              () -> {
                try {
                  return manager.requestAudioFetch("r1");
                } finally {
                  fetchDone.countDown();
                }
              });
      // gives the fetch a chance to finish first when nothing makes it wait for the read
      fetchDone.await(300, TimeUnit.MILLISECONDS);
      gated.release.countDown();

      slowRead.get(10, TimeUnit.SECONDS);
      assertThat(fetch.get(10, TimeUnit.SECONDS).audioLocalPath()).isNotNull();
    } finally {
      executor.shutdownNow();
    }

    Task afterFetch = store.get("r1").orElseThrow();
    assertThat(afterFetch.audioLocalPath()).isNotNull();
    assertThat(history.findById("r1")).contains(afterFetch);

    Task afterFailedRetry = manager.requestAudioFetch("r1");

    assertThat(afterFailedRetry.progress())
        .startsWith(TaskLifecycleManager.AUDIO_FETCH_FAILED_PREFIX);
    assertThat(afterFailedRetry.audioLocalPath()).isEqualTo(afterFetch.audioLocalPath());
    assertThat(store.get("r1").orElseThrow().audioLocalPath())
        .isEqualTo(afterFetch.audioLocalPath());
    assertThat(Path.of(afterFetch.audioLocalPath())).exists();
  }

  @Test
  void requestAudioFetch_shouldRejectTaskWithoutKeptAudio() {
    submit("r1", false);

    assertThatThrownBy(() -> manager.requestAudioFetch("r1"))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> manager.requestAudioFetch("unknown"))
        .isInstanceOf(TaskNotFoundException.class);
  }

  @Test
  void deleteAudio_shouldRemoveFileAndReference() {
    submit("r1", true);
    when(remoteClient.poll("r1")).thenReturn(completed(Optional.of("/api/audio/r1")));
    when(remoteClient.fetchAudio("r1")).thenReturn(new byte[] {1});
    manager.pollOnce("r1");
    runScheduledAudioFetch();
    Path audio = Path.of(store.get("r1").orElseThrow().audioLocalPath());

    Task task = manager.deleteAudio("r1");

    assertThat(task.audioLocalPath()).isNull();
    assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
    assertThat(audio).doesNotExist();
    assertThat(store.get("r1").orElseThrow().audioLocalPath()).isNull();
    verify(remoteClient, times(2)).deleteAudio("r1");
  }

  @Test
  void deleteAudio_shouldWaitForTaskLockBeforeRemovingFile() throws Exception {
    submit("r1", true);
    when(remoteClient.poll("r1")).thenReturn(completed(Optional.of("/api/audio/r1")));
    when(remoteClient.fetchAudio("r1")).thenReturn(new byte[] {1});
    manager.pollOnce("r1");
    runScheduledAudioFetch();
    Path audio = Path.of(store.get("r1").orElseThrow().audioLocalPath());

    ExecutorService executor = Executors.newFixedThreadPool(2);
    CountDownLatch locked = new CountDownLatch(1);
    CountDownLatch unlock = new CountDownLatch(1);
    try {
      Future<?> holder =
          executor.submit(
              () -> {
                locks.runWithLock(
                    "r1",
                    () -> {
                      locked.countDown();
                      try {
                        unlock.await();
                      } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                      }
                    });
                return null;
              });
      assertThat(locked.await(10, TimeUnit.SECONDS)).isTrue();

      Future<Task> deletion = executor.submit(() -> manager.deleteAudio("r1"));
      Thread.sleep(200);
      assertThat(deletion).isNotDone();
      assertThat(audio).exists();

      unlock.countDown();
      holder.get(10, TimeUnit.SECONDS);
      assertThat(deletion.get(10, TimeUnit.SECONDS).audioLocalPath()).isNull();
    } finally {
      executor.shutdownNow();
    }

    assertThat(audio).doesNotExist();
    assertThat(store.get("r1").orElseThrow().audioLocalPath()).isNull();
    assertThat(history.findById("r1").orElseThrow().audioLocalPath()).isNull();
  }

  @Test
  void deleteAudio_shouldToleratePreviouslyCleanedRemote() {
    submit("r1", false);
    doThrow(new TransientRemoteException("gone")).when(remoteClient).deleteAudio("r1");

    Task task = manager.deleteAudio("r1");

    assertThat(task.status()).isEqualTo(TaskStatus.SUBMITTED);
  }

  @Test
  void bulkCleanup_shouldReturnNonNegativeCount() {
    when(remoteClient.cleanup(24)).thenReturn(0, 5, -1);

    assertThat(manager.bulkCleanup(24)).isZero();
    assertThat(manager.bulkCleanup(24)).isEqualTo(5);
    assertThat(manager.bulkCleanup(24)).isZero();
    assertThatThrownBy(() -> manager.bulkCleanup(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void resumeInFlightTasks_shouldPollSubmittedAndProcessingTasks() {
    Task submitted = Task.created(URL, false, NOW).submitted("a", "queued", NOW);
    store.upsert(submitted);
    store.upsert(
        Task.created(URL, false, NOW).submitted("b", "queued", NOW).processing("10%", NOW));
    store.upsert(
        Task.created(URL, false, NOW).submitted("c", "queued", NOW).failed("boom", NOW));

    int resumed = manager.resumeInFlightTasks();

    assertThat(resumed).isEqualTo(2);
    assertThat(manager.pollingTaskIds()).containsExactlyInAnyOrder("a", "b");
  }

  @Test
  void deleteTask_shouldRemoveRecordAndStopPolling() {
    submit("r1", false);

    manager.deleteTask("r1");

    assertThat(store.get("r1")).isEmpty();
    assertThat(history.findById("r1")).isEmpty();
    assertThat(manager.isPolling("r1")).isFalse();
    assertThatThrownBy(() -> manager.deleteTask("r1")).isInstanceOf(TaskNotFoundException.class);
  }

  @Test
  void purgeTasksOlderThan_shouldDeleteOnlyOldRecords() {
    Instant old = NOW.minus(Duration.ofDays(10));
    Task oldTask = Task.created(URL, false, old).submitted("old", "queued", old);
    store.upsert(oldTask);
    history.put(oldTask);
    submit("fresh", false);

    int deleted = manager.purgeTasksOlderThan(7);

    assertThat(deleted).isEqualTo(1);
    assertThat(store.get("old")).isEmpty();
    assertThat(history.findById("old")).isEmpty();
    assertThat(store.get("fresh")).isPresent();
  }

  @Test
  void listRecentTasks_shouldReturnNewestFirst() {
    Instant earlier = NOW.minusSeconds(60);
    store.upsert(Task.created(URL, false, earlier).submitted("older", "queued", earlier));
    submit("newer", false);

    assertThat(manager.listRecentTasks(10)).extracting(Task::id).containsExactly("newer", "older");
  }

  private Task submit(String remoteId, boolean keepAudio) {
    when(remoteClient.submit(URL, keepAudio, null)).thenReturn(remoteId);
    return manager.createTask(URL, keepAudio, null);
  }

  private void runScheduledAudioFetch() {
    ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
    verify(scheduler).schedule(captor.capture(), any(Instant.class));
    captor.getValue().run();
  }

  private static PollResult.Completed completed(Optional<String> audioRef) {
    return new PollResult.Completed(
        "你好。",
        List.of(new CharTimestamp(0, 100), new CharTimestamp(100, 200)),
        "Completed",
        audioRef);
  }

  private TaskLifecycleManager newManager(TaskStore taskStore, Optional<SecretProvider> provider) {
    return new TaskLifecycleManager(
        taskStore,
        history,
        remoteClient,
        provider,
        audioStore,
        locks,
        scheduler,
        properties,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  /** Store wrapper whose next {@code get} stalls after reading until released. */
  private static final class GatedTaskStore implements TaskStore {

    private final TaskStore delegate;
    private final AtomicBoolean armed = new AtomicBoolean();
    final CountDownLatch paused = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);

    GatedTaskStore(TaskStore delegate) {
      this.delegate = delegate;
    }

    void pauseNextGet() {
      armed.set(true);
    }

    @Override
    public Optional<Task> get(String id) {
      Optional<Task> read = delegate.get(id);
      if (armed.compareAndSet(true, false)) {
        paused.countDown();
        try {
          release.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      return read;
    }

    @Override
    public void upsert(Task task) {
      delegate.upsert(task);
    }

    @Override
    public List<Task> listRecent(int limit) {
      return delegate.listRecent(limit);
    }

    @Override
    public List<Task> findByStatus(Collection<TaskStatus> statuses) {
      return delegate.findByStatus(statuses);
    }

    @Override
    public boolean deleteAudioReference(String id) {
      return delegate.deleteAudioReference(id);
    }

    @Override
    public boolean delete(String id) {
      return delegate.delete(id);
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
      return delegate.deleteOlderThan(cutoff);
    }
  }
}
