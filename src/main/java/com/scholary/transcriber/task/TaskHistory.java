package com.scholary.transcriber.task;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.transcriber.config.TaskProperties;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * In-memory set of recently seen tasks, used for display.
 *
 * <p>Filled at startup by the history loader and kept current by the lifecycle manager after every
 * persisted change. Size-bounded through Caffeine so a long-running process does not accumulate
 * every task it ever touched. The store stays the source of truth.
 */
@Component
public class TaskHistory {

  private final Cache<String, Task> cache;

  public TaskHistory(TaskProperties properties) {
    this.cache = Caffeine.newBuilder().maximumSize(properties.historyCacheSize()).build();
  }

  public void put(Task task) {
    cache.put(task.id(), task);
  }

  public Optional<Task> findById(String id) {
    return Optional.ofNullable(cache.getIfPresent(id));
  }

  public void remove(String id) {
    cache.invalidate(id);
  }

  public void clear() {
    cache.invalidateAll();
  }

  /** Snapshot of the cached tasks, newest first. */
  public List<Task> snapshot() {
    return cache.asMap().values().stream()
        .sorted(Comparator.comparing(Task::createdAt).reversed())
        .toList();
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }
}
