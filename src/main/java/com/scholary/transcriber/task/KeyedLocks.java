package com.scholary.transcriber.task;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One reentrant lock per task id.
 *
 * <p>Locks are held in a weak-valued Caffeine cache: a lock stays in the map while any thread
 * holds a reference to it, and is collected once nobody uses it. Callers on different ids never
 * contend.
 */
@Component
public class KeyedLocks {

  private final LoadingCache<String, ReentrantLock> locks =
      Caffeine.newBuilder().weakValues().build(key -> new ReentrantLock());

  public <T> T withLock(String key, Supplier<T> action) {
    ReentrantLock lock = locks.get(key);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public void runWithLock(String key, Runnable action) {
    withLock(
        key,
        () -> {
          action.run();
          return null;
        });
  }
}
