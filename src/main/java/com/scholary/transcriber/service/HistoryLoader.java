package com.scholary.transcriber.service;

import com.scholary.transcriber.config.TaskProperties;
import com.scholary.transcriber.task.Task;
import com.scholary.transcriber.task.TaskHistory;
import com.scholary.transcriber.task.TaskStore;
import com.scholary.transcriber.task.TaskStoreException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Fills the in-memory history with the most recent tasks at startup.
 *
 * <p>A store that cannot be read leaves the history empty; the process still starts.
 */
@Component
public class HistoryLoader implements ApplicationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(HistoryLoader.class);

  private final TaskStore taskStore;
  private final TaskHistory taskHistory;
  private final int historyLimit;

  public HistoryLoader(TaskStore taskStore, TaskHistory taskHistory, TaskProperties properties) {
    this.taskStore = taskStore;
    this.taskHistory = taskHistory;
    this.historyLimit = properties.historyLimit();
  }

  @Override
  public void run(ApplicationArguments args) {
    load();
  }

  /**
   * Replace the history with the newest tasks from the store.
   *
   * @return number of tasks loaded
   */
  public int load() {
    taskHistory.clear();
    List<Task> recent;
    try {
      recent = taskStore.listRecent(historyLimit);
    } catch (TaskStoreException e) {
      LOGGER.error("Could not load task history, starting with an empty history", e);
      return 0;
    }
    recent.forEach(taskHistory::put);
    LOGGER.info("Loaded {} tasks into history", recent.size());
    return recent.size();
  }
}
