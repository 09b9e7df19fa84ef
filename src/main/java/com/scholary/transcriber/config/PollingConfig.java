package com.scholary.transcriber.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for the task poll loop.
 *
 * <p>Every in-flight task gets its own fixed-delay schedule on this pool. The pool size bounds how
 * many polls run at the same moment, not how many tasks can be watched.
 */
@Configuration
public class PollingConfig {

  @Bean(name = "pollingScheduler")
  public ThreadPoolTaskScheduler pollingScheduler(TaskProperties properties) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.pollingThreads());
    scheduler.setThreadNamePrefix("task-poll-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }
}
