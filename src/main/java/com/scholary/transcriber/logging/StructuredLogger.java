package com.scholary.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method sets event fields for the duration of a single log call, so log shippers can
 * index task lifecycle events without parsing messages.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a persisted status change. */
  public void logTransition(String taskId, String fromStatus, String toStatus, String progress) {
    try {
      MDC.put("event_type", "task_transition");
      MDC.put("fromStatus", fromStatus);
      MDC.put("toStatus", toStatus);

      logger.info(
          "Task transition: taskId={}, {} -> {}, progress={}",
          taskId,
          fromStatus,
          toStatus,
          progress);
    } finally {
      clearEventFields();
    }
  }

  /** Log a recoverable poll or fetch fault. */
  public void logTransientFault(String taskId, String operation, String errorType, String message) {
    try {
      MDC.put("event_type", "transient_fault");
      MDC.put("operation", operation);
      MDC.put("errorType", errorType);

      logger.warn(
          "Transient fault: taskId={}, operation={}, error={}, message={}",
          taskId,
          operation,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a completed audio download. */
  public void logAudioFetched(String taskId, long bytes, long fetchMs) {
    try {
      MDC.put("event_type", "audio_fetched");
      MDC.put("bytes", String.valueOf(bytes));
      MDC.put("fetchMs", String.valueOf(fetchMs));

      logger.info("Audio fetched: taskId={}, bytes={}, fetch={}ms", taskId, bytes, fetchMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed audio download; the task keeps its status. */
  public void logAudioFetchFailed(String taskId, String errorType, String message) {
    try {
      MDC.put("event_type", "audio_fetch_failed");
      MDC.put("errorType", errorType);

      logger.warn(
          "Audio fetch failed (retry available): taskId={}, error={}, message={}",
          taskId,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set task context in MDC. */
  public static void setTaskContext(String taskId) {
    MDC.put("taskId", taskId);
  }

  /** Clear task context from MDC. */
  public static void clearTaskContext() {
    MDC.remove("taskId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("fromStatus");
    MDC.remove("toStatus");
    MDC.remove("operation");
    MDC.remove("errorType");
    MDC.remove("bytes");
    MDC.remove("fetchMs");
  }
}
