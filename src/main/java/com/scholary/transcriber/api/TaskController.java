package com.scholary.transcriber.api;

import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.service.TaskLifecycleManager;
import com.scholary.transcriber.task.Task;
import com.scholary.transcriber.task.TaskStatus;
import com.scholary.transcriber.task.TaskStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for transcription tasks.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting, inspecting and listing tasks
 *   <li>Fetching and deleting a task's audio
 *   <li>Local and remote cleanup
 * </ul>
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Tasks", description = "Remote transcription task lifecycle")
public class TaskController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskController.class);

  private final TaskLifecycleManager lifecycleManager;

  public TaskController(TaskLifecycleManager lifecycleManager) {
    this.lifecycleManager = lifecycleManager;
  }

  /**
   * Submit a URL for transcription.
   *
   * <p>Returns 201 when the remote service accepted the task. A rejected submission still creates a
   * local {@code FAILED} record, returned with 200 so the caller can show the error.
   */
  @PostMapping("/tasks")
  @Operation(
      summary = "Create a transcription task",
      description =
          "Submits the URL to the remote service and starts polling. "
              + "Submission failures produce a FAILED task instead of an error response.")
  public ResponseEntity<TaskResponse> createTask(@Valid @RequestBody CreateTaskRequest request) {
    LOGGER.info("Create task request: url={}, keepAudio={}", request.url(), request.keepAudio());
    Task task = lifecycleManager.createTask(request.url(), request.keepAudio(), request.secret());
    HttpStatus status = task.status() == TaskStatus.FAILED ? HttpStatus.OK : HttpStatus.CREATED;
    return ResponseEntity.status(status).body(toResponse(task));
  }

  @GetMapping("/tasks/{taskId}")
  @Operation(summary = "Get a task")
  public TaskResponse getTask(@PathVariable String taskId) {
    return toResponse(lifecycleManager.getTaskOrThrow(taskId));
  }

  @GetMapping("/tasks")
  @Operation(summary = "List recent tasks", description = "Newest first, at most 100.")
  public List<TaskResponse> listTasks(
      @RequestParam(defaultValue = "" + TaskStore.MAX_RECENT) int limit) {
    return lifecycleManager.listRecentTasks(limit).stream().map(this::toResponse).toList();
  }

  @DeleteMapping("/tasks/{taskId}")
  @Operation(summary = "Delete a task locally", description = "Also removes its local audio file.")
  public ResponseEntity<Void> deleteTask(@PathVariable String taskId) {
    lifecycleManager.deleteTask(taskId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/tasks/{taskId}/abandon")
  @Operation(summary = "Stop polling a task", description = "The record is left unchanged.")
  public TaskResponse abandonTask(@PathVariable String taskId) {
    lifecycleManager.abandonTask(taskId);
    return toResponse(lifecycleManager.getTaskOrThrow(taskId));
  }

  @PostMapping("/tasks/{taskId}/audio")
  @Operation(
      summary = "Fetch a task's audio",
      description =
          "Downloads the audio kept by the remote service. "
              + "A failed download keeps the task COMPLETED and can be retried.")
  public TaskResponse fetchAudio(@PathVariable String taskId) {
    try {
      StructuredLogger.setTaskContext(taskId);
      return toResponse(lifecycleManager.requestAudioFetch(taskId));
    } finally {
      StructuredLogger.clearTaskContext();
    }
  }

  @DeleteMapping("/tasks/{taskId}/audio")
  @Operation(summary = "Delete a task's audio", description = "Local file and remote copy.")
  public TaskResponse deleteAudio(@PathVariable String taskId) {
    return toResponse(lifecycleManager.deleteAudio(taskId));
  }

  @PostMapping("/maintenance/cleanup")
  @Operation(summary = "Delete old tasks on the remote service")
  public CountResponse cleanupRemote(@RequestParam(defaultValue = "24") int maxAgeHours) {
    return new CountResponse(lifecycleManager.bulkCleanup(maxAgeHours));
  }

  @PostMapping("/maintenance/purge")
  @Operation(summary = "Delete old local task records")
  public CountResponse purgeLocal(@RequestParam(defaultValue = "30") int days) {
    return new CountResponse(lifecycleManager.purgeTasksOlderThan(days));
  }

  private TaskResponse toResponse(Task task) {
    return TaskResponse.from(task, lifecycleManager.isPolling(task.id()));
  }
}
