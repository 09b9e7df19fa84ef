package com.scholary.transcriber.service;

import com.scholary.transcriber.audio.FileNames;
import com.scholary.transcriber.config.TaskProperties;
import com.scholary.transcriber.subtitle.SubtitleCue;
import com.scholary.transcriber.subtitle.SubtitleFormat;
import com.scholary.transcriber.subtitle.SubtitleSynthesizer;
import com.scholary.transcriber.subtitle.SubtitleWriter;
import com.scholary.transcriber.task.Task;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Renders a completed task's transcript as subtitles, in memory or to a file. */
@Service
public class SubtitleExportService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleExportService.class);

  private final TaskLifecycleManager lifecycleManager;
  private final SubtitleSynthesizer synthesizer;
  private final SubtitleWriter writer;
  private final Path exportDir;
  private final int defaultMinLength;

  public SubtitleExportService(
      TaskLifecycleManager lifecycleManager,
      SubtitleSynthesizer synthesizer,
      SubtitleWriter writer,
      TaskProperties properties) {
    this.lifecycleManager = lifecycleManager;
    this.synthesizer = synthesizer;
    this.writer = writer;
    this.exportDir = Paths.get(properties.exportDir()).toAbsolutePath().normalize();
    this.defaultMinLength = properties.defaultMinLength();
  }

  /**
   * Synthesize the task's cues.
   *
   * @param minLength minimum cue length, or {@code null} for the configured default
   * @throws IllegalStateException if the task has no transcript yet
   */
  public List<SubtitleCue> cues(String taskId, Integer minLength) {
    Task task = lifecycleManager.getTaskOrThrow(taskId);
    if (!task.hasTranscript()) {
      throw new IllegalStateException(
          "Task " + taskId + " has no transcript, status=" + task.status());
    }
    return synthesizer.synthesize(
        task.transcript(), task.subtitleSource(), resolveMinLength(minLength));
  }

  public String render(String taskId, Integer minLength, SubtitleFormat format) {
    return writer.write(cues(taskId, minLength), format);
  }

  /**
   * Write the task's subtitles into the export directory.
   *
   * @param fileName base name without extension, or {@code null} to use the task id
   * @return the written file
   */
  public Path export(String taskId, Integer minLength, SubtitleFormat format, String fileName) {
    String content = render(taskId, minLength, format);
    String baseName = fileName == null || fileName.isBlank() ? taskId : fileName;
    Path target = exportDir.resolve(FileNames.sanitize(baseName) + format.extension());
    try {
      Files.createDirectories(exportDir);
      Files.writeString(target, content, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write subtitles to " + target, e);
    }
    LOGGER.info("Exported subtitles: taskId={}, format={}, path={}", taskId, format, target);
    return target;
  }

  private int resolveMinLength(Integer minLength) {
    if (minLength == null) {
      return defaultMinLength;
    }
    if (minLength < 1) {
      throw new IllegalArgumentException("minLength must be positive: " + minLength);
    }
    return minLength;
  }
}
