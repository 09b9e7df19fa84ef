package com.scholary.transcriber.audio;

import com.scholary.transcriber.config.TaskProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps downloaded task audio on the local filesystem.
 *
 * <p>Each task maps to exactly one file, {@code <audio-dir>/<sanitized-task-id>.mp3}, so repeated
 * fetches overwrite rather than accumulate. Writes go to a temp file first and are moved into
 * place, so a reader never sees a half-written file.
 */
@Component
public class LocalAudioStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalAudioStore.class);
  private static final String EXTENSION = ".mp3";

  private final Path audioDir;

  public LocalAudioStore(TaskProperties properties) {
    this.audioDir = Paths.get(properties.audioDir()).toAbsolutePath().normalize();

    try {
      Files.createDirectories(audioDir);
    } catch (IOException e) {
      throw new AudioStorageException("Failed to create audio directory: " + audioDir, e);
    }
    LOGGER.info("Local audio store ready: dir={}", audioDir);
  }

  /** Deterministic location of a task's audio file. */
  public Path pathFor(String taskId) {
    return audioDir.resolve(FileNames.sanitize(taskId) + EXTENSION);
  }

  /**
   * Write the audio of a task, replacing any earlier copy.
   *
   * @return the absolute path of the written file
   */
  public Path write(String taskId, byte[] audio) {
    Path target = pathFor(taskId);
    Path temp = audioDir.resolve(target.getFileName() + ".part");
    try {
      Files.write(temp, audio);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new AudioStorageException("Failed to write audio for task " + taskId, e);
    }
    LOGGER.info("Stored audio: taskId={}, path={}, bytes={}", taskId, target, audio.length);
    return target;
  }

  /**
   * Delete a task's audio file if present.
   *
   * @return true if a file was removed
   */
  public boolean delete(Path path) {
    try {
      boolean deleted = Files.deleteIfExists(path);
      LOGGER.info("Deleted local audio: path={}, existed={}", path, deleted);
      return deleted;
    } catch (IOException e) {
      throw new AudioStorageException("Failed to delete audio file " + path, e);
    }
  }

  private void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Could not remove partial audio file {}: {}", path, e.getMessage());
    }
  }
}
