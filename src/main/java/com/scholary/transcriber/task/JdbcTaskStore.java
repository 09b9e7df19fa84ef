package com.scholary.transcriber.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * JDBC implementation of {@link TaskStore} backed by the embedded H2 database.
 *
 * <p>Upserts are a single {@code MERGE} statement, so the row is replaced atomically. Writes for
 * the same id additionally go through {@link KeyedLocks}, which linearizes them with the lifecycle
 * manager's read-modify-write sections. The character timing list is stored as a JSON array of
 * {@code [start, end]} pairs.
 */
@Repository
public class JdbcTaskStore implements TaskStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcTaskStore.class);

  private static final String UPSERT_SQL =
      """
      MERGE INTO tasks (id, source_url, status, progress, keep_audio, transcript,
                        subtitle_source, audio_local_path, error_message, created_at, updated_at)
      KEY (id)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      """;

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final KeyedLocks keyedLocks;
  private final RowMapper<Task> rowMapper = this::mapRow;

  public JdbcTaskStore(
      JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, KeyedLocks keyedLocks) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
    this.keyedLocks = keyedLocks;
  }

  @Override
  public void upsert(Task task) {
    String subtitleJson = writeTimestamps(task);
    keyedLocks.runWithLock(
        task.id(),
        () -> {
          try {
            jdbcTemplate.update(
                UPSERT_SQL,
                task.id(),
                task.sourceUrl(),
                task.status().name(),
                task.progress(),
                task.keepAudio(),
                task.transcript(),
                subtitleJson,
                task.audioLocalPath(),
                task.errorMessage(),
                toUtc(task.createdAt()),
                toUtc(task.updatedAt()));
          } catch (DataAccessException e) {
            throw new TaskStoreException("Failed to save task: " + task.id(), e);
          }
        });
    LOGGER.debug("Saved task: id={}, status={}", task.id(), task.status());
  }

  @Override
  public Optional<Task> get(String id) {
    try {
      List<Task> rows = jdbcTemplate.query("SELECT * FROM tasks WHERE id = ?", rowMapper, id);
      return rows.stream().findFirst();
    } catch (DataAccessException e) {
      throw new TaskStoreException("Failed to load task: " + id, e);
    }
  }

  @Override
  public List<Task> listRecent(int limit) {
    int bounded = Math.min(limit, MAX_RECENT);
    if (bounded <= 0) {
      return List.of();
    }
    try {
      return jdbcTemplate.query(
          "SELECT * FROM tasks ORDER BY created_at DESC, id DESC LIMIT ?", rowMapper, bounded);
    } catch (DataAccessException e) {
      throw new TaskStoreException("Failed to list recent tasks", e);
    }
  }

  @Override
  public List<Task> findByStatus(Collection<TaskStatus> statuses) {
    if (statuses.isEmpty()) {
      return List.of();
    }
    String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
    Object[] args = statuses.stream().map(Enum::name).toArray();
    try {
      return jdbcTemplate.query(
          "SELECT * FROM tasks WHERE status IN (" + placeholders + ") ORDER BY created_at",
          rowMapper,
          args);
    } catch (DataAccessException e) {
      throw new TaskStoreException("Failed to find tasks by status: " + statuses, e);
    }
  }

  @Override
  public boolean deleteAudioReference(String id) {
    return keyedLocks.withLock(
        id,
        () -> {
          try {
            int updated =
                jdbcTemplate.update(
                    "UPDATE tasks SET audio_local_path = NULL, updated_at = ? WHERE id = ?",
                    toUtc(Instant.now()),
                    id);
            return updated > 0;
          } catch (DataAccessException e) {
            throw new TaskStoreException("Failed to clear audio reference: " + id, e);
          }
        });
  }

  @Override
  public boolean delete(String id) {
    return keyedLocks.withLock(
        id,
        () -> {
          try {
            return jdbcTemplate.update("DELETE FROM tasks WHERE id = ?", id) > 0;
          } catch (DataAccessException e) {
            throw new TaskStoreException("Failed to delete task: " + id, e);
          }
        });
  }

  @Override
  public int deleteOlderThan(Instant cutoff) {
    try {
      int deleted =
          jdbcTemplate.update("DELETE FROM tasks WHERE created_at < ?", toUtc(cutoff));
      LOGGER.info("Deleted {} tasks created before {}", deleted, cutoff);
      return deleted;
    } catch (DataAccessException e) {
      throw new TaskStoreException("Failed to delete tasks older than " + cutoff, e);
    }
  }

  private Task mapRow(ResultSet rs, int rowNum) throws SQLException {
    String id = rs.getString("id");
    return new Task(
        id,
        rs.getString("source_url"),
        TaskStatus.valueOf(rs.getString("status")),
        rs.getString("progress"),
        rs.getBoolean("keep_audio"),
        rs.getString("transcript"),
        readTimestamps(id, rs.getString("subtitle_source")),
        rs.getString("audio_local_path"),
        rs.getString("error_message"),
        toInstant(rs.getObject("created_at", OffsetDateTime.class)),
        toInstant(rs.getObject("updated_at", OffsetDateTime.class)));
  }

  private String writeTimestamps(Task task) {
    if (task.subtitleSource() == null) {
      return null;
    }
    long[][] pairs = new long[task.subtitleSource().size()][];
    for (int i = 0; i < pairs.length; i++) {
      CharTimestamp ts = task.subtitleSource().get(i);
      pairs[i] = new long[] {ts.startMs(), ts.endMs()};
    }
    try {
      return objectMapper.writeValueAsString(pairs);
    } catch (JsonProcessingException e) {
      throw new TaskStoreException("Failed to serialize timestamps of task: " + task.id(), e);
    }
  }

  private List<CharTimestamp> readTimestamps(String id, String json) {
    if (json == null) {
      return null;
    }
    try {
      long[][] pairs = objectMapper.readValue(json, long[][].class);
      List<CharTimestamp> timestamps = new ArrayList<>(pairs.length);
      for (long[] pair : pairs) {
        timestamps.add(new CharTimestamp(pair[0], pair[1]));
      }
      return timestamps;
    } catch (JsonProcessingException | RuntimeException e) {
      throw new TaskStoreException("Corrupt subtitle source for task: " + id, e);
    }
  }

  // Bound with an explicit offset so the JVM time zone never shifts stored instants.
  private static OffsetDateTime toUtc(Instant instant) {
    return instant.atOffset(ZoneOffset.UTC);
  }

  private static Instant toInstant(OffsetDateTime timestamp) {
    return timestamp != null ? timestamp.toInstant() : null;
  }
}
