package com.scholary.transcriber.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the remote transcription service.
 *
 * <p>Speaks JSON over the Java 11+ HttpClient. Every request carries the configured read timeout,
 * and every transport fault (connection refused, timeout, unexpected status, unreadable body) is
 * reported as a {@link TransientRemoteException} so the poll loop can simply try again on the next
 * tick.
 *
 * <p>Only the idempotent audio calls are retried in place, with exponential backoff and jitter.
 * Submissions are attempted once: a retry after a lost response could start the same job twice.
 */
@Component
public class HttpRemoteTaskClient implements RemoteTaskClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpRemoteTaskClient.class);

  private final HttpClient httpClient;
  private final RemoteServiceProperties properties;
  private final ObjectMapper objectMapper;
  private final String baseUrl;

  public HttpRemoteTaskClient(RemoteServiceProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.baseUrl = stripTrailingSlash(properties.baseUrl());

    this.httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized remote task client: baseUrl={}", baseUrl);
  }

  @Override
  public String submit(String url, boolean keepAudio, String encryptedSecret) {
    LOGGER.info(
        "Submitting task: url={}, keepAudio={}, withSecret={}",
        url,
        keepAudio,
        encryptedSecret != null);

    HttpResponse<String> response;
    try {
      byte[] body = objectMapper.writeValueAsBytes(new SubmitRequest(url, keepAudio, encryptedSecret));
      HttpRequest request =
          requestBuilder("/api/process")
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofByteArray(body))
              .build();
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw new SubmissionException("Submission timed out", e);
    } catch (IOException e) {
      throw new SubmissionException("Submission failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SubmissionException("Submission interrupted", e);
    }

    if (response.statusCode() != 200 && response.statusCode() != 202) {
      throw new SubmissionException(
          String.format(
              "Remote service rejected submission with status %d: %s",
              response.statusCode(), response.body()));
    }

    SubmitResponse submitResponse;
    try {
      submitResponse = objectMapper.readValue(response.body(), SubmitResponse.class);
    } catch (JsonProcessingException e) {
      throw new SubmissionException("Unreadable submission response: " + e.getOriginalMessage(), e);
    }
    if (submitResponse.taskId() == null || submitResponse.taskId().isBlank()) {
      throw new SubmissionException("Submission response is missing task_id");
    }

    LOGGER.info("Task accepted by remote service: taskId={}", submitResponse.taskId());
    return submitResponse.taskId();
  }

  @Override
  public PollResult poll(String taskId) {
    HttpRequest request = requestBuilder("/api/status/" + encode(taskId)).GET().build();
    HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString(), "poll");

    if (response.statusCode() != 200) {
      throw new TransientRemoteException(
          String.format(
              "Status query for %s returned %d: %s", taskId, response.statusCode(), response.body()));
    }

    try {
      StatusResponse status = objectMapper.readValue(response.body(), StatusResponse.class);
      return status.toPollResult();
    } catch (JsonProcessingException e) {
      throw new TransientRemoteException(
          "Unreadable status response for " + taskId + ": " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public byte[] fetchAudio(String taskId) {
    HttpRequest request = requestBuilder(audioPath(taskId)).GET().build();
    HttpResponse<byte[]> response =
        sendWithRetry(request, HttpResponse.BodyHandlers.ofByteArray(), "fetchAudio");

    if (response.statusCode() == 404) {
      throw new AudioNotAvailableException(taskId);
    }
    if (response.statusCode() != 200) {
      throw new TransientRemoteException(
          String.format("Audio download for %s returned %d", taskId, response.statusCode()));
    }

    LOGGER.info("Downloaded audio: taskId={}, bytes={}", taskId, response.body().length);
    return response.body();
  }

  @Override
  public void deleteAudio(String taskId) {
    HttpRequest request = requestBuilder(audioPath(taskId)).DELETE().build();
    HttpResponse<String> response =
        sendWithRetry(request, HttpResponse.BodyHandlers.ofString(), "deleteAudio");

    int statusCode = response.statusCode();
    if (statusCode == 404) {
      LOGGER.debug("Remote audio already gone: taskId={}", taskId);
      return;
    }
    if (statusCode != 200 && statusCode != 204) {
      throw new TransientRemoteException(
          String.format("Audio delete for %s returned %d: %s", taskId, statusCode, response.body()));
    }
    LOGGER.info("Deleted remote audio: taskId={}", taskId);
  }

  @Override
  public int cleanup(int maxAgeHours) {
    HttpRequest request =
        requestBuilder("/api/cleanup?max_age_hours=" + maxAgeHours)
            .POST(BodyPublishers.noBody())
            .build();
    HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString(), "cleanup");

    if (response.statusCode() != 200) {
      throw new TransientRemoteException(
          String.format("Cleanup returned %d: %s", response.statusCode(), response.body()));
    }
    if (response.body() == null || response.body().isBlank()) {
      return 0;
    }

    try {
      CleanupResponse cleanup = objectMapper.readValue(response.body(), CleanupResponse.class);
      int deleted = cleanup.deletedCount() != null ? Math.max(0, cleanup.deletedCount()) : 0;
      LOGGER.info("Remote cleanup finished: maxAgeHours={}, deleted={}", maxAgeHours, deleted);
      return deleted;
    } catch (JsonProcessingException e) {
      throw new TransientRemoteException("Unreadable cleanup response: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Send an idempotent request, retrying transport faults with exponential backoff.
   *
   * @throws TransientRemoteException once all attempts are used up
   */
  private <T> HttpResponse<T> sendWithRetry(
      HttpRequest request, HttpResponse.BodyHandler<T> handler, String operation) {
    int attempt = 0;
    TransientRemoteException lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return send(request, handler, operation);
      } catch (TransientRemoteException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "{} attempt {} failed, retrying in {}ms: {}",
              operation,
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientRemoteException(operation + " interrupted", ie);
          }
        }
      }
    }

    throw new TransientRemoteException(
        String.format("%s failed after %d attempts", operation, properties.maxRetries()),
        lastException);
  }

  private <T> HttpResponse<T> send(
      HttpRequest request, HttpResponse.BodyHandler<T> handler, String operation) {
    LOGGER.debug("Sending {} request to {}", operation, request.uri());
    try {
      return httpClient.send(request, handler);
    } catch (HttpTimeoutException e) {
      throw new TransientRemoteException(operation + " timed out: " + request.uri(), e);
    } catch (IOException e) {
      throw new TransientRemoteException(operation + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientRemoteException(operation + " interrupted", e);
    }
  }

  private HttpRequest.Builder requestBuilder(String path) {
    return HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .timeout(Duration.ofSeconds(properties.readTimeout()));
  }

  private static String audioPath(String taskId) {
    return "/api/audio/" + encode(taskId);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
