package com.scholary.transcriber.remote;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the remote transcription service client.
 *
 * <p>Timeouts are in seconds. {@code maxRetries} applies to idempotent calls only (audio download,
 * audio delete); submissions and polls are attempted once.
 */
@ConfigurationProperties(prefix = "remote")
@Validated
public record RemoteServiceProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
