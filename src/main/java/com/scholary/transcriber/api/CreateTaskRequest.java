package com.scholary.transcriber.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to transcribe a media URL.
 *
 * <p>{@code secret} is an optional plaintext credential payload; it is encrypted before it is
 * forwarded and never stored.
 */
public record CreateTaskRequest(@NotBlank String url, boolean keepAudio, String secret) {}
