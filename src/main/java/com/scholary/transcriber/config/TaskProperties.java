package com.scholary.transcriber.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for local task handling.
 *
 * <p>Controls the poll cadence, where fetched audio and exported subtitles land, and how much
 * history is loaded at startup.
 */
@ConfigurationProperties(prefix = "tasks")
@Validated
public record TaskProperties(
    @NotNull Duration pollInterval,
    @Positive int pollingThreads,
    @NotBlank String audioDir,
    @NotBlank String exportDir,
    @Positive @Max(100) int historyLimit,
    @Positive int historyCacheSize,
    boolean resumeOnStartup,
    @Positive int defaultMinLength) {}
