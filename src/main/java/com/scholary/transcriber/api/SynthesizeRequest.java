package com.scholary.transcriber.api;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * Ad-hoc subtitle synthesis input.
 *
 * <p>{@code timestamps} holds one {@code [start, end]} pair in milliseconds per content character.
 */
public record SynthesizeRequest(
    @NotNull String text, @NotNull List<List<Long>> timestamps, @Positive Integer minLength) {}
