package com.scholary.transcriber.api;

import java.time.Instant;

/** JSON body returned for every handled error. */
public record ErrorResponse(int status, String error, String message, Instant timestamp) {}
