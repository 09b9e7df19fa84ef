package com.scholary.transcriber.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Response to a bulk audio cleanup request. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CleanupResponse(@JsonProperty("deleted_count") Integer deletedCount) {}
