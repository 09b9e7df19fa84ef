package com.scholary.transcriber.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Response to a job submission. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitResponse(@JsonProperty("task_id") String taskId, String message) {}
