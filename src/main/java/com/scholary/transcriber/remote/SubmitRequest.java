package com.scholary.transcriber.remote;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of the job submission call. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmitRequest(
    String url,
    @JsonProperty("keep_audio") boolean keepAudio,
    @JsonProperty("encrypted_cookie_data") String encryptedSecret) {}
