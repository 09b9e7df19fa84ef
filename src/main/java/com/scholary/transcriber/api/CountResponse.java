package com.scholary.transcriber.api;

/** Result of a maintenance call that removes records. */
public record CountResponse(int deletedCount) {}
