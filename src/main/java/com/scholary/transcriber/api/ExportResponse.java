package com.scholary.transcriber.api;

public record ExportResponse(String taskId, String format, String path) {}
