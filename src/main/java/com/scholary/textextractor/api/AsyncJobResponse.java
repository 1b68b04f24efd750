package com.scholary.textextractor.api;

/** Response for an async extraction request: the job ID to poll. */
public record AsyncJobResponse(String jobId) {}
