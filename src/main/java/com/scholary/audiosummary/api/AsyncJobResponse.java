package com.scholary.audiosummary.api;

/**
 * Response for an async summary request.
 *
 * <p>Returns a job ID that can be used to poll for status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {}
