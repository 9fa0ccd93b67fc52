package com.scholary.audiosummary.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.audiosummary.job.SummaryJob;
import com.scholary.audiosummary.pipeline.PipelineResult;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result if completed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
    String jobId,
    Status status,
    Integer progress,
    String stage,
    String message,
    PipelineResult result,
    String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
  }

  static JobStatusResponse from(SummaryJob job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getStatus(),
        job.getProgress(),
        job.getStage(),
        job.getMessage(),
        job.getResult(),
        job.getError());
  }
}
