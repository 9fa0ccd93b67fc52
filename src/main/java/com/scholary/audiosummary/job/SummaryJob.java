package com.scholary.audiosummary.job;

import com.scholary.audiosummary.api.JobStatusResponse.Status;
import com.scholary.audiosummary.capability.ProviderOverrides;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import com.scholary.audiosummary.pipeline.PipelineResult;
import java.time.Instant;

/**
 * Represents an async summary job.
 *
 * <p>Tracks the job's state, latest progress event, and result. Written by the pipeline thread and
 * read by request threads, so mutable fields are volatile.
 */
public class SummaryJob {

  private final String jobId;
  private final String sourceUrl;
  private final ProviderOverrides overrides;
  private final CancellationSignal signal;
  private final Instant createdAt;

  private volatile Status status;
  private volatile int progress; // 0-100
  private volatile String stage;
  private volatile String message;
  private volatile PipelineResult result;
  private volatile String error;

  public SummaryJob(String jobId, String sourceUrl, ProviderOverrides overrides) {
    this.jobId = jobId;
    this.sourceUrl = sourceUrl;
    this.overrides = overrides;
    this.signal = CancellationSignal.create();
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public String getSourceUrl() {
    return sourceUrl;
  }

  public ProviderOverrides getOverrides() {
    return overrides;
  }

  public CancellationSignal getSignal() {
    return signal;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public int getProgress() {
    return progress;
  }

  public void setProgress(int progress) {
    this.progress = progress;
  }

  public String getStage() {
    return stage;
  }

  public void setStage(String stage) {
    this.stage = stage;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public PipelineResult getResult() {
    return result;
  }

  public void setResult(PipelineResult result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
