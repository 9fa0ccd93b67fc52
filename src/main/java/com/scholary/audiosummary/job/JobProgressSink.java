package com.scholary.audiosummary.job;

import com.scholary.audiosummary.pipeline.ProcessingStatus;
import com.scholary.audiosummary.pipeline.ProgressSink;

/** Mirrors pipeline progress onto a {@link SummaryJob} for status polling. */
class JobProgressSink implements ProgressSink {

  private final SummaryJob job;

  JobProgressSink(SummaryJob job) {
    this.job = job;
  }

  @Override
  public void accept(ProcessingStatus status) {
    job.setStage(status.stage().tag());
    job.setMessage(status.message());
    if (!status.error()) {
      job.setProgress(status.progress());
    } else {
      job.setError(status.errorMessage());
    }
  }
}
