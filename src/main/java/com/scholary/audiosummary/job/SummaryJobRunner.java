package com.scholary.audiosummary.job;

import com.scholary.audiosummary.api.JobStatusResponse.Status;
import com.scholary.audiosummary.error.AudioSummaryException;
import com.scholary.audiosummary.error.ErrorCode;
import com.scholary.audiosummary.logging.StructuredLogger;
import com.scholary.audiosummary.pipeline.PipelineResult;
import com.scholary.audiosummary.pipeline.SummaryPipeline;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs summary jobs on the job executor.
 *
 * <p>Lives in its own bean so that {@code @Async} goes through the Spring proxy. The pipeline has
 * already reported any failure through the job's progress sink by the time it throws; this class
 * only records the final status.
 */
@Component
public class SummaryJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummaryJobRunner.class);

  private final SummaryPipeline pipeline;
  private final JobRepository jobRepository;

  public SummaryJobRunner(SummaryPipeline pipeline, JobRepository jobRepository) {
    this.pipeline = pipeline;
    this.jobRepository = jobRepository;
  }

  @Async("jobExecutor")
  public void run(SummaryJob job) {
    StructuredLogger.setJobContext(job.getJobId());
    LOGGER.info("Starting async processing for job: {}", job.getJobId());
    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      PipelineResult result =
          pipeline.run(
              job.getSourceUrl(), job.getOverrides(), new JobProgressSink(job), job.getSignal());

      job.setResult(result);
      job.setProgress(100);
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);
      LOGGER.info(
          "Completed async processing for job: {} in {} ms",
          job.getJobId(),
          Duration.between(job.getCreatedAt(), Instant.now()).toMillis());

    } catch (AudioSummaryException e) {
      if (e.getErrorCode() == ErrorCode.CANCELLED) {
        LOGGER.info("Job cancelled: {}", job.getJobId());
        job.setStatus(Status.CANCELLED);
      } else {
        LOGGER.warn("Job failed: {} ({})", job.getJobId(), e.getErrorCode());
        job.setStatus(Status.FAILED);
      }
      job.setError(e.getMessage());
      jobRepository.save(job);
    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}
