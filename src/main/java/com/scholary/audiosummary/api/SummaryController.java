package com.scholary.audiosummary.api;

import com.scholary.audiosummary.config.PipelineProperties;
import com.scholary.audiosummary.job.JobRepository;
import com.scholary.audiosummary.job.SummaryJob;
import com.scholary.audiosummary.job.SummaryJobRunner;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import com.scholary.audiosummary.pipeline.ProcessingStatus;
import com.scholary.audiosummary.pipeline.SummaryPipeline;
import com.scholary.audiosummary.query.AudioContent;
import com.scholary.audiosummary.query.EpisodeResult;
import com.scholary.audiosummary.query.SummaryQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for audio summaries.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Asynchronous summarization (returns job ID immediately)
 *   <li>Job status polling and cancellation
 *   <li>Streaming a run's progress as server-sent events
 *   <li>Fetching stored results and audio
 * </ul>
 */
@RestController
@Tag(name = "Summaries", description = "Audio download, transcription and spoken summary API")
public class SummaryController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummaryController.class);

  private final SummaryPipeline pipeline;
  private final SummaryJobRunner jobRunner;
  private final JobRepository jobRepository;
  private final SummaryQueryService queryService;
  private final Executor jobExecutor;
  private final Executor streamExecutor;
  private final PipelineProperties.SseProperties sse;

  public SummaryController(
      SummaryPipeline pipeline,
      SummaryJobRunner jobRunner,
      JobRepository jobRepository,
      SummaryQueryService queryService,
      @Qualifier("jobExecutor") Executor jobExecutor,
      @Qualifier("streamExecutor") Executor streamExecutor,
      PipelineProperties properties) {
    this.pipeline = pipeline;
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
    this.queryService = queryService;
    this.jobExecutor = jobExecutor;
    this.streamExecutor = streamExecutor;
    this.sse = properties.sse();
  }

  @PostMapping("/api/summaries")
  @Operation(
      summary = "Start summary job",
      description =
          "Download, transcribe and summarize an audio source asynchronously. "
              + "Returns a job ID for status polling.")
  public ResponseEntity<AsyncJobResponse> submit(@Valid @RequestBody SummaryRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info("Summary request: url={}", request.url());

    SummaryJob job = new SummaryJob(jobId, request.url(), request.toOverrides());
    jobRepository.save(job);
    LOGGER.info("Created async summary job: {}", jobId);

    try {
      jobRunner.run(job);
    } catch (TaskRejectedException e) {
      jobRepository.delete(jobId);
      throw e;
    }
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
  }

  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async summary job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @DeleteMapping("/api/jobs/{id}")
  @Operation(
      summary = "Cancel job",
      description = "Request cancellation; the job stops at its next stage boundary")
  public ResponseEntity<JobStatusResponse> cancelJob(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job -> {
              if (job.getSignal().cancel()) {
                LOGGER.info("Cancellation requested for job: {}", id);
              }
              return ResponseEntity.accepted().body(JobStatusResponse.from(job));
            })
        .orElse(ResponseEntity.notFound().build());
  }

  /**
   * Run the pipeline and stream its progress.
   *
   * <p>Each event is named after its stage and carries the JSON status. The stream ends after the
   * {@code complete} or {@code error} event. Closing the connection cancels the run.
   */
  @GetMapping(value = "/api/summaries/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(
      summary = "Summarize with live progress",
      description = "Server-sent events, one JSON status per pipeline stage")
  public SseEmitter stream(@Valid @ModelAttribute SummaryRequest request) {
    SseEmitter emitter = new SseEmitter(Duration.ofMinutes(sse.timeoutMinutes()).toMillis());
    CancellationSignal signal = CancellationSignal.create();
    SseProgressSink sink = new SseProgressSink(emitter, sse.queueCapacity(), signal);

    streamExecutor.execute(sink::drain);
    try {
      jobExecutor.execute(
          () -> {
            try {
              pipeline.run(request.url(), request.toOverrides(), sink, signal);
            } catch (RuntimeException e) {
              // already reported to the client as an error event
              LOGGER.debug("Streamed run ended with failure: {}", e.getMessage());
            } finally {
              sink.finish();
            }
          });
    } catch (TaskRejectedException e) {
      LOGGER.warn("Rejected streamed run, executor saturated: url={}", request.url());
      sink.accept(ProcessingStatus.error("Processing failed", "Server is busy, try again later"));
      sink.finish();
    }
    return emitter;
  }

  @GetMapping("/api/summaries/{id}")
  @Operation(
      summary = "Get stored result",
      description = "Stored summary for an episode id or source URL")
  public EpisodeResult getResult(@PathVariable String id) {
    return queryService.getResult(id);
  }

  @GetMapping("/api/summaries/{id}/audio")
  @Operation(summary = "Download summary audio")
  public ResponseEntity<InputStreamResource> getSummaryAudio(@PathVariable String id) {
    return audio(queryService.openSummaryAudio(id));
  }

  @GetMapping("/api/episodes/{id}/audio")
  @Operation(summary = "Download original episode audio")
  public ResponseEntity<InputStreamResource> getEpisodeAudio(@PathVariable String id) {
    return audio(queryService.openEpisodeAudio(id));
  }

  private static ResponseEntity<InputStreamResource> audio(AudioContent content) {
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType("audio/mpeg"))
        .contentLength(content.contentLength())
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(content.fileName()).build().toString())
        .body(new InputStreamResource(content.stream()));
  }
}
