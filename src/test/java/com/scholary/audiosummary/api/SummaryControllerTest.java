package com.scholary.audiosummary.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.audiosummary.TestProperties;
import com.scholary.audiosummary.capability.ProviderOverrides;
import com.scholary.audiosummary.error.NotFoundException;
import com.scholary.audiosummary.job.JobRepository;
import com.scholary.audiosummary.job.SummaryJob;
import com.scholary.audiosummary.job.SummaryJobRunner;
import com.scholary.audiosummary.pipeline.SummaryPipeline;
import com.scholary.audiosummary.query.AudioContent;
import com.scholary.audiosummary.query.EpisodeResult;
import com.scholary.audiosummary.query.SummaryQueryService;
import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SummaryControllerTest {

  @Mock private SummaryPipeline pipeline;
  @Mock private SummaryJobRunner jobRunner;
  @Mock private SummaryQueryService queryService;

  @TempDir Path tempDir;

  private JobRepository jobRepository;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    jobRepository = new JobRepository(TestProperties.pipeline(tempDir));
    SummaryController controller =
        new SummaryController(
            pipeline,
            jobRunner,
            jobRepository,
            queryService,
            Runnable::run,
            Runnable::run,
            TestProperties.pipeline(tempDir));
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
  }

  @Test
  void submit_shouldCreateJobAndReturnAccepted() throws Exception {
    mockMvc
        .perform(
            post("/api/summaries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"https://example.com/a.mp3\"}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").isNotEmpty())
        .andExpect(jsonPath("$.statusUrl").value(startsWith("/api/jobs/")));

    verify(jobRunner).run(any(SummaryJob.class));
  }

  @Test
  void submit_shouldRejectMissingUrl() throws Exception {
    mockMvc
        .perform(post("/api/summaries").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

    verify(jobRunner, never()).run(any());
  }

  @Test
  void submit_shouldRejectSpeechSpeedOutOfRange() throws Exception {
    mockMvc
        .perform(
            post("/api/summaries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"https://example.com/a.mp3\",\"speechSpeed\":9.0}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void submit_shouldReturnServiceUnavailableWhenSaturated() throws Exception {
    doThrow(new TaskRejectedException("queue full")).when(jobRunner).run(any());

    mockMvc
        .perform(
            post("/api/summaries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"https://example.com/a.mp3\"}"))
        .andExpect(status().isServiceUnavailable());
  }

  @Test
  void getJobStatus_shouldReportProgress() throws Exception {
    SummaryJob job = new SummaryJob("job-1", "https://example.com/a.mp3", ProviderOverrides.NONE);
    job.setStage("transcribing");
    job.setProgress(25);
    jobRepository.save(job);

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.stage").value("transcribing"))
        .andExpect(jsonPath("$.progress").value(25));

    mockMvc.perform(get("/api/jobs/unknown")).andExpect(status().isNotFound());
  }

  @Test
  void cancelJob_shouldSignalRun() throws Exception {
    SummaryJob job = new SummaryJob("job-2", "https://example.com/a.mp3", ProviderOverrides.NONE);
    jobRepository.save(job);

    mockMvc.perform(delete("/api/jobs/job-2")).andExpect(status().isAccepted());

    assertThat(job.getSignal().isCancelled()).isTrue();
  }

  @Test
  void getResult_shouldReturnStoredSummary() throws Exception {
    when(queryService.getResult("k"))
        .thenReturn(
            new EpisodeResult(
                "k", "https://example.com/a.mp3", true, "Summary", 100, 1, Instant.now(),
                "/api/summaries/k/audio"));

    mockMvc
        .perform(get("/api/summaries/k"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.summaryAvailable").value(true))
        .andExpect(jsonPath("$.summaryAudioPath").value("/api/summaries/k/audio"));
  }

  @Test
  void getResult_shouldMapNotFound() throws Exception {
    when(queryService.getResult("missing")).thenThrow(new NotFoundException("Episode not found"));

    mockMvc
        .perform(get("/api/summaries/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void getSummaryAudio_shouldStreamAttachment() throws Exception {
    when(queryService.openSummaryAudio("k"))
        .thenReturn(
            new AudioContent("k_summary.mp3", 3, new ByteArrayInputStream(new byte[] {1, 2, 3})));

    mockMvc
        .perform(get("/api/summaries/k/audio"))
        .andExpect(status().isOk())
        .andExpect(content().contentType("audio/mpeg"))
        .andExpect(
            header()
                .string("Content-Disposition", "attachment; filename=\"k_summary.mp3\""))
        .andExpect(content().bytes(new byte[] {1, 2, 3}));
  }
}
