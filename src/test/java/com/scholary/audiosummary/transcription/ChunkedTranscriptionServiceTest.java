package com.scholary.audiosummary.transcription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audiosummary.TestProperties;
import com.scholary.audiosummary.capability.TranscriptionCapability;
import com.scholary.audiosummary.chunking.AudioSegmenter;
import com.scholary.audiosummary.chunking.FakeMediaToolkit;
import com.scholary.audiosummary.config.PipelineProperties;
import com.scholary.audiosummary.error.PipelineCancelledException;
import com.scholary.audiosummary.error.SegmentationFailedException;
import com.scholary.audiosummary.error.TranscriptionFailedException;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChunkedTranscriptionServiceTest {

  // 1000 bytes against a 100 byte limit; 60s chunks, so duration / 60 segments
  private static final long LIMIT = 100;

  @TempDir Path tempDir;

  private Path workDir;
  private Path source;
  private ExecutorService executor;

  @BeforeEach
  void setUp() throws Exception {
    workDir = Files.createDirectories(tempDir.resolve("work"));
    source = Files.write(Files.createDirectories(tempDir.resolve("in")).resolve("ep.mp3"), new byte[1000]);
    executor = Executors.newFixedThreadPool(12);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private ChunkedTranscriptionService service(double duration, int maxConcurrentCalls) {
    PipelineProperties properties = TestProperties.pipeline(workDir, LIMIT, maxConcurrentCalls);
    AudioSegmenter segmenter = new AudioSegmenter(new FakeMediaToolkit(duration), properties);
    return new ChunkedTranscriptionService(segmenter, properties, executor);
  }

  private static int indexOf(Path segment) {
    String name = segment.getFileName().toString();
    return Integer.parseInt(name.substring("chunk_".length(), name.indexOf('.')));
  }

  private long scratchEntries() throws Exception {
    try (Stream<Path> entries = Files.list(workDir)) {
      return entries.count();
    }
  }

  @Test
  void transcribe_shouldCallBackendOnceForSmallFile() {
    PipelineProperties properties = TestProperties.pipeline(workDir);
    FakeMediaToolkit toolkit = new FakeMediaToolkit(600);
    ChunkedTranscriptionService service =
        new ChunkedTranscriptionService(
            new AudioSegmenter(toolkit, properties), properties, executor);
    List<Path> calls = new CopyOnWriteArrayList<>();

    String text =
        service.transcribe(
            source,
            (file, signal) -> {
              calls.add(file);
              return "whole file";
            },
            CancellationSignal.create());

    assertThat(text).isEqualTo("whole file");
    assertThat(calls).containsExactly(source);
    assertThat(toolkit.probeCalls()).isZero();
  }

  @Test
  void transcribe_shouldTreatNullTextAsEmpty() {
    ChunkedTranscriptionService service =
        new ChunkedTranscriptionService(
            new AudioSegmenter(new FakeMediaToolkit(60), TestProperties.pipeline(workDir)),
            TestProperties.pipeline(workDir),
            executor);

    assertThat(service.transcribe(source, (file, signal) -> null, CancellationSignal.create()))
        .isEmpty();
  }

  @Test
  void transcribe_shouldJoinSegmentsInIndexOrderWhenTheyFinishInReverse() throws Exception {
    CountDownLatch[] finished = new CountDownLatch[4];
    for (int i = 0; i < finished.length; i++) {
      finished[i] = new CountDownLatch(1);
    }
    TranscriptionCapability reversed =
        (file, signal) -> {
          int index = indexOf(file);
          try {
            if (index < finished.length - 1) {
              // wait for the next segment, so the last one finishes first
              finished[index + 1].await(5, TimeUnit.SECONDS);
            }
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          finished[index].countDown();
          return "text-" + index;
        };

    String text = service(240, 4).transcribe(source, reversed, CancellationSignal.create());

    assertThat(text).isEqualTo("text-0 text-1 text-2 text-3");
    assertThat(scratchEntries()).isZero();
  }

  @Test
  void transcribe_shouldNeverExceedConcurrencyLimit() throws Exception {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();
    AtomicInteger calls = new AtomicInteger();
    TranscriptionCapability slow =
        (file, signal) -> {
          int now = inFlight.incrementAndGet();
          maxInFlight.accumulateAndGet(now, Math::max);
          try {
            Thread.sleep(50);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          } finally {
            inFlight.decrementAndGet();
          }
          calls.incrementAndGet();
          return "s" + indexOf(file);
        };

    String text = service(540, 3).transcribe(source, slow, CancellationSignal.create());

    assertThat(calls.get()).isEqualTo(9);
    assertThat(maxInFlight.get()).isBetween(1, 3);
    assertThat(text).isEqualTo("s0 s1 s2 s3 s4 s5 s6 s7 s8");
  }

  @Test
  void transcribe_shouldFailWholeFileAndRemoveScratchWhenOneSegmentFails() throws Exception {
    TranscriptionCapability failing =
        (file, signal) -> {
          if (indexOf(file) == 2) {
            throw new IllegalStateException("backend returned 500");
          }
          return "ok";
        };

    assertThatThrownBy(
            () -> service(300, 2).transcribe(source, failing, CancellationSignal.create()))
        .isInstanceOf(TranscriptionFailedException.class)
        .hasMessageContaining("backend returned 500")
        .hasCauseInstanceOf(IllegalStateException.class);
    assertThat(scratchEntries()).isZero();
  }

  @Test
  void transcribe_shouldStopSchedulingAndRemoveScratchWhenCancelled() throws Exception {
    CancellationSignal signal = CancellationSignal.create();
    AtomicInteger calls = new AtomicInteger();
    TranscriptionCapability cancelling =
        (file, s) -> {
          calls.incrementAndGet();
          signal.cancel();
          return "partial";
        };

    assertThatThrownBy(() -> service(300, 1).transcribe(source, cancelling, signal))
        .isInstanceOf(PipelineCancelledException.class);
    assertThat(calls.get()).isEqualTo(1);
    assertThat(scratchEntries()).isZero();
  }

  @Test
  void transcribe_shouldRemoveScratchWhenSegmentationFails() throws Exception {
    PipelineProperties properties = TestProperties.pipeline(workDir, LIMIT, 2);
    ChunkedTranscriptionService service =
        new ChunkedTranscriptionService(
            new AudioSegmenter(new FakeMediaToolkit(300, 1), properties), properties, executor);

    assertThatThrownBy(
            () -> service.transcribe(source, (file, s) -> "never", CancellationSignal.create()))
        .isInstanceOf(SegmentationFailedException.class);
    assertThat(scratchEntries()).isZero();
  }

  @Test
  void transcribe_shouldWaitForSubmittedSegmentsWhenExecutorRejects() throws Exception {
    CountDownLatch started = new CountDownLatch(2);
    AtomicInteger submitted = new AtomicInteger();
    Executor saturated =
        task -> {
          if (submitted.incrementAndGet() > 2) {
            try {
              // reject only once the accepted segments are inside the backend
              started.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            throw new RejectedExecutionException("queue full");
          }
          executor.execute(task);
        };
    List<Boolean> segmentPresent = new CopyOnWriteArrayList<>();
    TranscriptionCapability slow =
        (file, signal) -> {
          started.countDown();
          try {
            Thread.sleep(200);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          segmentPresent.add(Files.exists(file));
          return "ok";
        };
    PipelineProperties properties = TestProperties.pipeline(workDir, LIMIT, 4);
    ChunkedTranscriptionService service =
        new ChunkedTranscriptionService(
            new AudioSegmenter(new FakeMediaToolkit(300), properties), properties, saturated);

    assertThatThrownBy(() -> service.transcribe(source, slow, CancellationSignal.create()))
        .isInstanceOf(TranscriptionFailedException.class)
        .hasMessageContaining("rejected segment 2")
        .hasCauseInstanceOf(RejectedExecutionException.class);

    // both accepted segments finished before the scratch directory went away
    assertThat(segmentPresent).containsExactly(true, true);
    assertThat(submitted.get()).isEqualTo(3);
    assertThat(scratchEntries()).isZero();
  }
}
