package com.scholary.audiosummary.api;

import com.scholary.audiosummary.pipeline.CancellationSignal;
import com.scholary.audiosummary.pipeline.ProcessingStatus;
import com.scholary.audiosummary.pipeline.ProgressSink;
import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Progress sink that forwards events to a server-sent event stream.
 *
 * <p>The pipeline thread only offers to a bounded queue; {@link #drain()} runs on another thread
 * and writes events to the client in order. A client that disconnects, times out, or falls so far
 * behind that the queue fills up is dropped, and the run it was watching is cancelled.
 */
class SseProgressSink implements ProgressSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(SseProgressSink.class);
  private static final long POLL_MILLIS = 200;

  private final SseEmitter emitter;
  private final BlockingQueue<ProcessingStatus> queue;
  private final CancellationSignal signal;
  private final AtomicBoolean dropped = new AtomicBoolean();
  private final AtomicLong sequence = new AtomicLong();
  private volatile boolean producerDone;
  private volatile boolean terminalSent;

  SseProgressSink(SseEmitter emitter, int queueCapacity, CancellationSignal signal) {
    this.emitter = emitter;
    this.queue = new ArrayBlockingQueue<>(queueCapacity);
    this.signal = signal;
    emitter.onTimeout(() -> drop("stream timed out"));
    emitter.onError(e -> drop("stream error: " + e.getMessage()));
    emitter.onCompletion(() -> drop("stream closed"));
  }

  @Override
  public void accept(ProcessingStatus status) {
    if (dropped.get()) {
      return;
    }
    if (!queue.offer(status)) {
      drop("client is not keeping up");
    }
  }

  /** Called once the pipeline has returned; the drain loop stops when the queue is empty. */
  void finish() {
    producerDone = true;
  }

  /** Write queued events to the client until a terminal event is sent or the client is gone. */
  void drain() {
    try {
      while (!dropped.get()) {
        ProcessingStatus status = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (status == null) {
          if (producerDone && queue.isEmpty()) {
            break;
          }
          continue;
        }
        if (!send(status)) {
          return;
        }
        if (status.stage().isTerminal()) {
          terminalSent = true;
          break;
        }
      }
      emitter.complete();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      drop("interrupted");
      emitter.complete();
    }
  }

  boolean isDropped() {
    return dropped.get();
  }

  private boolean send(ProcessingStatus status) {
    try {
      emitter.send(
          SseEmitter.event()
              .id(String.valueOf(sequence.incrementAndGet()))
              .name(status.stage().tag())
              .data(status, MediaType.APPLICATION_JSON));
      return true;
    } catch (IOException | IllegalStateException e) {
      drop("send failed: " + e.getMessage());
      emitter.completeWithError(e);
      return false;
    }
  }

  private void drop(String reason) {
    if (terminalSent || !dropped.compareAndSet(false, true)) {
      return;
    }
    queue.clear();
    if (signal.cancel()) {
      LOGGER.info("Cancelling streamed run: {}", reason);
    }
  }
}
