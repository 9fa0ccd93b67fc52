package com.scholary.audiosummary.pipeline;

/**
 * Receives progress events in emission order.
 *
 * <p>Called on the pipeline's thread, so implementations must return quickly and must not throw.
 * A sink that feeds a slow consumer should queue with a bound and drop the consumer, not the
 * pipeline.
 */
@FunctionalInterface
public interface ProgressSink {

  ProgressSink NONE = status -> {};

  void accept(ProcessingStatus status);
}
