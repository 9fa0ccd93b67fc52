package com.scholary.audiosummary.capability;

import com.scholary.audiosummary.pipeline.CancellationSignal;

/** Text summarization backend (a chat completion model). */
@FunctionalInterface
public interface SummarizationCapability {

  /**
   * Run one summarization call.
   *
   * @param instructions system instructions describing the kind of summary wanted
   * @param prompt the user message, carrying the text to summarize or compress
   * @param targetWords the length the result should aim for
   * @param signal cancels the in-flight call when fired
   * @return the model's text
   */
  String summarize(String instructions, String prompt, int targetWords, CancellationSignal signal);
}
