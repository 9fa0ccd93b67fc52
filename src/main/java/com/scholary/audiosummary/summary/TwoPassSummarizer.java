package com.scholary.audiosummary.summary;

import com.scholary.audiosummary.capability.SummarizationCapability;
import com.scholary.audiosummary.config.PipelineProperties;
import com.scholary.audiosummary.error.AudioSummaryException;
import com.scholary.audiosummary.error.SummarizationFailedException;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import com.scholary.audiosummary.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces a narration-length summary of a transcript.
 *
 * <p>One call asks for {@code targetWords}. If the answer is longer than {@code targetWords +
 * toleranceWords}, exactly one compression call follows and its answer is accepted whatever its
 * length. The text is returned untrimmed.
 */
@Service
public class TwoPassSummarizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TwoPassSummarizer.class);

  private final int targetWords;
  private final int compressionThreshold;

  public TwoPassSummarizer(PipelineProperties properties) {
    this.targetWords = properties.summary().targetWords();
    this.compressionThreshold = properties.summary().compressionThreshold();
  }

  public String summarize(
      String transcript, SummarizationCapability capability, CancellationSignal signal) {
    LOGGER.info(
        "Starting summarization: transcriptChars={}, targetWords={}",
        transcript.length(),
        targetWords);

    signal.throwIfCancelled("summarization");
    String summary =
        call(
            capability,
            SummaryPrompts.summarizeInstructions(targetWords),
            SummaryPrompts.summarizePrompt(transcript, targetWords),
            signal);

    int words = TextUtils.countWords(summary);
    LOGGER.info("Summarization completed: chars={}, words={}", summary.length(), words);

    if (words <= compressionThreshold) {
      return summary;
    }

    LOGGER.warn("Summary exceeded target length ({} words), compressing", words);
    signal.throwIfCancelled("summary compression");
    String compressed =
        call(
            capability,
            SummaryPrompts.compressInstructions(targetWords),
            SummaryPrompts.compressPrompt(summary, targetWords),
            signal);
    LOGGER.info("Compression completed: words={}", TextUtils.countWords(compressed));
    return compressed;
  }

  private String call(
      SummarizationCapability capability,
      String instructions,
      String prompt,
      CancellationSignal signal) {
    String text;
    try {
      text = capability.summarize(instructions, prompt, targetWords, signal);
    } catch (AudioSummaryException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SummarizationFailedException("Summarization failed: " + e.getMessage(), e);
    }
    if (text == null) {
      throw new SummarizationFailedException("Summarization returned no text");
    }
    return text;
  }
}
