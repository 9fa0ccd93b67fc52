package com.scholary.audiosummary.summary;

/** Prompt text for the summarize and compress passes. */
final class SummaryPrompts {

  static final int WORDS_PER_MINUTE = 150;

  private SummaryPrompts() {}

  static String summarizeInstructions(int targetWords) {
    return String.join(
        "\n",
        "You write audio summaries that are read aloud, so they must sound natural when spoken.",
        "",
        String.format(
            "Condense the content into about %d minutes of narration: no more than %d words at"
                + " %d words per minute. The word limit is strict.",
            minutes(targetWords), targetWords, WORDS_PER_MINUTE),
        "",
        "- Keep every salient point, key insight, main argument and takeaway.",
        "- Keep a logical order; open with a short introduction and end with a brief conclusion.",
        "- Use plain conversational language and drop filler, pleasantries and tangents.",
        "- When there is more material than fits, put the most useful information first.",
        "- Link sections with spoken transitions such as \"Moving on to...\" or"
            + " \"Another key point is...\".",
        "",
        "The result goes straight to text-to-speech with no further editing.");
  }

  static String summarizePrompt(String transcript, int targetWords) {
    return String.format(
        "Summarize this transcript into about %d minutes of spoken content (%d words or fewer),"
            + " keeping all important points.%n%nTranscript:%n%s%n%nSummary:",
        minutes(targetWords), targetWords, transcript);
  }

  static String compressInstructions(int targetWords) {
    return String.format(
        "You are an editor who shortens text without losing meaning. Reduce the text to at most"
            + " %d words and keep all critical information.",
        targetWords);
  }

  static String compressPrompt(String summary, int targetWords) {
    return String.format(
        "This summary is too long for its narration slot. Compress it to %d words or fewer,"
            + " keep ALL key points and keep it flowing naturally when read aloud.%n%n"
            + "Summary:%n%s%n%nCompressed summary:",
        targetWords, summary);
  }

  private static long minutes(int targetWords) {
    return Math.max(1, Math.round((double) targetWords / WORDS_PER_MINUTE));
  }
}
