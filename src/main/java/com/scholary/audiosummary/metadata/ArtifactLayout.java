package com.scholary.audiosummary.metadata;

/**
 * Object keys for every artifact stored per cache key.
 *
 * <pre>
 *   episodes/{key}.mp3                 downloaded source audio
 *   transcripts/{key}_transcript.txt   full transcript
 *   transcripts/{key}_summary.txt      summary text
 *   summaries/{key}_summary.mp3        synthesized summary audio
 *   metadata/episodes/{key}.json       EpisodeRecord
 *   metadata/summaries/{key}.json      SummaryRecord
 * </pre>
 */
public final class ArtifactLayout {

  private ArtifactLayout() {}

  public static String episodeAudio(String cacheKey) {
    return "episodes/" + cacheKey + ".mp3";
  }

  public static String transcript(String cacheKey) {
    return "transcripts/" + cacheKey + "_transcript.txt";
  }

  public static String summaryText(String cacheKey) {
    return "transcripts/" + cacheKey + "_summary.txt";
  }

  public static String summaryAudio(String cacheKey) {
    return "summaries/" + cacheKey + "_summary.mp3";
  }

  public static String episodeRecord(String cacheKey) {
    return "metadata/episodes/" + cacheKey + ".json";
  }

  public static String summaryRecord(String cacheKey) {
    return "metadata/summaries/" + cacheKey + ".json";
  }
}
