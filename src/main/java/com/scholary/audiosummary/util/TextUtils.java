package com.scholary.audiosummary.util;

/** Small text helpers shared by the summarizer, the pipeline and the query layer. */
public final class TextUtils {

  private TextUtils() {}

  /**
   * Count words by splitting on whitespace and discarding empty tokens.
   *
   * @param text the text to count, may be null
   * @return the number of words, 0 for null or blank text
   */
  public static int countWords(String text) {
    if (text == null) {
      return 0;
    }
    int count = 0;
    for (String token : text.split("\\s+")) {
      if (!token.isEmpty()) {
        count++;
      }
    }
    return count;
  }

  /**
   * Trim leading and trailing characters that are neither letters nor digits.
   *
   * <p>Model output often arrives wrapped in quotes, markdown rules or stray punctuation. This is
   * presentation trimming only; stored artifacts keep the text exactly as produced.
   */
  public static String trimNonAlphanumeric(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    int start = 0;
    while (start < text.length() && !Character.isLetterOrDigit(text.charAt(start))) {
      start++;
    }
    int end = text.length() - 1;
    while (end >= start && !Character.isLetterOrDigit(text.charAt(end))) {
      end--;
    }
    return start <= end ? text.substring(start, end + 1) : "";
  }
}
