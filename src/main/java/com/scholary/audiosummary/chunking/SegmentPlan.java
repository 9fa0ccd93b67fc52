package com.scholary.audiosummary.chunking;

/**
 * One planned cut: where a segment starts in the source and how long it runs, in seconds.
 *
 * <p>Every segment but the first starts one overlap early and is one overlap longer, so a word
 * spoken at a boundary lands in both neighbours.
 */
public record SegmentPlan(int index, double start, double length) {

  public SegmentPlan {
    if (index < 0) {
      throw new IllegalArgumentException("Index cannot be negative");
    }
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (length <= 0) {
      throw new IllegalArgumentException("Length must be positive");
    }
  }

  public double end() {
    return start + length;
  }
}
