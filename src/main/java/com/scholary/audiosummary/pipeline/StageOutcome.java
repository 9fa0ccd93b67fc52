package com.scholary.audiosummary.pipeline;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Result of one pipeline stage: a value or the exception that ended the stage.
 *
 * <p>Stages never let an exception escape on their own; the orchestrator inspects the outcome and
 * does the reporting in one place.
 */
public final class StageOutcome<T> {

  private final T value;
  private final RuntimeException failure;

  private StageOutcome(T value, RuntimeException failure) {
    this.value = value;
    this.failure = failure;
  }

  public static <T> StageOutcome<T> success(T value) {
    return new StageOutcome<>(value, null);
  }

  public static <T> StageOutcome<T> failure(RuntimeException failure) {
    return new StageOutcome<>(null, Objects.requireNonNull(failure, "failure"));
  }

  /** Run {@code work} and capture its value or its runtime exception. */
  public static <T> StageOutcome<T> attempt(Supplier<T> work) {
    try {
      return success(work.get());
    } catch (RuntimeException e) {
      return failure(e);
    }
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public T value() {
    if (failure != null) {
      throw new IllegalStateException("Stage failed", failure);
    }
    return value;
  }

  public RuntimeException failure() {
    if (failure == null) {
      throw new IllegalStateException("Stage succeeded");
    }
    return failure;
  }
}
