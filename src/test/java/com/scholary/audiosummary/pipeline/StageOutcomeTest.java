package com.scholary.audiosummary.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audiosummary.error.StorageFailedException;
import org.junit.jupiter.api.Test;

class StageOutcomeTest {

  @Test
  void attempt_shouldCaptureValue() {
    StageOutcome<String> outcome = StageOutcome.attempt(() -> "done");

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.value()).isEqualTo("done");
    assertThatThrownBy(outcome::failure).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void attempt_shouldCaptureRuntimeException() {
    StorageFailedException failure = new StorageFailedException("disk full");

    StageOutcome<String> outcome =
        StageOutcome.attempt(
            () -> {
              throw failure;
            });

    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.failure()).isSameAs(failure);
    assertThatThrownBy(outcome::value).hasCause(failure);
  }
}
