package com.scholary.audiosummary.transcription;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/** One acquired semaphore permit, returned exactly once on close. */
final class PermitLease implements AutoCloseable {

  private final Semaphore semaphore;
  private final AtomicBoolean released = new AtomicBoolean();

  private PermitLease(Semaphore semaphore) {
    this.semaphore = semaphore;
  }

  static PermitLease acquire(Semaphore semaphore) throws InterruptedException {
    semaphore.acquire();
    return new PermitLease(semaphore);
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      semaphore.release();
    }
  }
}
