package com.scholary.audiosummary.pipeline;

import com.scholary.audiosummary.error.PipelineCancelledException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation flag threaded through one pipeline run.
 *
 * <p>Stages check it before scheduling new work. Code that holds a cancellable resource (an
 * in-flight HTTP exchange) registers a callback with {@link #onCancel} and closes the returned
 * {@link Registration} once the resource is done. Thread-safe; cancelling twice is a no-op.
 */
public final class CancellationSignal {

  private static final Logger LOGGER = LoggerFactory.getLogger(CancellationSignal.class);

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Callback> callbacks = new CopyOnWriteArrayList<>();

  /** A fresh signal that is cancelled only if somebody calls {@link #cancel()} on it. */
  public static CancellationSignal create() {
    return new CancellationSignal();
  }

  /**
   * Cancel the run and fire the registered callbacks.
   *
   * @return true if this call cancelled the signal, false if it was already cancelled
   */
  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    for (Callback callback : callbacks) {
      callback.fire();
    }
    return true;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Throw if the signal has been cancelled.
   *
   * @param activity what was about to start, used in the exception message
   * @throws PipelineCancelledException if cancelled
   */
  public void throwIfCancelled(String activity) {
    if (cancelled.get()) {
      throw new PipelineCancelledException("Processing was cancelled before " + activity);
    }
  }

  /**
   * Register an action to run on cancellation. Runs immediately if already cancelled.
   *
   * @return a registration that removes the action when closed
   */
  public Registration onCancel(Runnable action) {
    Callback callback = new Callback(action);
    callbacks.add(callback);
    if (cancelled.get()) {
      callback.fire();
    }
    return () -> callbacks.remove(callback);
  }

  /** Handle for a registered cancel action. Closing it never throws. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }

  private static final class Callback {
    private final Runnable action;
    private final AtomicBoolean fired = new AtomicBoolean();

    private Callback(Runnable action) {
      this.action = action;
    }

    private void fire() {
      if (!fired.compareAndSet(false, true)) {
        return;
      }
      try {
        action.run();
      } catch (RuntimeException e) {
        LOGGER.warn("Cancel callback failed: {}", e.getMessage(), e);
      }
    }
  }
}
