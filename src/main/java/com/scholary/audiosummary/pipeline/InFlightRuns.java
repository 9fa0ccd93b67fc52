package com.scholary.audiosummary.pipeline;

import com.scholary.audiosummary.error.PipelineCancelledException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks runs in progress by cache key so concurrent requests for one source share a single run.
 *
 * <p>The first caller for a key becomes the owner and does the work. Later callers join: they
 * wait for the owner's result. A joiner that is cancelled stops waiting; the owner carries on. An
 * owner that is cancelled fails its joiners with a cancellation; a joiner whose own signal is still
 * live may then claim the key again.
 */
@Component
public class InFlightRuns {

  private static final Logger LOGGER = LoggerFactory.getLogger(InFlightRuns.class);

  private final ConcurrentMap<String, CompletableFuture<PipelineResult>> runs =
      new ConcurrentHashMap<>();

  /** Register as owner of {@code cacheKey}, or join the run that already owns it. */
  public Claim claim(String cacheKey) {
    CompletableFuture<PipelineResult> mine = new CompletableFuture<>();
    CompletableFuture<PipelineResult> existing = runs.putIfAbsent(cacheKey, mine);
    if (existing != null) {
      LOGGER.info("Joining in-flight run: cacheKey={}", cacheKey);
      return new Claim(cacheKey, existing, false);
    }
    return new Claim(cacheKey, mine, true);
  }

  public int size() {
    return runs.size();
  }

  /** Ownership of, or a seat in, one in-flight run. Owners must close it when the run ends. */
  public final class Claim implements AutoCloseable {

    private final String cacheKey;
    private final CompletableFuture<PipelineResult> future;
    private final boolean owner;

    private Claim(String cacheKey, CompletableFuture<PipelineResult> future, boolean owner) {
      this.cacheKey = cacheKey;
      this.future = future;
      this.owner = owner;
    }

    public boolean isOwner() {
      return owner;
    }

    public void complete(PipelineResult result) {
      future.complete(result);
    }

    /** Fail the run. The key is released first so a woken joiner can claim it straight away. */
    public void fail(Throwable failure) {
      runs.remove(cacheKey, future);
      future.completeExceptionally(failure);
    }

    /**
     * Wait for the owner's result.
     *
     * @throws PipelineCancelledException if {@code signal} fires first
     * @throws RuntimeException the owner's failure, unchanged
     */
    public PipelineResult await(CancellationSignal signal) {
      // a dependent stage, so cancelling it leaves the owner's future alone
      CompletableFuture<PipelineResult> waiter = future.thenApply(Function.identity());
      try (CancellationSignal.Registration registration =
          signal.onCancel(() -> waiter.cancel(false))) {
        return waiter.join();
      } catch (CancellationException e) {
        throw new PipelineCancelledException("Stopped waiting for in-flight run of " + cacheKey, e);
      } catch (CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        throw new IllegalStateException("In-flight run failed", cause);
      }
    }

    @Override
    public void close() {
      if (!owner) {
        return;
      }
      if (!future.isDone()) {
        future.completeExceptionally(new IllegalStateException("Run ended without a result"));
      }
      runs.remove(cacheKey, future);
    }
  }
}
