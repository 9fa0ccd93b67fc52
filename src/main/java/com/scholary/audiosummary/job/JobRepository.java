package com.scholary.audiosummary.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.audiosummary.config.PipelineProperties;
import java.time.Duration;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for summary jobs.
 *
 * <p>Uses a Caffeine cache so finished jobs are evicted by size and age. Job state is not durable;
 * the stored artifacts are, and a resubmitted URL is served from them.
 */
@Repository
public class JobRepository {

  private final Cache<String, SummaryJob> cache;

  public JobRepository(PipelineProperties properties) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.jobs().maxSize())
            .expireAfterWrite(Duration.ofMinutes(properties.jobs().expireAfterMinutes()))
            .build();
  }

  public void save(SummaryJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<SummaryJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
