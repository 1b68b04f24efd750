package com.scholary.textextractor.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for extraction jobs.
 *
 * <p>Backed by a Caffeine cache bounded by {@code jobstore.maxSize}. A pending or running job never
 * expires, so a long extraction cannot vanish while a client is polling it. Once a job is saved in
 * a finished state, its entry (and with it the chunk list of a completed run) expires {@code
 * jobstore.expireAfterMinutes} later.
 */
@Repository
public class JobRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRepository.class);

  private final Cache<String, ExtractionJob> cache;

  @Autowired
  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {
    this(maxSize, expireAfterMinutes, Ticker.systemTicker());
  }

  JobRepository(int maxSize, int expireAfterMinutes, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new FinishedJobExpiry(Duration.ofMinutes(expireAfterMinutes)))
            .ticker(ticker)
            .executor(Runnable::run)
            .removalListener(
                (String jobId, ExtractionJob job, RemovalCause cause) -> {
                  if (cause.wasEvicted()) {
                    LOGGER.debug("Evicted job: jobId={}, cause={}", jobId, cause);
                  }
                })
            .build();
  }

  public void save(ExtractionJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<ExtractionJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }

  /** Retention starts when a job is saved finished; unfinished jobs are kept until then. */
  private static final class FinishedJobExpiry implements Expiry<String, ExtractionJob> {

    private final long retentionNanos;

    FinishedJobExpiry(Duration retention) {
      this.retentionNanos = retention.toNanos();
    }

    @Override
    public long expireAfterCreate(String jobId, ExtractionJob job, long currentTime) {
      return lifetime(job);
    }

    @Override
    public long expireAfterUpdate(
        String jobId, ExtractionJob job, long currentTime, long currentDuration) {
      return lifetime(job);
    }

    @Override
    public long expireAfterRead(
        String jobId, ExtractionJob job, long currentTime, long currentDuration) {
      return currentDuration;
    }

    private long lifetime(ExtractionJob job) {
      return job.isFinished() ? retentionNanos : Long.MAX_VALUE;
    }
  }
}
