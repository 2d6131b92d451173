package io.caresync.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 *
 * <p>Delay is {@code baseDelay * 2^(attempt-1)} capped at {@code maxDelay}, multiplied
 * by a random jitter factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, true);
  }

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  upper bound of any delay (milliseconds)
   * @param jitter      whether to randomize delays
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long expDelay;
    if (attempts >= 31) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempts - 1);
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (!jitter) {
      return capped;
    }
    long withJitter = (long) (capped * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    return Math.min(maxDelayMs, Math.max(0L, withJitter));
  }
}
