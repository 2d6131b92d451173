package io.caresync.retry;

/**
 * Strategy for computing the delay before retrying a failed remote call.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay before the next attempt.
   *
   * @param attempts the number of failed attempts so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);
}
