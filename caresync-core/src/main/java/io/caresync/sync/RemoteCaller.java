package io.caresync.sync;

import io.caresync.retry.RetryPolicy;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs calendar calls with a per-attempt timeout and a bounded number of attempts.
 *
 * <p>Only {@link SyncTransientException}s and timeouts are retried. Credential failures
 * and other {@link SyncException}s propagate at once. A timed-out attempt is cancelled
 * with interruption before the next one starts.
 */
final class RemoteCaller {
  private static final Logger logger = Logger.getLogger(RemoteCaller.class.getName());

  @FunctionalInterface
  interface RemoteCall<T> {
    T call() throws SyncException;
  }

  private final ExecutorService executor;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final long timeoutMs;

  RemoteCaller(ExecutorService executor, RetryPolicy retryPolicy, int maxAttempts, long timeoutMs) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.maxAttempts = maxAttempts;
    this.timeoutMs = timeoutMs;
  }

  <T> T call(String operation, RemoteCall<T> remoteCall) throws SyncException, InterruptedException {
    SyncTransientException last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return attempt(operation, remoteCall);
      } catch (SyncTransientException e) {
        last = e;
        if (attempt < maxAttempts) {
          long delayMs = retryPolicy.computeDelayMs(attempt);
          logger.log(Level.FINE, "{0} failed (attempt {1}/{2}), retrying in {3}ms: {4}",
              new Object[]{operation, attempt, maxAttempts, delayMs, e.getMessage()});
          TimeUnit.MILLISECONDS.sleep(delayMs);
        }
      }
    }
    throw last;
  }

  private <T> T attempt(String operation, RemoteCall<T> remoteCall) throws SyncException, InterruptedException {
    Future<T> future = executor.submit(remoteCall::call);
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new SyncTransientException(operation + " timed out after " + timeoutMs + "ms", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof SyncException se) {
        throw se;
      }
      throw new SyncException(operation + " failed unexpectedly", cause);
    }
  }
}
