package io.caresync.sync;

/**
 * Network or timeout failure. Retried with backoff; schedule and link state are
 * left unchanged while the retry budget lasts.
 */
public class SyncTransientException extends SyncException {

  public SyncTransientException(String message) {
    super(message);
  }

  public SyncTransientException(String message, Throwable cause) {
    super(message, cause);
  }
}
