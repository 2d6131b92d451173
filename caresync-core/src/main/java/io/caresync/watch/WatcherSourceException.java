package io.caresync.watch;

/**
 * A hospital booking source could not be queried. Retried with backoff by the
 * {@link WatcherSupervisor}.
 */
public class WatcherSourceException extends Exception {

  public WatcherSourceException(String message) {
    super(message);
  }

  public WatcherSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
