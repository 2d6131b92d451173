package io.caresync.sync;

/**
 * Failure of a call to the external calendar.
 *
 * @see SyncTransientException
 * @see SyncCredentialException
 */
public class SyncException extends Exception {

  public SyncException(String message) {
    super(message);
  }

  public SyncException(String message, Throwable cause) {
    super(message, cause);
  }
}
