package io.caresync.sync;

/**
 * The external calendar rejected the access token or the refresh credential.
 * Fatal to the sync link until the user re-authorizes.
 */
public class SyncCredentialException extends SyncException {

  public SyncCredentialException(String message) {
    super(message);
  }

  public SyncCredentialException(String message, Throwable cause) {
    super(message, cause);
  }
}
