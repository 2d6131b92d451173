package io.caresync.spi;

/**
 * Unchecked exception wrapping JDBC errors raised by store implementations and by
 * the transactions the core opens around them.
 */
public final class CareStoreException extends RuntimeException {
    public CareStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
