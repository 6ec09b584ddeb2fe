package org.iceforge.governor.retention;

/**
 * Unexpected failure of a whole retention cycle, as opposed to a single failed deletion.
 */
public class RetentionException extends RuntimeException {
    public RetentionException(String message, Throwable cause) {
        super(message, cause);
    }
}
