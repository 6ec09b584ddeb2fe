package org.iceforge.governor.query;

/**
 * The query engine failed, or the result did not arrive in time. Delivered to every caller
 * waiting on the same key.
 */
public class ComputeFailureException extends RuntimeException {
    private final String key;

    public ComputeFailureException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
