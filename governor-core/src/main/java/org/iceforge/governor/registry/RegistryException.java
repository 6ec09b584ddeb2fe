package org.iceforge.governor.registry;

/**
 * Failure talking to a job or artifact registry.
 */
public class RegistryException extends RuntimeException {
    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RegistryException(String message) {
        super(message);
    }
}
