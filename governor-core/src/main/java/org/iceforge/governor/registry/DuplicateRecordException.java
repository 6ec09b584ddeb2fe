package org.iceforge.governor.registry;

/** A job or artifact id that is already registered. */
public class DuplicateRecordException extends RegistryException {

    public DuplicateRecordException(String message) {
        super(message);
    }
}
