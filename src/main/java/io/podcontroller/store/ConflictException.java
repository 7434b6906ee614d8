package io.podcontroller.store;

/**
 * The record exists but is in a state that forbids the operation.
 */
public class ConflictException extends StoreException {

    public ConflictException(String message) {
        super(message);
    }
}
