package io.podcontroller.store;

/**
 * Invalid input, rejected before the store is contacted.
 */
public class ValidationException extends StoreException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
