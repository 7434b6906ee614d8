package io.podcontroller.store;

/**
 * Failure of a coordination store operation. Raised as-is when a transient failure
 * outlasts the retry budget; subclasses describe permanent failures that are never retried.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
