package io.podcontroller.store;

/**
 * The addressed record does not exist.
 */
public class NotFoundException extends StoreException {

    public NotFoundException(String message) {
        super(message);
    }
}
