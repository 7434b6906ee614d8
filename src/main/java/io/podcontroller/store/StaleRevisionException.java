package io.podcontroller.store;

/**
 * A compare-and-swap lost against a concurrent writer. Transient: the read-modify-write is
 * repeated by {@link RetryPolicy}.
 */
public class StaleRevisionException extends RuntimeException {

    public StaleRevisionException(String key) {
        super("Concurrent modification of " + key);
    }
}
