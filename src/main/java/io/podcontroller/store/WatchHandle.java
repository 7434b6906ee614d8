package io.podcontroller.store;

/**
 * Handle on a running watch. Closing it stops further notifications.
 */
@FunctionalInterface
public interface WatchHandle extends AutoCloseable {

    @Override
    void close();
}
