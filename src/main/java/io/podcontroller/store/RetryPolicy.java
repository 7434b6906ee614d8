package io.podcontroller.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.etcd.jetcd.common.exception.EtcdException;
import io.grpc.StatusRuntimeException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Bounded retry around coordination store calls. A classifier decides which failures are
 * transient; permanent failures and {@link StoreException}s surface on the first attempt.
 * When the attempts run out the last failure is wrapped in a {@link StoreException}.
 */
@Slf4j
@Getter
public class RetryPolicy {

    private final int maxAttempts;
    private final Predicate<Throwable> isTransient;

    public RetryPolicy(int maxAttempts) {
        this(maxAttempts, RetryPolicy::isTransientStoreFailure);
    }

    public RetryPolicy(int maxAttempts, Predicate<Throwable> isTransient) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.isTransient = isTransient;
    }

    /**
     * Store operation that may fail.
     */
    @FunctionalInterface
    public interface StoreCall<T> {
        T call() throws Exception;
    }

    /**
     * Store operation without a result.
     */
    @FunctionalInterface
    public interface StoreAction {
        void run() throws Exception;
    }

    public <T> T call(String description, StoreCall<T> operation) throws StoreException {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.call();
            } catch (StoreException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StoreException("Interrupted during " + description, e);
            } catch (Exception e) {
                if (!isTransient.test(e)) {
                    throw new StoreException("Failed to " + description + ": " + e.getMessage(), e);
                }
                lastFailure = e;
                log.debug("Attempt {}/{} to {} failed: {}", attempt, maxAttempts, description, e.getMessage());
            }
        }
        log.warn("Giving up on {} after {} attempts: {}", description, maxAttempts, lastFailure.getMessage());
        throw new StoreException("Failed to " + description + " after " + maxAttempts + " attempts", lastFailure);
    }

    public void run(String description, StoreAction action) throws StoreException {
        call(description, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Default classification: connectivity problems, timeouts and lost compare-and-swap races
     * are worth another attempt.
     */
    public static boolean isTransientStoreFailure(Throwable t) {
        if (t instanceof StoreException) {
            return false;
        }
        if (t instanceof ExecutionException && t.getCause() != null) {
            return isTransientStoreFailure(t.getCause());
        }
        return t instanceof TimeoutException
            || t instanceof StaleRevisionException
            || (t instanceof IOException && !(t instanceof JsonProcessingException))
            || t instanceof StatusRuntimeException
            || t instanceof EtcdException;
    }
}
