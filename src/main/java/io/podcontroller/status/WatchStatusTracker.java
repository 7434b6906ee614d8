package io.podcontroller.status;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.podcontroller.metrics.MetricsProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import static io.podcontroller.metrics.MetricsConstants.*;

/**
 * Counts consecutive errors per watch loop. Any successful pass resets the count to zero;
 * the last error text is kept for reporting. Counts are exported as gauges.
 */
@Slf4j
public class WatchStatusTracker {

    private final MetricsProvider metricsProvider;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public WatchStatusTracker(MetricsProvider metricsProvider) {
        this(metricsProvider, Clock.systemUTC());
    }

    public WatchStatusTracker(MetricsProvider metricsProvider, Clock clock) {
        this.metricsProvider = metricsProvider;
        this.clock = clock;
    }

    public void recordSuccess(String watchName) {
        Entry entry = entry(watchName);
        synchronized (entry) {
            if (entry.consecutiveErrors > 0) {
                log.info("Watch {} recovered after {} consecutive error(s)", watchName, entry.consecutiveErrors);
            }
            entry.consecutiveErrors = 0;
            entry.lastSuccessAt = clock.instant();
            entry.consecutiveErrorsGauge.set(0);
        }
        entry.ticks.increment();
    }

    public void recordError(String watchName, Throwable error) {
        Entry entry = entry(watchName);
        synchronized (entry) {
            entry.consecutiveErrors++;
            entry.lastError = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            entry.lastErrorAt = clock.instant();
            entry.consecutiveErrorsGauge.set(entry.consecutiveErrors);
            log.warn("Watch {} error ({} consecutive): {}", watchName, entry.consecutiveErrors, entry.lastError);
        }
        entry.errors.increment();
    }

    /**
     * Count errors that were reported but never seen, e.g. because an error queue was full.
     */
    public void recordDropped(String watchName, int count) {
        Entry entry = entry(watchName);
        synchronized (entry) {
            entry.consecutiveErrors += count;
            entry.lastError = count + " error(s) dropped";
            entry.lastErrorAt = clock.instant();
            entry.consecutiveErrorsGauge.set(entry.consecutiveErrors);
            log.warn("Watch {} dropped {} error(s) ({} consecutive)", watchName, count, entry.consecutiveErrors);
        }
        entry.errors.increment(count);
    }

    public Optional<WatchStatus> status(String watchName) {
        Entry entry = entries.get(watchName);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot(watchName));
    }

    /**
     * Status of every tracked watch, keyed and sorted by name.
     */
    public Map<String, WatchStatus> snapshot() {
        Map<String, WatchStatus> result = new TreeMap<>();
        entries.forEach((name, entry) -> result.put(name, entry.snapshot(name)));
        return result;
    }

    /**
     * Forget a watch that no longer runs.
     */
    public void remove(String watchName) {
        Entry entry = entries.remove(watchName);
        if (entry != null) {
            entry.consecutiveErrorsGauge.set(0);
        }
    }

    private Entry entry(String watchName) {
        return entries.computeIfAbsent(watchName, name -> new Entry(
            metricsProvider.gauge(WATCH_CONSECUTIVE_ERRORS_METRIC_NAME, Map.of(WATCH_NAME_TAG, name)),
            metricsProvider.counter(WATCH_ERRORS_METRIC_NAME, Map.of(WATCH_NAME_TAG, name)),
            metricsProvider.counter(WATCH_TICKS_METRIC_NAME, Map.of(WATCH_NAME_TAG, name))));
    }

    private static final class Entry {
        private final AtomicDouble consecutiveErrorsGauge;
        private final Counter errors;
        private final Counter ticks;
        private int consecutiveErrors;
        private String lastError;
        private Instant lastErrorAt;
        private Instant lastSuccessAt;

        Entry(AtomicDouble consecutiveErrorsGauge, Counter errors, Counter ticks) {
            this.consecutiveErrorsGauge = consecutiveErrorsGauge;
            this.errors = errors;
            this.ticks = ticks;
        }

        synchronized WatchStatus snapshot(String name) {
            return new WatchStatus(name, consecutiveErrors, lastError, lastErrorAt, lastSuccessAt);
        }
    }
}
