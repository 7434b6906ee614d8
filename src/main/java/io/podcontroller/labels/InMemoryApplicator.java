package io.podcontroller.labels;

import io.podcontroller.store.WatchHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Applicator holding labels in process memory. Watchers are notified synchronously on the
 * mutating thread after every change to their label type.
 */
@Slf4j
public class InMemoryApplicator implements Applicator {

    private final Map<LabelType, Map<String, Map<String, String>>> labelsByType = new HashMap<>();
    private final List<MatchWatcher> watchers = new CopyOnWriteArrayList<>();

    public InMemoryApplicator() {
        for (LabelType type : LabelType.values()) {
            labelsByType.put(type, new TreeMap<>());
        }
    }

    @Override
    public void setLabel(LabelType type, String id, String key, String value) {
        setLabels(type, id, Map.of(key, value));
    }

    @Override
    public void setLabels(LabelType type, String id, Map<String, String> labels) {
        synchronized (this) {
            labelsByType.get(type).computeIfAbsent(id, ignored -> new TreeMap<>()).putAll(labels);
        }
        notifyWatchers(type);
    }

    @Override
    public synchronized Labeled getLabels(LabelType type, String id) {
        Map<String, String> labels = labelsByType.get(type).get(id);
        return new Labeled(type, id, labels == null ? new HashMap<>() : new HashMap<>(labels));
    }

    @Override
    public void removeLabel(LabelType type, String id, String key) {
        removeLabels(type, id, List.of(key));
    }

    @Override
    public void removeLabels(LabelType type, String id, Collection<String> keys) {
        synchronized (this) {
            Map<String, String> labels = labelsByType.get(type).get(id);
            if (labels == null) {
                return;
            }
            keys.forEach(labels::remove);
            if (labels.isEmpty()) {
                labelsByType.get(type).remove(id);
            }
        }
        notifyWatchers(type);
    }

    @Override
    public void removeAllLabels(LabelType type, String id) {
        synchronized (this) {
            if (labelsByType.get(type).remove(id) == null) {
                return;
            }
        }
        notifyWatchers(type);
    }

    @Override
    public synchronized List<Labeled> getMatches(LabelSelector selector, LabelType type) {
        List<Labeled> matches = new ArrayList<>();
        labelsByType.get(type).forEach((id, labels) -> {
            if (selector.test(labels)) {
                matches.add(new Labeled(type, id, new HashMap<>(labels)));
            }
        });
        return matches;
    }

    @Override
    public WatchHandle watchMatches(LabelSelector selector, LabelType type, Consumer<List<Labeled>> listener) {
        MatchWatcher watcher = new MatchWatcher(selector, type, listener);
        watchers.add(watcher);
        watcher.deliver();
        return () -> watchers.remove(watcher);
    }

    private void notifyWatchers(LabelType type) {
        for (MatchWatcher watcher : watchers) {
            if (watcher.type == type) {
                watcher.deliver();
            }
        }
    }

    private final class MatchWatcher {
        private final LabelSelector selector;
        private final LabelType type;
        private final Consumer<List<Labeled>> listener;

        MatchWatcher(LabelSelector selector, LabelType type, Consumer<List<Labeled>> listener) {
            this.selector = selector;
            this.type = type;
            this.listener = listener;
        }

        void deliver() {
            try {
                listener.accept(getMatches(selector, type));
            } catch (RuntimeException e) {
                log.error("Label watch listener for {} failed: {}", selector, e.getMessage(), e);
            }
        }
    }
}
