package io.podcontroller.labels;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.etcd.jetcd.KeyValue;
import io.podcontroller.store.EtcdOperations;
import io.podcontroller.store.PodPathScheme;
import io.podcontroller.store.RetryPolicy;
import io.podcontroller.store.StoreException;
import io.podcontroller.store.WatchHandle;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * etcd-based Applicator. The labels of an entity are one JSON object stored at
 * {@code labels/<type>/<id>}; every mutation is a read-modify-write guarded by the mod
 * revision that was read, retried by the {@link RetryPolicy} when another writer wins.
 */
@Slf4j
public class EtcdApplicator implements Applicator {

    private static final TypeReference<TreeMap<String, String>> LABELS_TYPE = new TypeReference<>() {};

    private final EtcdOperations etcd;
    private final PodPathScheme paths;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;

    public EtcdApplicator(EtcdOperations etcd, RetryPolicy retryPolicy) {
        this.etcd = etcd;
        this.paths = PodPathScheme.getInstance();
        this.retryPolicy = retryPolicy;
        this.objectMapper = new ObjectMapper();
    }

    // =================================================================
    // MUTATIONS
    // =================================================================

    @Override
    public void setLabel(LabelType type, String id, String key, String value) throws StoreException {
        setLabels(type, id, Map.of(key, value));
    }

    @Override
    public void setLabels(LabelType type, String id, Map<String, String> labels) throws StoreException {
        log.debug("Setting labels {} on {} {}", labels, type.getName(), id);
        mutate(type, id, "set labels on", current -> {
            current.putAll(labels);
            return current;
        });
    }

    @Override
    public void removeLabel(LabelType type, String id, String key) throws StoreException {
        removeLabels(type, id, List.of(key));
    }

    @Override
    public void removeLabels(LabelType type, String id, Collection<String> keys) throws StoreException {
        log.debug("Removing labels {} from {} {}", keys, type.getName(), id);
        mutate(type, id, "remove labels from", current -> {
            keys.forEach(current::remove);
            return current;
        });
    }

    @Override
    public void removeAllLabels(LabelType type, String id) throws StoreException {
        String key = paths.labelPath(type.getName(), id);
        retryPolicy.run("remove all labels from " + key, () -> {
            long deleted = etcd.delete(key);
            log.debug("Deleted {} label key(s) at {}", deleted, key);
        });
    }

    /**
     * Compare-And-Swap read-modify-write. An empty result deletes the label key.
     */
    private void mutate(LabelType type, String id, String description, UnaryOperator<TreeMap<String, String>> change)
            throws StoreException {
        String key = paths.labelPath(type.getName(), id);
        retryPolicy.run(description + " " + key, () -> {
            Optional<KeyValue> current = etcd.get(key);
            TreeMap<String, String> labels = current.isPresent() ? parse(current.get()) : new TreeMap<>();
            long revision = current.map(KeyValue::getModRevision).orElse(0L);

            TreeMap<String, String> updated = change.apply(new TreeMap<>(labels));
            if (current.isPresent() && updated.equals(labels)) {
                return;
            }
            if (updated.isEmpty()) {
                if (current.isPresent()) {
                    etcd.deleteAtRevision(key, revision);
                }
                return;
            }
            etcd.putAtRevision(key, objectMapper.writeValueAsBytes(updated), revision);
        });
    }

    // =================================================================
    // QUERIES
    // =================================================================

    @Override
    public Labeled getLabels(LabelType type, String id) throws StoreException {
        String key = paths.labelPath(type.getName(), id);
        return retryPolicy.call("read labels at " + key, () -> {
            Optional<KeyValue> kv = etcd.get(key);
            if (kv.isEmpty()) {
                return Labeled.empty(type, id);
            }
            return new Labeled(type, id, new HashMap<>(parse(kv.get())));
        });
    }

    @Override
    public List<Labeled> getMatches(LabelSelector selector, LabelType type) throws StoreException {
        String prefix = paths.labelTypePrefix(type.getName());
        return retryPolicy.call("query " + type.getName() + " labels matching " + selector, () -> {
            List<Labeled> matches = new ArrayList<>();
            for (KeyValue kv : etcd.getPrefix(prefix)) {
                String key = EtcdOperations.string(kv.getKey());
                TreeMap<String, String> labels;
                try {
                    labels = parse(kv);
                } catch (Exception parseException) {
                    log.warn("Failed to parse labels at key {}: {}", key, parseException.getMessage());
                    continue;
                }
                if (selector.test(labels)) {
                    matches.add(new Labeled(type, paths.entityIdFromLabelPath(type.getName(), key), new HashMap<>(labels)));
                }
            }
            return matches;
        });
    }

    @Override
    public WatchHandle watchMatches(LabelSelector selector, LabelType type, Consumer<List<Labeled>> listener) {
        ExecutorService executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
            .setNameFormat("label-watch-" + type.getName() + "-%d")
            .setDaemon(true)
            .build());
        AtomicBoolean closed = new AtomicBoolean(false);
        Runnable deliver = () -> {
            if (closed.get()) {
                return;
            }
            try {
                listener.accept(getMatches(selector, type));
            } catch (StoreException e) {
                log.warn("Label watch query for {} failed, waiting for next change: {}", selector, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Label watch listener for {} failed: {}", selector, e.getMessage(), e);
            }
        };

        // Queries run off the etcd callback thread
        WatchHandle etcdWatch = etcd.watch(paths.labelTypePrefix(type.getName()), true, () -> {
            try {
                executor.execute(deliver);
            } catch (RejectedExecutionException e) {
                log.debug("Ignoring label change for closed watch on {}", selector);
            }
        });
        executor.execute(deliver);
        return () -> {
            if (closed.compareAndSet(false, true)) {
                etcdWatch.close();
                executor.shutdownNow();
            }
        };
    }

    private TreeMap<String, String> parse(KeyValue kv) throws IOException {
        return objectMapper.readValue(kv.getValue().getBytes(), LABELS_TYPE);
    }
}
