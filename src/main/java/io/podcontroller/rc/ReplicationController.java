package io.podcontroller.rc;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.podcontroller.labels.Applicator;
import io.podcontroller.labels.LabelSelector;
import io.podcontroller.labels.LabelType;
import io.podcontroller.labels.Labeled;
import io.podcontroller.labels.SelectorParseException;
import io.podcontroller.lock.HeldLock;
import io.podcontroller.lock.Locker;
import io.podcontroller.models.PodManifest;
import io.podcontroller.models.RcRecord;
import io.podcontroller.rc.store.RcStore;
import io.podcontroller.scheduler.Scheduler;
import io.podcontroller.scheduler.SchedulingException;
import io.podcontroller.store.PodPathScheme;
import io.podcontroller.store.PodStore;
import io.podcontroller.store.PodTree;
import io.podcontroller.store.StoreException;
import io.podcontroller.store.WatchHandle;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import static io.podcontroller.config.Constants.DEFAULT_WATCH_INTERVAL_SECONDS;
import static io.podcontroller.config.Constants.PATH_DELIMITER;
import static io.podcontroller.config.Constants.RC_ID_LABEL;

/**
 * Keeps the pods of one replication controller record placed on the nodes its selector
 * picks. Each reconciliation pass compares the nodes whose pod entity carries this
 * controller's ownership label with the first {@code replicas_desired} eligible nodes,
 * then writes intent for missing nodes and removes it from surplus nodes.
 *
 * <p>Several controllers, in this or other processes, may work against the same store.
 * Intent and label writes rely on the store's conditional updates; removals additionally
 * hold the pod lock.</p>
 */
@Slf4j
public class ReplicationController {

    @Getter
    private final String rcId;
    private final RcStore rcStore;
    private final Scheduler scheduler;
    private final PodStore podStore;
    private final Applicator applicator;
    private final Locker locker;
    private final Duration fallbackInterval;
    private final PodPathScheme paths;
    private final LabelSelector ownershipSelector;

    public ReplicationController(String rcId, RcStore rcStore, Scheduler scheduler, PodStore podStore,
                                 Applicator applicator, Locker locker) {
        this(rcId, rcStore, scheduler, podStore, applicator, locker,
            Duration.ofSeconds(DEFAULT_WATCH_INTERVAL_SECONDS));
    }

    public ReplicationController(String rcId, RcStore rcStore, Scheduler scheduler, PodStore podStore,
                                 Applicator applicator, Locker locker, Duration fallbackInterval) {
        this.rcId = rcId;
        this.rcStore = rcStore;
        this.scheduler = scheduler;
        this.podStore = podStore;
        this.applicator = applicator;
        this.locker = locker;
        this.fallbackInterval = fallbackInterval;
        this.paths = PodPathScheme.getInstance();
        this.ownershipSelector = LabelSelector.matchingLabels(Map.of(RC_ID_LABEL, rcId));
    }

    // =================================================================
    // DESIRE WATCH LOOP
    // =================================================================

    public DesireWatch watchDesires() {
        return watchDesires(TickListener.NOOP);
    }

    /**
     * Start reconciling in the background. A pass runs immediately, after every change to
     * the record, and at the fallback interval. Passes never overlap. Failures are reported
     * on {@link DesireWatch#errors()} and never end the loop; only {@link DesireWatch#stop()} does.
     */
    public DesireWatch watchDesires(TickListener tickListener) {
        DesireWatch watch = new DesireWatch(rcId);
        ExecutorService executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
            .setNameFormat("rc-watch-" + rcId + "-%d")
            .setDaemon(true)
            .build());
        WatchHandle recordWatch = rcStore.watch(rcId, watch::wake);

        log.info("[RC: {}] Starting desire watch (fallback interval: {}s)", rcId, fallbackInterval.toSeconds());
        executor.execute(() -> {
            try {
                while (!watch.quitRequested()) {
                    long errorsBefore = watch.reportedCount();
                    try {
                        tick(watch);
                    } catch (RuntimeException e) {
                        log.error("[RC: {}] Reconciliation pass failed unexpectedly: {}", rcId, e.getMessage(), e);
                        watch.report(e);
                    }
                    if (watch.quitRequested()) {
                        break;
                    }
                    notifyTick(tickListener, (int) (watch.reportedCount() - errorsBefore), watch);
                    watch.awaitNextTick(fallbackInterval);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[RC: {}] Watch loop interrupted", rcId);
            } finally {
                recordWatch.close();
                watch.acknowledge();
                executor.shutdown();
            }
        });
        return watch;
    }

    private void notifyTick(TickListener tickListener, int errorCount, DesireWatch watch) {
        try {
            tickListener.tickCompleted(watch, errorCount);
        } catch (RuntimeException e) {
            watch.report(e);
        }
    }

    /**
     * One reconciliation pass.
     */
    void tick(DesireWatch watch) {
        RcRecord record;
        try {
            record = rcStore.get(rcId);
        } catch (StoreException e) {
            watch.report(e);
            return;
        }
        if (record.isDisabled()) {
            log.debug("[RC: {}] Disabled, skipping scheduling", rcId);
            return;
        }

        List<String> targetNodes;
        try {
            targetNodes = resolveTargetNodes(record, watch);
        } catch (SchedulingException e) {
            watch.report(e);
            return;
        }

        Set<String> currentNodes;
        try {
            currentNodes = new HashSet<>(currentNodes());
        } catch (StoreException e) {
            watch.report(e);
            return;
        }

        for (String node : targetNodes) {
            if (watch.quitRequested()) {
                return;
            }
            if (!currentNodes.contains(node)) {
                try {
                    schedule(record, node);
                } catch (PlacementException e) {
                    watch.report(e);
                }
            }
        }
        for (String node : new TreeSet<>(currentNodes)) {
            if (watch.quitRequested()) {
                return;
            }
            if (!targetNodes.contains(node)) {
                try {
                    unschedule(record, node);
                } catch (PlacementException e) {
                    watch.report(e);
                }
            }
        }
    }

    /**
     * The first {@code replicas_desired} eligible nodes. Having fewer eligible nodes than
     * desired is reported but does not stop the available nodes from being used.
     */
    private List<String> resolveTargetNodes(RcRecord record, DesireWatch watch) throws SchedulingException {
        if (record.getNodeSelector() == null) {
            throw new SchedulingException("Stored record has no node selector");
        }
        LabelSelector selector;
        try {
            selector = LabelSelector.parse(record.getNodeSelector());
        } catch (SelectorParseException e) {
            throw new SchedulingException("Stored node selector is invalid: " + e.getMessage(), e);
        }
        List<String> eligible = scheduler.eligibleNodes(record.getManifest(), selector);
        int desired = record.getReplicasDesired();
        if (eligible.size() < desired) {
            watch.report(new SchedulingException("Only " + eligible.size() + " node(s) match '" + selector
                + "' but " + desired + " replica(s) are desired"));
        }
        return new ArrayList<>(eligible.subList(0, Math.min(desired, eligible.size())));
    }

    private void schedule(RcRecord record, String node) throws PlacementException {
        PodManifest manifest = record.getManifest();
        log.info("[RC: {}] Scheduling pod {} on node {}", rcId, manifest.getId(), node);
        try {
            podStore.setPod(PodTree.INTENT, node, manifest);
            Map<String, String> labels = new HashMap<>(record.getPodLabels());
            labels.put(RC_ID_LABEL, rcId);
            applicator.setLabels(LabelType.POD, podEntityId(node, manifest.getId()), labels);
        } catch (Exception e) {
            throw new PlacementException(node, "Failed to schedule pod " + manifest.getId(), e);
        }
    }

    private void unschedule(RcRecord record, String node) throws PlacementException {
        String podId = record.getManifest().getId();
        log.info("[RC: {}] Unscheduling pod {} from node {}", rcId, podId, node);
        HeldLock lock = null;
        try {
            lock = locker.lock(paths.podLockPath(PodTree.INTENT, node, podId));
            podStore.deletePod(PodTree.INTENT, node, podId);
            applicator.removeAllLabels(LabelType.POD, podEntityId(node, podId));
        } catch (Exception e) {
            throw new PlacementException(node, "Failed to unschedule pod " + podId, e);
        } finally {
            locker.unlock(lock);
        }
    }

    // =================================================================
    // CURRENT NODES AND CONVERGENCE
    // =================================================================

    /**
     * Nodes whose pod entity is labeled as owned by this controller, sorted.
     */
    public List<String> currentNodes() throws StoreException {
        return nodesOf(applicator.getMatches(ownershipSelector, LabelType.POD));
    }

    /**
     * Poll {@link #currentNodes()} until it equals {@code expectedNodes} as a set.
     *
     * @return true if converged before the timeout
     */
    public boolean awaitConvergence(Collection<String> expectedNodes, Duration timeout, Duration pollInterval)
            throws InterruptedException {
        Set<String> expected = new HashSet<>(expectedNodes);
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                if (new HashSet<>(currentNodes()).equals(expected)) {
                    return true;
                }
            } catch (StoreException e) {
                log.debug("[RC: {}] Reading current nodes failed while awaiting convergence: {}", rcId, e.getMessage());
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(pollInterval.toMillis());
        }
    }

    /**
     * Deliver the current nodes now and after every change to pod ownership labels.
     */
    public WatchHandle watchCurrentNodes(Consumer<List<String>> listener) {
        return applicator.watchMatches(ownershipSelector, LabelType.POD, matches -> listener.accept(nodesOf(matches)));
    }

    private static List<String> nodesOf(List<Labeled> podEntities) {
        Set<String> nodes = new LinkedHashSet<>();
        for (Labeled pod : podEntities) {
            String id = pod.getId();
            int slash = id.indexOf(PATH_DELIMITER);
            nodes.add(slash < 0 ? id : id.substring(0, slash));
        }
        return new ArrayList<>(new TreeSet<>(nodes));
    }

    static String podEntityId(String node, String podId) {
        return node + PATH_DELIMITER + podId;
    }
}
