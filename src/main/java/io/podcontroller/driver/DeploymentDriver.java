package io.podcontroller.driver;

import io.podcontroller.labels.Applicator;
import io.podcontroller.labels.LabelSelector;
import io.podcontroller.labels.LabelType;
import io.podcontroller.labels.Labeled;
import io.podcontroller.labels.SelectorParseException;
import io.podcontroller.lock.Locker;
import io.podcontroller.models.PodManifest;
import io.podcontroller.models.RcRecord;
import io.podcontroller.rc.DesireWatch;
import io.podcontroller.rc.ReplicationController;
import io.podcontroller.rc.store.RcStore;
import io.podcontroller.scheduler.Scheduler;
import io.podcontroller.scheduler.SchedulingException;
import io.podcontroller.store.PodStore;
import io.podcontroller.store.StoreException;
import io.podcontroller.store.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives a replication controller through its whole life: create the record, run its loop,
 * scale it up and wait for placement, then scale it down, delete it and check nothing is
 * left behind.
 */
@Slf4j
public class DeploymentDriver {

    public static final String SHA_LABEL = "sha-truncated";
    private static final int MAX_LABEL_VALUE_LENGTH = 63;

    private final RcStore rcStore;
    private final Scheduler scheduler;
    private final PodStore podStore;
    private final Applicator applicator;
    private final Locker locker;
    private final Duration watchInterval;
    private final Duration pollInterval;

    public DeploymentDriver(RcStore rcStore, Scheduler scheduler, PodStore podStore, Applicator applicator,
                            Locker locker, Duration watchInterval, Duration pollInterval) {
        this.rcStore = rcStore;
        this.scheduler = scheduler;
        this.podStore = podStore;
        this.applicator = applicator;
        this.locker = locker;
        this.watchInterval = watchInterval;
        this.pollInterval = pollInterval;
    }

    /**
     * Create a replication controller for the manifest, start its loop and wait until it
     * runs on {@code replicas} nodes. Pods are labeled with {@code podLabels} plus a
     * truncated manifest digest. On timeout the loop is stopped and the record is left in
     * place for inspection.
     *
     * @throws DeploymentException if too few nodes match or placement does not converge in time
     */
    public Deployment deploy(PodManifest manifest, String nodeSelector, Map<String, String> podLabels, int replicas,
                             Duration timeout) throws StoreException, SchedulingException, DeploymentException,
                             InterruptedException {
        LabelSelector selector;
        try {
            selector = LabelSelector.parse(nodeSelector);
        } catch (SelectorParseException e) {
            throw new ValidationException("invalid node selector: " + e.getMessage(), e);
        }
        List<String> eligible = scheduler.eligibleNodes(manifest, selector);
        if (eligible.size() < replicas) {
            throw new DeploymentException("Only " + eligible.size() + " node(s) match '" + selector
                + "', cannot deploy " + replicas + " replica(s)");
        }
        List<String> targetNodes = new ArrayList<>(eligible.subList(0, replicas));

        Map<String, String> labels = new HashMap<>(podLabels);
        String sha = manifest.sha();
        labels.put(SHA_LABEL, sha.substring(0, Math.min(MAX_LABEL_VALUE_LENGTH, sha.length())));

        RcRecord record = rcStore.create(manifest, nodeSelector, labels);
        log.info("Deploying pod {} as replication controller {} to {}", manifest.getId(), record.getId(), targetNodes);

        ReplicationController controller = new ReplicationController(
            record.getId(), rcStore, scheduler, podStore, applicator, locker, watchInterval);
        DesireWatch watch = controller.watchDesires();
        rcStore.setDesiredReplicas(record.getId(), replicas);
        if (!controller.awaitConvergence(targetNodes, timeout, pollInterval)) {
            watch.stop();
            drainErrors(watch);
            throw new DeploymentException("Replication controller " + record.getId() + " did not reach "
                + targetNodes + " within " + timeout + ", currently on " + safeCurrentNodes(controller));
        }
        log.info("Replication controller {} converged on {}", record.getId(), targetNodes);
        return new Deployment(record.getId(), controller, watch, targetNodes);
    }

    /**
     * Scale to zero, wait for every pod to be removed, then disable and delete the record,
     * verify its labels are gone and stop its loop.
     *
     * @throws DeploymentException if pods remain after the timeout or labels survive deletion
     */
    public void teardown(Deployment deployment, Duration timeout)
            throws StoreException, DeploymentException, InterruptedException {
        String rcId = deployment.getRcId();
        log.info("Tearing down replication controller {}", rcId);
        try {
            rcStore.setDesiredReplicas(rcId, 0);
            if (!deployment.getController().awaitConvergence(List.of(), timeout, pollInterval)) {
                throw new DeploymentException("Replication controller " + rcId + " still runs on "
                    + safeCurrentNodes(deployment.getController()) + " after " + timeout);
            }
            rcStore.disable(rcId);
            rcStore.delete(rcId);

            Labeled residual = applicator.getLabels(LabelType.RC, rcId);
            if (!residual.getLabels().isEmpty()) {
                throw new DeploymentException("Replication controller " + rcId + " still has labels "
                    + residual.getLabels() + " after deletion");
            }
        } finally {
            deployment.getWatch().stop();
            drainErrors(deployment.getWatch());
        }
        log.info("Replication controller {} torn down", rcId);
    }

    private void drainErrors(DesireWatch watch) {
        List<Throwable> errors = new ArrayList<>();
        watch.errors().drainTo(errors);
        errors.forEach(error -> log.info("Error from watcher of {}: {}", watch.getRcId(), error.getMessage()));
    }

    private List<String> safeCurrentNodes(ReplicationController controller) {
        try {
            return controller.currentNodes();
        } catch (StoreException e) {
            log.debug("Failed to read current nodes: {}", e.getMessage());
            return List.of();
        }
    }
}
