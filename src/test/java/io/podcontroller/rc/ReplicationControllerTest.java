package io.podcontroller.rc;

import io.podcontroller.labels.InMemoryApplicator;
import io.podcontroller.labels.LabelType;
import io.podcontroller.lock.InMemoryLocker;
import io.podcontroller.models.PodManifest;
import io.podcontroller.models.RcRecord;
import io.podcontroller.rc.store.InMemoryRcStore;
import io.podcontroller.scheduler.ApplicatorScheduler;
import io.podcontroller.scheduler.Scheduler;
import io.podcontroller.scheduler.SchedulingException;
import io.podcontroller.store.InMemoryPodStore;
import io.podcontroller.store.NotFoundException;
import io.podcontroller.store.PodPathScheme;
import io.podcontroller.store.PodTree;
import io.podcontroller.store.StoreException;
import io.podcontroller.store.WatchHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static io.podcontroller.config.Constants.RC_ID_LABEL;
import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class ReplicationControllerTest {

    private static final Duration LONG_FALLBACK = Duration.ofMinutes(1);

    private final PodManifest manifest = new PodManifest("web", "1");

    private InMemoryApplicator applicator;
    private InMemoryRcStore rcStore;
    private FlakyPodStore podStore;
    private InMemoryLocker locker;
    private RcRecord record;
    private ReplicationController controller;
    private final List<DesireWatch> started = new ArrayList<>();

    /**
     * Pod store failing intent writes for selected nodes.
     */
    private static class FlakyPodStore extends InMemoryPodStore {
        private final List<String> failingNodes = new CopyOnWriteArrayList<>();

        @Override
        public void setPod(PodTree tree, String nodeName, PodManifest manifest) throws StoreException {
            if (failingNodes.contains(nodeName)) {
                throw new StoreException("disk full on " + nodeName);
            }
            super.setPod(tree, nodeName, manifest);
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        applicator = new InMemoryApplicator();
        podStore = new FlakyPodStore();
        rcStore = new InMemoryRcStore(applicator, podStore);
        locker = new InMemoryLocker();

        applicator.setLabels(LabelType.NODE, "node-a", Map.of("app", "web"));
        applicator.setLabels(LabelType.NODE, "node-b", Map.of("app", "web"));
        applicator.setLabels(LabelType.NODE, "node-c", Map.of("app", "web"));
        applicator.setLabels(LabelType.NODE, "node-x", Map.of("app", "db"));

        record = rcStore.create(manifest, "app=web", Map.of("team", "search"));
        controller = newController(record.getId(), LONG_FALLBACK);
    }

    @AfterEach
    void tearDown() throws Exception {
        for (DesireWatch watch : started) {
            watch.stop(Duration.ofSeconds(5));
        }
    }

    private ReplicationController newController(String rcId, Duration fallback) {
        return new ReplicationController(rcId, rcStore, new ApplicatorScheduler(applicator), podStore,
            applicator, locker, fallback);
    }

    private DesireWatch startWatch(ReplicationController rc, TickListener listener) {
        DesireWatch watch = rc.watchDesires(listener);
        started.add(watch);
        return watch;
    }

    private List<Throwable> drain(DesireWatch watch) {
        List<Throwable> errors = new ArrayList<>();
        watch.errors().drainTo(errors);
        return errors;
    }

    // =================================================================
    // SINGLE PASS
    // =================================================================

    @Test
    void testTick_SchedulesMissingPodWithOwnershipLabel() throws Exception {
        // Given
        rcStore.setDesiredReplicas(record.getId(), 1);
        DesireWatch watch = new DesireWatch(record.getId());

        // When
        controller.tick(watch);

        // Then
        assertThat(controller.currentNodes()).containsExactly("node-a");
        assertThat(podStore.getPod(PodTree.INTENT, "node-a", "web")).contains(manifest);
        assertThat(applicator.getLabels(LabelType.POD, "node-a/web").getLabels())
            .containsEntry("team", "search")
            .containsEntry(RC_ID_LABEL, record.getId());
        assertThat(drain(watch)).isEmpty();
    }

    @Test
    void testTick_ScalesDownAndReleasesPodLocks() throws Exception {
        // Given
        DesireWatch watch = new DesireWatch(record.getId());
        rcStore.setDesiredReplicas(record.getId(), 3);
        controller.tick(watch);
        assertThat(controller.currentNodes()).containsExactly("node-a", "node-b", "node-c");

        // When
        rcStore.setDesiredReplicas(record.getId(), 1);
        controller.tick(watch);

        // Then
        assertThat(controller.currentNodes()).containsExactly("node-a");
        assertThat(podStore.getPod(PodTree.INTENT, "node-b", "web")).isEmpty();
        assertThat(podStore.getPod(PodTree.INTENT, "node-c", "web")).isEmpty();
        assertThat(applicator.getLabels(LabelType.POD, "node-c/web").getLabels()).isEmpty();
        assertThat(locker.isLocked(PodPathScheme.getInstance().podLockPath(PodTree.INTENT, "node-c", "web"))).isFalse();
        assertThat(drain(watch)).isEmpty();
    }

    @Test
    void testTick_IsIdempotentOnceConverged() throws Exception {
        DesireWatch watch = new DesireWatch(record.getId());
        rcStore.setDesiredReplicas(record.getId(), 2);
        controller.tick(watch);

        podStore.failingNodes.add("node-a");
        podStore.failingNodes.add("node-b");
        controller.tick(watch);

        assertThat(controller.currentNodes()).containsExactly("node-a", "node-b");
        assertThat(drain(watch)).isEmpty();
    }

    @Test
    void testTick_PartialFailureReportsFailingNodeOnly() throws Exception {
        // Given
        podStore.failingNodes.add("node-b");
        rcStore.setDesiredReplicas(record.getId(), 3);
        DesireWatch watch = new DesireWatch(record.getId());

        // When
        controller.tick(watch);

        // Then
        assertThat(controller.currentNodes()).containsExactly("node-a", "node-c");
        List<Throwable> errors = drain(watch);
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0)).isInstanceOf(PlacementException.class)
            .hasMessageContaining("node-b")
            .hasMessageContaining("disk full");
        assertThat(((PlacementException) errors.get(0)).getNodeName()).isEqualTo("node-b");

        // When the node recovers
        podStore.failingNodes.clear();
        controller.tick(watch);

        // Then
        assertThat(controller.currentNodes()).containsExactly("node-a", "node-b", "node-c");
        assertThat(drain(watch)).isEmpty();
    }

    @Test
    void testTick_TooFewEligibleNodesStillUsesThem() throws Exception {
        rcStore.setDesiredReplicas(record.getId(), 5);
        DesireWatch watch = new DesireWatch(record.getId());

        controller.tick(watch);

        assertThat(controller.currentNodes()).containsExactly("node-a", "node-b", "node-c");
        List<Throwable> errors = drain(watch);
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0)).isInstanceOf(SchedulingException.class)
            .hasMessageContaining("Only 3 node(s) match")
            .hasMessageContaining("5 replica(s)");
    }

    @Test
    void testTick_DisabledRecordIsLeftAlone() throws Exception {
        rcStore.setDesiredReplicas(record.getId(), 2);
        rcStore.disable(record.getId());
        DesireWatch watch = new DesireWatch(record.getId());

        controller.tick(watch);

        assertThat(controller.currentNodes()).isEmpty();
        assertThat(drain(watch)).isEmpty();
    }

    @Test
    void testTick_HeldPodLockBlocksRemoval() throws Exception {
        // Given
        DesireWatch watch = new DesireWatch(record.getId());
        rcStore.setDesiredReplicas(record.getId(), 1);
        controller.tick(watch);
        locker.lock(PodPathScheme.getInstance().podLockPath(PodTree.INTENT, "node-a", "web"));

        // When
        rcStore.setDesiredReplicas(record.getId(), 0);
        controller.tick(watch);

        // Then
        assertThat(controller.currentNodes()).containsExactly("node-a");
        List<Throwable> errors = drain(watch);
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0)).isInstanceOf(PlacementException.class).hasMessageContaining("Failed to unschedule");
    }

    @Test
    void testTick_MissingRecordIsReported() {
        ReplicationController orphan = newController("no-such-rc", LONG_FALLBACK);
        DesireWatch watch = new DesireWatch("no-such-rc");

        orphan.tick(watch);

        assertThat(drain(watch)).singleElement().isInstanceOf(NotFoundException.class);
    }

    @Test
    void testDelete_BeforeScaleDownLeavesNoOwnedPods() throws Exception {
        // Given
        rcStore.setDesiredReplicas(record.getId(), 1);
        controller.tick(new DesireWatch(record.getId()));
        assertThat(controller.currentNodes()).containsExactly("node-a");

        // When
        rcStore.disable(record.getId());
        rcStore.setDesiredReplicas(record.getId(), 0);
        rcStore.delete(record.getId());
        DesireWatch watch = new DesireWatch(record.getId());
        controller.tick(watch);

        // Then
        assertThat(controller.currentNodes()).isEmpty();
        assertThat(applicator.getLabels(LabelType.POD, "node-a/web").getLabels()).isEmpty();
        assertThat(podStore.getPod(PodTree.INTENT, "node-a", "web")).isEmpty();
        assertThat(drain(watch)).singleElement().isInstanceOf(NotFoundException.class);
    }

    @Test
    void testTick_IgnoresPodsOfOtherControllers() throws Exception {
        // Given
        RcRecord other = rcStore.create(new PodManifest("api", "1"), "app=web", Map.of());
        rcStore.setDesiredReplicas(other.getId(), 3);
        newController(other.getId(), LONG_FALLBACK).tick(new DesireWatch(other.getId()));
        rcStore.setDesiredReplicas(record.getId(), 1);

        // When
        controller.tick(new DesireWatch(record.getId()));

        // Then
        assertThat(controller.currentNodes()).containsExactly("node-a");
        assertThat(podStore.listPods(PodTree.INTENT, "node-c")).extracting(PodManifest::getId).containsExactly("api");
    }

    // =================================================================
    // BACKGROUND LOOP
    // =================================================================

    @Test
    void testWatchDesires_ReactsToRecordChanges() throws Exception {
        // Given
        AtomicInteger ticks = new AtomicInteger();
        DesireWatch watch = startWatch(controller, (w, errorCount) -> ticks.incrementAndGet());
        await().atMost(Duration.ofSeconds(5)).until(() -> ticks.get() >= 1);

        // When
        rcStore.setDesiredReplicas(record.getId(), 2);

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> controller.currentNodes().size() == 2);
        assertThat(controller.currentNodes()).containsExactly("node-a", "node-b");

        // When
        rcStore.setDesiredReplicas(record.getId(), 0);

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> controller.currentNodes().isEmpty());
        assertThat(watch.isStopped()).isFalse();
    }

    @Test
    void testWatchDesires_ErrorsDoNotEndTheLoop() throws Exception {
        // Given
        podStore.failingNodes.add("node-b");
        rcStore.setDesiredReplicas(record.getId(), 3);
        List<Integer> errorCounts = new CopyOnWriteArrayList<>();

        // When
        DesireWatch watch = startWatch(controller, (w, errorCount) -> errorCounts.add(errorCount));

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> !errorCounts.isEmpty());
        assertThat(errorCounts.get(0)).isEqualTo(1);
        List<Throwable> errors = drain(watch);
        assertThat(errors).singleElement().isInstanceOf(PlacementException.class);
        assertThat(((PlacementException) errors.get(0)).getNodeName()).isEqualTo("node-b");
        assertThat(watch.isStopped()).isFalse();

        // When the node recovers and the record changes
        podStore.failingNodes.clear();
        rcStore.setDesiredReplicas(record.getId(), 3);
        rcStore.setDesiredReplicas(record.getId(), 2);

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> controller.currentNodes().size() == 2);
    }

    @Test
    void testWatchDesires_UncheckedFailureDoesNotEndTheLoop() throws Exception {
        // Given a scheduler whose first call blows up
        ApplicatorScheduler delegate = new ApplicatorScheduler(applicator);
        AtomicInteger schedulerCalls = new AtomicInteger();
        Scheduler glitchy = (podManifest, selector) -> {
            if (schedulerCalls.incrementAndGet() == 1) {
                throw new IllegalStateException("inventory glitch");
            }
            return delegate.eligibleNodes(podManifest, selector);
        };
        ReplicationController glitchyController = new ReplicationController(record.getId(), rcStore, glitchy,
            podStore, applicator, locker, Duration.ofMillis(50));
        rcStore.setDesiredReplicas(record.getId(), 1);
        List<Integer> errorCounts = new CopyOnWriteArrayList<>();

        // When
        DesireWatch watch = startWatch(glitchyController, (w, errorCount) -> errorCounts.add(errorCount));

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> glitchyController.currentNodes().size() == 1);
        assertThat(watch.isStopped()).isFalse();
        assertThat(errorCounts.get(0)).isEqualTo(1);
        assertThat(drain(watch)).first()
            .isInstanceOf(IllegalStateException.class)
            .hasFieldOrPropertyWithValue("message", "inventory glitch");
    }

    @Test
    void testWatchDesires_FallbackIntervalRetries() throws Exception {
        // Given
        ReplicationController fastController = newController(record.getId(), Duration.ofMillis(50));
        podStore.failingNodes.add("node-a");
        rcStore.setDesiredReplicas(record.getId(), 1);
        startWatch(fastController, TickListener.NOOP);

        // When
        Thread.sleep(150);
        podStore.failingNodes.clear();

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> fastController.currentNodes().size() == 1);
    }

    @Test
    void testStop_WaitsForAcknowledgement() throws Exception {
        DesireWatch watch = controller.watchDesires();

        assertThat(watch.stop(Duration.ofSeconds(5))).isTrue();
        assertThat(watch.isStopped()).isTrue();

        // A stopped loop ignores further changes
        rcStore.setDesiredReplicas(record.getId(), 1);
        assertThat(controller.currentNodes()).isEmpty();
        assertThatCode(watch::stop).doesNotThrowAnyException();
    }

    @Test
    void testTickListenerFailureIsReported() throws Exception {
        DesireWatch watch = startWatch(controller, (w, errorCount) -> {
            throw new IllegalStateException("listener broke");
        });

        await().atMost(Duration.ofSeconds(5)).until(() -> !watch.errors().isEmpty());
        assertThat(watch.errors().peek()).hasMessage("listener broke");
    }

    // =================================================================
    // CONVERGENCE
    // =================================================================

    @Test
    void testAwaitConvergence() throws Exception {
        startWatch(controller, TickListener.NOOP);

        rcStore.setDesiredReplicas(record.getId(), 2);

        assertThat(controller.awaitConvergence(List.of("node-b", "node-a"), Duration.ofSeconds(5), Duration.ofMillis(20)))
            .isTrue();
    }

    @Test
    void testAwaitConvergence_TimesOut() throws Exception {
        rcStore.setDesiredReplicas(record.getId(), 2);

        assertThat(controller.awaitConvergence(List.of("node-a", "node-b"), Duration.ofMillis(100), Duration.ofMillis(20)))
            .isFalse();
    }

    @Test
    void testWatchCurrentNodes_DeliversChanges() throws Exception {
        // Given
        List<List<String>> deliveries = new CopyOnWriteArrayList<>();
        WatchHandle handle = controller.watchCurrentNodes(deliveries::add);
        startWatch(controller, TickListener.NOOP);

        // When
        rcStore.setDesiredReplicas(record.getId(), 1);

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> deliveries.contains(List.of("node-a")));
        assertThat(deliveries.get(0)).isEmpty();
        handle.close();
    }
}
