package io.podcontroller.rc.store;

import io.podcontroller.labels.Applicator;
import io.podcontroller.labels.LabelSelector;
import io.podcontroller.labels.LabelType;
import io.podcontroller.labels.Labeled;
import io.podcontroller.store.PodStore;
import io.podcontroller.store.PodTree;
import io.podcontroller.store.StoreException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static io.podcontroller.config.Constants.PATH_DELIMITER;
import static io.podcontroller.config.Constants.RC_ID_LABEL;

/**
 * Releases the pods a deleted replication controller still owns: the intent entry and
 * every label of each pod entity labeled {@code replication_controller_id=<id>}.
 */
@Slf4j
final class OwnedPods {

    private OwnedPods() {
    }

    /**
     * Every owned pod is attempted; the first failure is rethrown after the rest.
     */
    static void release(String rcId, Applicator applicator, PodStore podStore) throws StoreException {
        LabelSelector ownership = LabelSelector.matchingLabels(Map.of(RC_ID_LABEL, rcId));
        StoreException firstFailure = null;
        for (Labeled pod : applicator.getMatches(ownership, LabelType.POD)) {
            String entityId = pod.getId();
            int slash = entityId.indexOf(PATH_DELIMITER);
            try {
                if (slash > 0) {
                    podStore.deletePod(PodTree.INTENT, entityId.substring(0, slash), entityId.substring(slash + 1));
                }
                applicator.removeAllLabels(LabelType.POD, entityId);
                log.info("Released pod {} of deleted replication controller {}", entityId, rcId);
            } catch (StoreException e) {
                log.error("Failed to release pod {} of replication controller {}: {}", entityId, rcId, e.getMessage(), e);
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
    }
}
