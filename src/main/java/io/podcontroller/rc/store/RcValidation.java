package io.podcontroller.rc.store;

import io.podcontroller.labels.LabelSelector;
import io.podcontroller.labels.SelectorParseException;
import io.podcontroller.models.PodManifest;
import io.podcontroller.store.ValidationException;

/**
 * Argument checks shared by the store implementations. They run before any store access.
 */
final class RcValidation {

    private RcValidation() {
    }

    static void validateCreate(PodManifest manifest, String nodeSelector) throws ValidationException {
        if (manifest == null) {
            throw new ValidationException("manifest is required");
        }
        if (manifest.getId() == null || manifest.getId().isEmpty()) {
            throw new ValidationException("manifest must have a pod id");
        }
        if (nodeSelector == null) {
            throw new ValidationException("node selector is required");
        }
        try {
            LabelSelector.parse(nodeSelector);
        } catch (SelectorParseException e) {
            throw new ValidationException("invalid node selector: " + e.getMessage(), e);
        }
    }

    static void validateReplicas(int replicas) throws ValidationException {
        if (replicas < 0) {
            throw new ValidationException("desired replicas must be non-negative, got " + replicas);
        }
    }
}
