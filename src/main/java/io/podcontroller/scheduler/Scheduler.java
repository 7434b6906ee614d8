package io.podcontroller.scheduler;

import io.podcontroller.labels.LabelSelector;
import io.podcontroller.models.PodManifest;

import java.util.List;

/**
 * Resolves which nodes may run a pod.
 */
public interface Scheduler {

    /**
     * Nodes eligible for the manifest under the selector, in a stable order: the same
     * label state always yields the same list.
     */
    List<String> eligibleNodes(PodManifest manifest, LabelSelector selector) throws SchedulingException;
}
