package io.podcontroller.scheduler;

import io.podcontroller.labels.Applicator;
import io.podcontroller.labels.LabelSelector;
import io.podcontroller.labels.LabelType;
import io.podcontroller.labels.Labeled;
import io.podcontroller.models.PodManifest;
import io.podcontroller.store.StoreException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Scheduler that picks the nodes whose labels match the selector, sorted by node id.
 * The manifest does not influence the choice.
 */
@Slf4j
public class ApplicatorScheduler implements Scheduler {

    private final Applicator applicator;

    public ApplicatorScheduler(Applicator applicator) {
        this.applicator = applicator;
    }

    @Override
    public List<String> eligibleNodes(PodManifest manifest, LabelSelector selector) throws SchedulingException {
        List<Labeled> matches;
        try {
            matches = applicator.getMatches(selector, LabelType.NODE);
        } catch (StoreException e) {
            throw new SchedulingException("Failed to resolve nodes matching '" + selector + "': " + e.getMessage(), e);
        }
        List<String> nodes = matches.stream()
            .map(Labeled::getId)
            .distinct()
            .sorted()
            .collect(Collectors.toList());
        log.debug("Selector '{}' matched {} node(s) for pod {}", selector, nodes.size(),
            manifest != null ? manifest.getId() : null);
        return nodes;
    }
}
