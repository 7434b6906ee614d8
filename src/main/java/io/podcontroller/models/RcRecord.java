package io.podcontroller.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Persisted replication controller record: which manifest to run, where it may run
 * and how many copies are wanted.
 */
@Data
@NoArgsConstructor
public class RcRecord {

    @JsonProperty("id")
    private String id;

    @JsonProperty("manifest")
    private PodManifest manifest;

    @JsonProperty("node_selector")
    private String nodeSelector;

    @JsonProperty("pod_labels")
    private Map<String, String> podLabels = new HashMap<>();

    @JsonProperty("disabled")
    private boolean disabled;

    @JsonProperty("replicas_desired")
    private int replicasDesired;

    public RcRecord(String id, PodManifest manifest, String nodeSelector, Map<String, String> podLabels) {
        this.id = id;
        this.manifest = manifest;
        this.nodeSelector = nodeSelector;
        this.podLabels = podLabels != null ? new HashMap<>(podLabels) : new HashMap<>();
        this.disabled = false;
        this.replicasDesired = 0;
    }

    /**
     * Field-for-field copy, so callers never share mutable state with a store.
     */
    public RcRecord copy() {
        RcRecord copy = new RcRecord(id, manifest, nodeSelector, podLabels);
        copy.setDisabled(disabled);
        copy.setReplicasDesired(replicasDesired);
        return copy;
    }
}
