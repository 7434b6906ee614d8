package io.podcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.hash.Hashing;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Versioned deployment manifest for a pod. The RC treats its content as opaque apart from
 * the pod id, and identifies a manifest by the digest of its canonical JSON encoding.
 */
@Data
@NoArgsConstructor
public class PodManifest {

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true);

    @JsonProperty("id")
    private String id;

    @JsonProperty("version")
    private String version;

    @JsonProperty("config")
    private Map<String, Object> config = new HashMap<>();

    public PodManifest(String id, String version) {
        this.id = id;
        this.version = version;
    }

    /**
     * Hex encoded SHA-256 of the canonical JSON form of this manifest.
     */
    @JsonIgnore
    public String sha() {
        try {
            byte[] canonical = CANONICAL_MAPPER.writeValueAsBytes(this);
            return Hashing.sha256().hashBytes(canonical).toString();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode manifest " + id + " for hashing", e);
        }
    }

    /**
     * Canonical JSON encoding, as written to the intent tree.
     */
    @JsonIgnore
    public byte[] toCanonicalJson() {
        try {
            return CANONICAL_MAPPER.writeValueAsBytes(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode manifest " + id, e);
        }
    }

    public static PodManifest fromJson(byte[] json) throws IOException {
        return CANONICAL_MAPPER.readValue(new String(json, UTF_8), PodManifest.class);
    }
}
