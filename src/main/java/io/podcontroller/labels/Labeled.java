package io.podcontroller.labels;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Snapshot of the labels carried by one entity.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Labeled {

    @JsonProperty("type")
    private LabelType labelType;

    @JsonProperty("id")
    private String id;

    @JsonProperty("labels")
    private Map<String, String> labels = new HashMap<>();

    public static Labeled empty(LabelType labelType, String id) {
        return new Labeled(labelType, id, new HashMap<>());
    }
}
