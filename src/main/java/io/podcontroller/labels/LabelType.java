package io.podcontroller.labels;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static io.podcontroller.config.Constants.*;

/**
 * Kinds of entities that carry labels.
 */
public enum LabelType {
    NODE(LABEL_TYPE_NODE),
    POD(LABEL_TYPE_POD),
    RC(LABEL_TYPE_RC);

    private final String name;

    LabelType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static LabelType fromName(String name) {
        for (LabelType type : values()) {
            if (type.name.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown label type: " + name);
    }
}
