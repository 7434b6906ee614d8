package io.podcontroller.rc;

import lombok.Getter;

/**
 * Scheduling or unscheduling a pod failed on one node. Other nodes are unaffected.
 */
@Getter
public class PlacementException extends Exception {

    private final String nodeName;

    public PlacementException(String nodeName, String message, Throwable cause) {
        super(message + " on node " + nodeName + ": " + (cause.getMessage() != null ? cause.getMessage() : cause), cause);
        this.nodeName = nodeName;
    }
}
