package io.podcontroller.driver;

import io.podcontroller.rc.DesireWatch;
import io.podcontroller.rc.ReplicationController;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * A replication controller started by {@link DeploymentDriver}, with its running loop.
 */
@Getter
@AllArgsConstructor
public class Deployment {
    private final String rcId;
    private final ReplicationController controller;
    private final DesireWatch watch;
    private final List<String> targetNodes;
}
