package io.podcontroller.driver;

/**
 * A deployment or teardown did not reach the expected state.
 */
public class DeploymentException extends Exception {

    public DeploymentException(String message) {
        super(message);
    }

    public DeploymentException(String message, Throwable cause) {
        super(message, cause);
    }
}
