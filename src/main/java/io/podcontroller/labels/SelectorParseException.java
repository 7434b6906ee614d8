package io.podcontroller.labels;

/**
 * A label selector expression could not be parsed.
 */
public class SelectorParseException extends RuntimeException {

    public SelectorParseException(String message) {
        super(message);
    }
}
