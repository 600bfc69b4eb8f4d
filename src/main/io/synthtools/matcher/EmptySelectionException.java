package io.synthtools.matcher;

/**
 * Thrown when a test would be created without targets or without agents.
 */
public class EmptySelectionException extends RuntimeException {

    public EmptySelectionException(String msg) {
        super(msg);
    }

}
