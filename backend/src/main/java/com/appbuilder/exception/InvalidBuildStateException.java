package com.appbuilder.exception;

/**
 * The requested operation is not allowed for the build's current status.
 */
public class InvalidBuildStateException extends RuntimeException {

    public InvalidBuildStateException(String message) {
        super(message);
    }
}
