package com.mailrules.api.exceptions;

/**
 * The remote label directory could not be listed.
 */
public class LabelDirectoryException extends Exception {

    public LabelDirectoryException(String message) {
        super(message);
    }

    public LabelDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
