package com.umitunal.qdelay.core;

/**
 * A job was submitted without an execution target.
 */
public class NoClassException extends JobValidationException {

    public NoClassException(String message) {
        super(message);
    }
}
