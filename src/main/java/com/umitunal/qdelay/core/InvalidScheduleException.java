package com.umitunal.qdelay.core;

/**
 * A schedule definition cannot be stored, typically because it has no trigger.
 */
public class InvalidScheduleException extends JobValidationException {

    public InvalidScheduleException(String message) {
        super(message);
    }
}
