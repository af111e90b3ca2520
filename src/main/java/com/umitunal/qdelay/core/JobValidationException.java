package com.umitunal.qdelay.core;

/**
 * Thrown before any store mutation when a job or schedule is not acceptable.
 */
public class JobValidationException extends IllegalArgumentException {

    public JobValidationException(String message) {
        super(message);
    }
}
