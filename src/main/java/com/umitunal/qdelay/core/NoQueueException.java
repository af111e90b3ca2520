package com.umitunal.qdelay.core;

/**
 * A job's execution target does not resolve to any queue.
 */
public class NoQueueException extends JobValidationException {

    public NoQueueException(String message) {
        super(message);
    }
}
