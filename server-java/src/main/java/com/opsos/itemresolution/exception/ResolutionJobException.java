package com.opsos.itemresolution.exception;

/**
 * Unrecoverable problem with a batch invocation: bad arguments, unreachable store,
 * unwritable output. Thrown out of the runner so the process exits non-zero.
 */
public class ResolutionJobException extends ResolutionException {

    public ResolutionJobException(String message) {
        super(message);
    }

    public ResolutionJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
