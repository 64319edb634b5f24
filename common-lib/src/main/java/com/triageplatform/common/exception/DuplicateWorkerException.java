package com.triageplatform.common.exception;

/**
 * Raised when a worker is registered under a name that is already taken.
 * Always a wiring mistake; never retried.
 */
public class DuplicateWorkerException extends RuntimeException {
    private final String workerName;

    public DuplicateWorkerException(String workerName) {
        super("Worker '" + workerName + "' is already registered. Each worker must have a unique name.");
        this.workerName = workerName;
    }

    public String getWorkerName() {
        return workerName;
    }
}
