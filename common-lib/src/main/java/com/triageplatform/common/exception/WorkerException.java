package com.triageplatform.common.exception;

public class WorkerException extends RuntimeException {
    private final String workerName;

    public WorkerException(String workerName, String message) {
        super("[" + workerName + "] " + message);
        this.workerName = workerName;
    }

    public WorkerException(String workerName, String message, Throwable cause) {
        super("[" + workerName + "] " + message, cause);
        this.workerName = workerName;
    }

    public String getWorkerName() {
        return workerName;
    }
}
