package com.pensionai.orchestration.service;

import com.pensionai.orchestration.model.StepName;

public class WorkerInvocationException extends RuntimeException {

    private final StepName workerId;

    public WorkerInvocationException(StepName workerId, Throwable cause) {
        super("Worker " + workerId.id() + " failed: " + cause.getMessage(), cause);
        this.workerId = workerId;
    }

    public StepName getWorkerId() {
        return workerId;
    }
}
