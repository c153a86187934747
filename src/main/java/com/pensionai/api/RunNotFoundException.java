package com.pensionai.api;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
    }
}
