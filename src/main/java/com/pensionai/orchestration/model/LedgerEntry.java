package com.pensionai.orchestration.model;

/**
 * One tool invocation performed by a worker. Payloads are kept verbatim.
 */
public record LedgerEntry(String workerName, String toolName, String inputPayload, String outputPayload) {

    public LedgerEntry {
        workerName = workerName == null ? "" : workerName;
        toolName = toolName == null ? "unknown" : toolName;
        inputPayload = inputPayload == null ? "" : inputPayload;
        outputPayload = outputPayload == null ? "" : outputPayload;
    }
}
