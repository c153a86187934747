package com.pensionai.orchestration.api;

import com.pensionai.orchestration.model.RequestContext;
import com.pensionai.orchestration.model.StepName;
import com.pensionai.orchestration.model.WorkerOutput;

/**
 * Runs one specialist worker. Implementations decide at their boundary whether the result
 * is plain text or text with a tool trace.
 */
public interface WorkerClient {

    /**
     * Executes a worker against the user's query.
     *
     * @param workerId The worker to run; always one of the worker steps.
     * @param queryText The most recent user message.
     * @param context Identity of the run, including the user the tools act on behalf of.
     * @return The worker's output.
     */
    WorkerOutput runWorker(StepName workerId, String queryText, RequestContext context);
}
