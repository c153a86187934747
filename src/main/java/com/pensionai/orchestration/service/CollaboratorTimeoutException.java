package com.pensionai.orchestration.service;

/**
 * Raised when a collaborator call does not answer before the run deadline. Never retried.
 */
public class CollaboratorTimeoutException extends RuntimeException {

    private final String collaborator;

    public CollaboratorTimeoutException(String collaborator, Throwable cause) {
        super("Collaborator " + collaborator + " did not answer before the run deadline", cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
