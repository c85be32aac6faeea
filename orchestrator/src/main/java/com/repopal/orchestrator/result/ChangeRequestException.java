package com.repopal.orchestrator.result;

/**
 * The repository adapter could not open a change request. Worth retrying.
 */
public class ChangeRequestException extends RuntimeException {

    public ChangeRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
