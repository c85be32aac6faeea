package com.repopal.orchestrator.result;

/**
 * An ExecutionResult failed shape validation.
 */
public class InvalidResultException extends RuntimeException {

    public InvalidResultException(String message) {
        super(message);
    }
}
