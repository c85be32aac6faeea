package com.repopal.orchestrator.executor;

/**
 * The authentication collaborator could not issue a credential.
 *
 * @see #isRevoked() true when the installation/credential is revoked or invalid, which no retry can fix
 */
public class CredentialException extends RuntimeException {

    private final boolean revoked;

    public CredentialException(String message, boolean revoked) {
        super(message);
        this.revoked = revoked;
    }

    public CredentialException(String message, boolean revoked, Throwable cause) {
        super(message, cause);
        this.revoked = revoked;
    }

    public boolean isRevoked() { return revoked; }
}
