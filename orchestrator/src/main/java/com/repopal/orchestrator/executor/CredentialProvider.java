package com.repopal.orchestrator.executor;

/**
 * External authentication collaborator: issues short-lived repository credentials.
 */
public interface CredentialProvider {

    /**
     * @param repository "owner/name"
     * @throws CredentialException if no credential can be issued
     */
    RepositoryCredential issue(String repository);
}
