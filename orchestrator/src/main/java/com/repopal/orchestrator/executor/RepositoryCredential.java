package com.repopal.orchestrator.executor;

import java.time.Instant;

/**
 * Short-lived repository access token. Held in memory for one execution only;
 * never written to disk, logged, or passed into the sandbox.
 *
 * @param token null for anonymous access
 */
public record RepositoryCredential(String token, Instant expiresAt) {

    public static RepositoryCredential anonymous() {
        return new RepositoryCredential(null, Instant.MAX);
    }

    public boolean isAnonymous() {
        return token == null || token.isBlank();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "RepositoryCredential[token=" + (isAnonymous() ? "none" : "****") + ", expiresAt=" + expiresAt + "]";
    }
}
