package com.repopal.orchestrator.executor;

import com.repopal.orchestrator.config.RepoPalProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Hands out the token from {@code repopal.git.token}, or anonymous access when it is blank.
 *
 * Stands in for an app-installation token service; a deployment that has one
 * registers it as a {@code @Primary} {@link CredentialProvider}.
 */
@Component
public class ConfiguredCredentialProvider implements CredentialProvider {

    private final RepoPalProperties.Git git;

    public ConfiguredCredentialProvider(RepoPalProperties properties) {
        this.git = properties.getGit();
    }

    @Override
    public RepositoryCredential issue(String repository) {
        if (git.getToken() == null || git.getToken().isBlank()) {
            return RepositoryCredential.anonymous();
        }
        return new RepositoryCredential(git.getToken(), Instant.now().plusSeconds(git.getTokenTtlSeconds()));
    }
}
