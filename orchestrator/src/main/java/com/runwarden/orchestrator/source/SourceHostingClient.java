package com.runwarden.orchestrator.source;

/**
 * The one source-hosting operation the orchestrator performs itself.
 */
public interface SourceHostingClient {

    /**
     * Merge the pull request. A refusal by the host (conflicts, failing
     * checks, missing permission) comes back as an unsuccessful outcome.
     *
     * @throws SourceHostingException when the host is unreachable
     */
    MergeOutcome merge(String pullRequestUrl);
}
