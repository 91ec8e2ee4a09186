package com.runwarden.orchestrator.source;

/**
 * Result of asking the source host to merge a pull request.
 * sha is the merge commit when the merge went through.
 */
public record MergeOutcome(boolean success, String sha, String message) {

    public static MergeOutcome merged(String sha) {
        return new MergeOutcome(true, sha, null);
    }

    public static MergeOutcome refused(String message) {
        return new MergeOutcome(false, null, message);
    }
}
