package com.runwarden.orchestrator.source;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * owner/repo/number parsed out of a pull request URL such as
 * {@code https://github.com/acme/shop/pull/42}.
 */
public record PullRequestRef(String owner, String repo, int number) {

    private static final Pattern PR_URL =
            Pattern.compile("^https?://[^/]+/([^/]+)/([^/]+)/pulls?/(\\d+)(?:[/?#].*)?$");

    public static Optional<PullRequestRef> parse(String url) {
        if (url == null) return Optional.empty();
        Matcher m = PR_URL.matcher(url.trim());
        if (!m.matches()) return Optional.empty();
        return Optional.of(new PullRequestRef(m.group(1), m.group(2), Integer.parseInt(m.group(3))));
    }
}
