package com.purchasingpower.prreview.source;

import com.purchasingpower.prreview.exception.FetchException;
import lombok.Value;

import java.net.URI;

/**
 * Owner, repository and number of a GitHub pull request.
 *
 * Accepted shapes:
 * - https://github.com/owner/repo/pull/123
 * - https://github.com/owner/repo/pull/123/
 * - https://github.com/owner/repo/pull/123/files
 */
@Value
public class PullRequestReference {
    String owner;
    String repo;
    int number;

    public static PullRequestReference parse(String url) {
        if (url == null || url.isBlank()) {
            throw new FetchException("Pull request URL is required");
        }

        String path;
        try {
            path = URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException e) {
            throw new FetchException("Invalid GitHub PR URL format: " + url, e);
        }
        if (path == null) {
            throw new FetchException("Invalid GitHub PR URL format: " + url);
        }

        // ["", owner, repo, "pull", number, ...]
        String[] parts = path.split("/");
        if (parts.length < 5 || !"pull".equals(parts[3]) || parts[1].isEmpty() || parts[2].isEmpty()) {
            throw new FetchException("Invalid GitHub PR URL format: " + url);
        }

        try {
            int number = Integer.parseInt(parts[4]);
            if (number <= 0) {
                throw new FetchException("Invalid GitHub PR URL format: " + url);
            }
            return new PullRequestReference(parts[1], parts[2], number);
        } catch (NumberFormatException e) {
            throw new FetchException("Invalid GitHub PR URL format: " + url, e);
        }
    }

    public String slug() {
        return owner + "/" + repo;
    }
}
