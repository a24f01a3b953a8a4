package com.purchasingpower.prreview.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to review a GitHub pull request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GitHubReviewRequest {

    /**
     * e.g. {@code https://github.com/owner/repo/pull/123}
     */
    @NotBlank(message = "pr_url is required")
    private String prUrl;

    /**
     * Overrides the configured token, needed for private repositories.
     */
    private String githubToken;

    @Override
    public String toString() {
        return "GitHubReviewRequest(prUrl=" + prUrl + ", githubToken=" + (githubToken == null ? "none" : "****") + ")";
    }
}
