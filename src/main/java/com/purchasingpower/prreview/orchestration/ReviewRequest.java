package com.purchasingpower.prreview.orchestration;

import lombok.Builder;
import lombok.Value;

/**
 * Input of a review run: either a remote reference or an inline diff, plus optional hints.
 * When both are present the remote reference wins.
 */
@Value
@Builder
public class ReviewRequest {

    /**
     * Remote change reference, e.g. {@code https://github.com/owner/repo/pull/7}.
     */
    String reference;

    /**
     * Credential for the remote fetch. Never logged in full and not kept on the run state.
     */
    String token;

    String inlineDiff;

    /**
     * Language hint; detected from the file paths when absent.
     */
    String language;

    String context;

    public static ReviewRequest forPullRequest(String url, String token) {
        return ReviewRequest.builder().reference(url).token(token).build();
    }

    public static ReviewRequest forDiff(String diff, String language, String context) {
        return ReviewRequest.builder().inlineDiff(diff).language(language).context(context).build();
    }

    public boolean hasReference() {
        return reference != null && !reference.isBlank();
    }

    @Override
    public String toString() {
        return "ReviewRequest[" + (hasReference() ? "reference=" + reference : "inline diff") + "]";
    }
}
