package com.purchasingpower.prreview.model.review;

import lombok.Value;

import java.util.List;

/**
 * Terminal result of one pipeline run: ranked, deduplicated comments plus their counts.
 */
@Value
public class ReviewReport {
    List<ReviewComment> comments;
    int totalIssues;
    ReviewSummary summary;
}
