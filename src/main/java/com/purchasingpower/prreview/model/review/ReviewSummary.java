package com.purchasingpower.prreview.model.review;

import lombok.Value;

import java.util.Map;

/**
 * Counts derived from the deduplicated comment list.
 * Map iteration order is severity rank order and first-seen category order respectively.
 */
@Value
public class ReviewSummary {
    int totalIssues;
    Map<String, Long> bySeverity;
    Map<String, Long> byCategory;

    public long countOf(Severity severity) {
        return bySeverity.getOrDefault(severity.getValue(), 0L);
    }

    public long countOf(String category) {
        return byCategory.getOrDefault(category, 0L);
    }
}
