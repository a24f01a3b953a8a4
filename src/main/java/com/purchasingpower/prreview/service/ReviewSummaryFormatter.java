package com.purchasingpower.prreview.service;

import com.purchasingpower.prreview.model.review.ReviewCategory;
import com.purchasingpower.prreview.model.review.ReviewReport;
import com.purchasingpower.prreview.model.review.ReviewSummary;
import com.purchasingpower.prreview.model.review.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One-paragraph, human-readable description of a report's counts.
 */
@Component
public class ReviewSummaryFormatter {

    static final String NO_ISSUES = "No issues found. Code looks good!";

    public String format(ReviewReport report) {
        ReviewSummary summary = report.getSummary();
        if (report.getTotalIssues() == 0) {
            return NO_ISSUES;
        }

        List<String> severities = new ArrayList<>();
        addCount(severities, summary.countOf(Severity.CRITICAL), "critical");
        addCount(severities, summary.countOf(Severity.ERROR), "error(s)");
        addCount(severities, summary.countOf(Severity.WARNING), "warning(s)");
        addCount(severities, summary.countOf(Severity.INFO), "info");

        List<String> categories = new ArrayList<>();
        for (Map.Entry<String, Long> entry : summary.getByCategory().entrySet()) {
            categories.add(label(entry.getKey()) + ": " + entry.getValue());
        }

        StringBuilder text = new StringBuilder("Found ").append(report.getTotalIssues()).append(" issue(s)");
        if (!severities.isEmpty()) {
            text.append(": ").append(String.join(", ", severities));
        }
        if (!categories.isEmpty()) {
            text.append("\nCategories: ").append(String.join(", ", categories));
        }
        return text.toString();
    }

    private static void addCount(List<String> parts, long count, String label) {
        if (count > 0) {
            parts.add(count + " " + label);
        }
    }

    private static String label(String category) {
        for (ReviewCategory known : ReviewCategory.values()) {
            if (known.getValue().equals(category)) {
                return known.getLabel();
            }
        }
        return category;
    }
}
