package com.purchasingpower.prreview.orchestration;

import com.purchasingpower.prreview.model.review.ReviewComment;
import com.purchasingpower.prreview.model.review.ReviewReport;
import com.purchasingpower.prreview.model.review.ReviewSummary;
import com.purchasingpower.prreview.model.review.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges the findings of all stages into one ranked report.
 *
 * <p>Duplicates are detected on (file path, message trimmed and lower-cased). Line number
 * and severity are not part of the key, so the same finding reported a line apart by two
 * stages collapses to the first one seen. Survivors are ordered by severity rank, then
 * file path, then line number (absent counts as 0).
 */
@Slf4j
@Component
public class CommentAggregator {

    static final String UNKNOWN = "unknown";

    private static final Comparator<ReviewComment> RANKING = Comparator
            .comparingInt((ReviewComment c) -> Severity.rankOf(c.getSeverity()))
            .thenComparing(c -> nullToEmpty(c.getFilePath()))
            .thenComparingInt(c -> c.getLineNumber() == null ? 0 : c.getLineNumber());

    public ReviewReport aggregate(List<ReviewComment> comments) {
        if (comments == null) {
            comments = List.of();
        }

        Set<String> seen = new HashSet<>();
        List<ReviewComment> unique = new ArrayList<>();
        for (ReviewComment comment : comments) {
            if (comment != null && seen.add(dedupKey(comment))) {
                unique.add(comment);
            }
        }

        // List.sort is stable, equal-ranked comments keep stage order
        unique.sort(RANKING);

        log.info("Aggregated {} unique comments from {} total", unique.size(), comments.size());
        return new ReviewReport(List.copyOf(unique), unique.size(), summarize(unique));
    }

    static String dedupKey(ReviewComment comment) {
        return nullToEmpty(comment.getFilePath()) + '\u0000'
                + nullToEmpty(comment.getMessage()).trim().toLowerCase(Locale.ROOT);
    }

    private static ReviewSummary summarize(List<ReviewComment> comments) {
        Map<String, Long> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity.getValue(), 0L);
        }
        Map<String, Long> byCategory = new LinkedHashMap<>();

        for (ReviewComment comment : comments) {
            String severity = comment.getSeverity() == null ? UNKNOWN : comment.getSeverity().getValue();
            bySeverity.merge(severity, 1L, Long::sum);

            String category = comment.getCategory() == null || comment.getCategory().isBlank()
                    ? UNKNOWN
                    : comment.getCategory();
            byCategory.merge(category, 1L, Long::sum);
        }
        return new ReviewSummary(comments.size(),
                Collections.unmodifiableMap(bySeverity),
                Collections.unmodifiableMap(byCategory));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
