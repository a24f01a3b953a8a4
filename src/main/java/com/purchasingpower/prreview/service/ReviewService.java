package com.purchasingpower.prreview.service;

import com.purchasingpower.prreview.model.dto.ReviewResponse;
import com.purchasingpower.prreview.model.review.ReviewReport;
import com.purchasingpower.prreview.orchestration.ReviewOrchestrator;
import com.purchasingpower.prreview.orchestration.ReviewRequest;
import com.purchasingpower.prreview.orchestration.ReviewRunState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for reviews: runs the orchestrator and turns the final run state into a
 * {@link ReviewResponse}. Fatal run errors come back as error-status responses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewService {

    private final ReviewOrchestrator orchestrator;
    private final ReviewSummaryFormatter summaryFormatter;

    public ReviewResponse reviewPullRequest(String prUrl, String githubToken) {
        log.info("Starting review workflow for PR: {}", prUrl);
        return runReview(ReviewRequest.forPullRequest(prUrl, githubToken));
    }

    public ReviewResponse reviewDiff(String diff, String language, String context) {
        log.info("Starting review workflow for inline diff (language: {})", language == null ? "auto" : language);
        return runReview(ReviewRequest.forDiff(diff, language, context));
    }

    public ReviewResponse runReview(ReviewRequest request) {
        try {
            ReviewRunState state = orchestrator.run(request);
            if (!state.isSucceeded()) {
                return ReviewResponse.error("Review failed: " + state.getError());
            }
            return toResponse(state);
        } catch (RuntimeException e) {
            log.error("Unexpected error during review of {}", request, e);
            return ReviewResponse.error("Unexpected error: " + e.getMessage());
        }
    }

    private ReviewResponse toResponse(ReviewRunState state) {
        ReviewReport report = state.getReport();
        return ReviewResponse.builder()
                .status(ReviewResponse.STATUS_SUCCESS)
                .prInfo(state.getMetadata())
                .comments(report.getComments())
                .summary(summaryFormatter.format(report))
                .totalIssues(report.getTotalIssues())
                .statistics(report.getSummary())
                .build();
    }
}
