package com.purchasingpower.prreview.api;

import com.purchasingpower.prreview.model.dto.ReviewResponse;
import com.purchasingpower.prreview.model.review.ReviewCategory;
import com.purchasingpower.prreview.model.review.Severity;
import com.purchasingpower.prreview.service.ReviewService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for code reviews.
 *
 * <p>Both review endpoints answer with the same report shape; a failed review comes back
 * as HTTP 400 carrying {@code status=error} and the failure in {@code summary}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/review")
@RequiredArgsConstructor
public class ReviewController {

    private final ReviewService reviewService;

    /**
     * POST /api/v1/review/github
     */
    @PostMapping("/github")
    public ResponseEntity<ReviewResponse> reviewGitHubPullRequest(@Valid @RequestBody GitHubReviewRequest request) {
        log.info("Received GitHub PR review request: {}", request);
        return toEntity(reviewService.reviewPullRequest(request.getPrUrl(), request.getGithubToken()));
    }

    /**
     * POST /api/v1/review/diff
     */
    @PostMapping("/diff")
    public ResponseEntity<ReviewResponse> reviewDiff(@Valid @RequestBody DiffReviewRequest request) {
        log.info("Received diff review request ({} chars)", request.getDiff().length());
        return toEntity(reviewService.reviewDiff(request.getDiff(), request.getLanguage(), request.getContext()));
    }

    @GetMapping("/categories")
    public Map<String, List<Map<String, String>>> categories() {
        return Map.of("categories", Arrays.stream(ReviewCategory.values())
                .map(c -> describe(c.getValue(), c.getDescription()))
                .toList());
    }

    @GetMapping("/severities")
    public Map<String, List<Map<String, String>>> severities() {
        return Map.of("severities", Arrays.stream(Severity.values())
                .map(s -> describe(s.getValue(), s.getDescription()))
                .toList());
    }

    private static ResponseEntity<ReviewResponse> toEntity(ReviewResponse response) {
        if (!response.isSuccess()) {
            log.warn("Review finished with error: {}", response.getSummary());
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }

    private static Map<String, String> describe(String name, String description) {
        Map<String, String> entry = new LinkedHashMap<>();
        entry.put("name", name);
        entry.put("description", description);
        return entry;
    }
}
