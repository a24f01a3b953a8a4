package com.purchasingpower.prreview.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.prreview.model.review.ReviewComment;
import com.purchasingpower.prreview.model.review.ReviewSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Report shape handed to presentation layers. A failed run has status {@code error},
 * a human-readable summary and no comments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReviewResponse {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private String status;

    /**
     * Pull request metadata, present only when the diff was fetched.
     */
    private Map<String, Object> prInfo;

    @Builder.Default
    private List<ReviewComment> comments = new ArrayList<>();

    private String summary;

    private int totalIssues;

    /**
     * Per-severity and per-category counts.
     */
    private ReviewSummary statistics;

    @JsonIgnore
    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }

    public static ReviewResponse error(String summary) {
        return ReviewResponse.builder()
                .status(STATUS_ERROR)
                .summary(summary)
                .totalIssues(0)
                .build();
    }
}
