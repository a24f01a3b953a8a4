package com.purchasingpower.prreview.api;

import com.purchasingpower.prreview.model.dto.ReviewResponse;
import com.purchasingpower.prreview.model.review.ReviewComment;
import com.purchasingpower.prreview.model.review.ReviewSummary;
import com.purchasingpower.prreview.model.review.Severity;
import com.purchasingpower.prreview.service.ReviewService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReviewController.class)
@DisplayName("Review Controller Tests")
class ReviewControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReviewService reviewService;

    @Test
    @DisplayName("Should review a pull request and answer in snake_case")
    void testReviewGitHub_ShouldReturnReport() throws Exception {
        // Given
        ReviewComment comment = ReviewComment.builder()
                .filePath("app.py")
                .lineNumber(4)
                .severity(Severity.ERROR)
                .category("logic")
                .message("Division by zero")
                .sourceStage("logic-reviewer")
                .build();
        ReviewResponse response = ReviewResponse.builder()
                .status(ReviewResponse.STATUS_SUCCESS)
                .prInfo(Map.of("number", 5))
                .comments(List.of(comment))
                .totalIssues(1)
                .summary("Found 1 issue(s): 1 error(s)\nCategories: Logic: 1")
                .statistics(new ReviewSummary(1, Map.of("error", 1L), Map.of("logic", 1L)))
                .build();
        when(reviewService.reviewPullRequest("https://github.com/a/b/pull/5", "tkn")).thenReturn(response);

        // When / Then
        mockMvc.perform(post("/api/v1/review/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pr_url\": \"https://github.com/a/b/pull/5\", \"github_token\": \"tkn\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.total_issues").value(1))
                .andExpect(jsonPath("$.pr_info.number").value(5))
                .andExpect(jsonPath("$.comments[0].file_path").value("app.py"))
                .andExpect(jsonPath("$.comments[0].line_number").value(4))
                .andExpect(jsonPath("$.comments[0].severity").value("error"))
                .andExpect(jsonPath("$.comments[0].source_stage").value("logic-reviewer"))
                .andExpect(jsonPath("$.statistics.by_category.logic").value(1));
    }

    @Test
    @DisplayName("A failed review answers 400 with the error report")
    void testReviewDiffFailure_ShouldReturnBadRequest() throws Exception {
        // Given
        when(reviewService.reviewDiff(any(), isNull(), isNull()))
                .thenReturn(ReviewResponse.error("Review failed: No diff content available to parse"));

        // When / Then
        mockMvc.perform(post("/api/v1/review/diff")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"diff\": \"not a diff\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.summary").value("Review failed: No diff content available to parse"));
    }

    @Test
    @DisplayName("Should pass language and context through")
    void testReviewDiff_ShouldPassHints() throws Exception {
        // Given
        when(reviewService.reviewDiff("d", "java", "billing"))
                .thenReturn(ReviewResponse.builder().status(ReviewResponse.STATUS_SUCCESS).summary("ok").build());

        // When / Then
        mockMvc.perform(post("/api/v1/review/diff")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"diff\": \"d\", \"language\": \"java\", \"context\": \"billing\"}"))
                .andExpect(status().isOk());
        verify(reviewService).reviewDiff("d", "java", "billing");
    }

    @Test
    @DisplayName("Missing required fields are rejected before reaching the service")
    void testMissingFields_ShouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/review/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.summary").value("Invalid request: pr_url is required"));

        mockMvc.perform(post("/api/v1/review/diff")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"diff\": \"\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(reviewService);
    }

    @Test
    @DisplayName("Malformed JSON is a bad request")
    void testMalformedJson_ShouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/review/diff")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{diff"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    @DisplayName("An unexpected exception answers 500")
    void testUnexpectedException_ShouldReturnServerError() throws Exception {
        when(reviewService.reviewDiff(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/v1/review/diff")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"diff\": \"d\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.summary").value("Unexpected error: boom"));
    }

    @Test
    @DisplayName("Should list categories and severities")
    void testReferenceEndpoints_ShouldListValues() throws Exception {
        mockMvc.perform(get("/api/v1/review/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories.length()").value(4))
                .andExpect(jsonPath("$.categories[0].name").value("logic"));

        mockMvc.perform(get("/api/v1/review/severities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.severities.length()").value(4))
                .andExpect(jsonPath("$.severities[0].name").value("critical"))
                .andExpect(jsonPath("$.severities[3].description").isNotEmpty());
    }
}
