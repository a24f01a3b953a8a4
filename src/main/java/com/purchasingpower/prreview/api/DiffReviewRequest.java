package com.purchasingpower.prreview.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiffReviewRequest {

    @NotBlank(message = "diff is required")
    private String diff;

    /**
     * Detected from the file paths when absent.
     */
    private String language;

    private String context;
}
