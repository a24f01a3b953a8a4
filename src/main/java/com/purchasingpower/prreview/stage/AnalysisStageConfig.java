package com.purchasingpower.prreview.stage;

import com.purchasingpower.prreview.client.GeminiClient;
import com.purchasingpower.prreview.configuration.AppProperties;
import com.purchasingpower.prreview.model.review.ReviewCategory;
import com.purchasingpower.prreview.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

/**
 * Registers the built-in reviewers. The orchestrator receives every {@link AnalysisStage}
 * bean, so adding a stage is a matter of declaring one more bean.
 */
@Configuration
@RequiredArgsConstructor
public class AnalysisStageConfig {

    private final GeminiClient geminiClient;
    private final PromptLibraryService promptLibrary;
    private final LlmFindingParser findingParser;
    private final AppProperties props;

    @Bean
    @Order(1)
    public AnalysisStage logicReviewer() {
        return stage("logic-reviewer", ReviewCategory.LOGIC);
    }

    @Bean
    @Order(2)
    public AnalysisStage securityReviewer() {
        return stage("security-reviewer", ReviewCategory.SECURITY);
    }

    @Bean
    @Order(3)
    public AnalysisStage performanceReviewer() {
        return stage("performance-reviewer", ReviewCategory.PERFORMANCE);
    }

    @Bean
    @Order(4)
    public AnalysisStage readabilityReviewer() {
        return stage("readability-reviewer", ReviewCategory.READABILITY);
    }

    private AnalysisStage stage(String name, ReviewCategory category) {
        return new LlmAnalysisStage(name, category, name, geminiClient, promptLibrary, findingParser, props.getReview());
    }
}
