package com.purchasingpower.prreview;

import com.purchasingpower.prreview.orchestration.ReviewOrchestrator;
import com.purchasingpower.prreview.service.PromptLibraryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@DisplayName("Application Context Tests")
class PrReviewOrchestratorApplicationTest {

    @Autowired
    private ReviewOrchestrator orchestrator;

    @Autowired
    private PromptLibraryService promptLibrary;

    @Test
    @DisplayName("Should register the four reviewers in order, each with a prompt")
    void testContext_ShouldWireReviewers() {
        assertThat(orchestrator.stageNames()).containsExactly(
                "logic-reviewer", "security-reviewer", "performance-reviewer", "readability-reviewer");
        orchestrator.stageNames().forEach(name -> assertThat(promptLibrary.hasTemplate(name)).isTrue());
    }
}
