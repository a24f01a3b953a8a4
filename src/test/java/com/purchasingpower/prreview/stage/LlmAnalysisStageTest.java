package com.purchasingpower.prreview.stage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.prreview.client.GeminiClient;
import com.purchasingpower.prreview.configuration.ReviewProperties;
import com.purchasingpower.prreview.exception.GeminiException;
import com.purchasingpower.prreview.model.diff.ChangeLine;
import com.purchasingpower.prreview.model.diff.FileDiff;
import com.purchasingpower.prreview.model.diff.Hunk;
import com.purchasingpower.prreview.model.review.ReviewCategory;
import com.purchasingpower.prreview.model.review.ReviewComment;
import com.purchasingpower.prreview.service.PromptLibraryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LLM Analysis Stage Tests")
class LlmAnalysisStageTest {

    @Mock
    private GeminiClient geminiClient;

    private LlmAnalysisStage stage;
    private ReviewProperties reviewProperties;

    @BeforeEach
    void setUp() {
        PromptLibraryService prompts = new PromptLibraryService();
        prompts.loadPrompts();
        reviewProperties = new ReviewProperties();
        stage = new LlmAnalysisStage("security-reviewer", ReviewCategory.SECURITY, "security-reviewer",
                geminiClient, prompts, new LlmFindingParser(new ObjectMapper()), reviewProperties);
    }

    @Test
    @DisplayName("Should render the changed lines into the prompt and stamp category and stage")
    void testAnalyze_ShouldPromptPerFileAndTagComments() {
        // Given
        FileDiff file = file("api/login.py",
                ChangeLine.context(9, "def login(req):"),
                ChangeLine.deletion(10, "    q = safe(req)"),
                ChangeLine.addition(10, "    q = \"SELECT * FROM u WHERE n='\" + req.name + \"'\""));
        when(geminiClient.generate(anyString(), eq("security-reviewer"))).thenReturn(
                "[{\"line_number\": 10, \"severity\": \"critical\", \"message\": \"SQL injection\"}]");

        // When
        List<ReviewComment> comments = stage.analyze(List.of(file), "python", null);

        // Then
        assertEquals(1, comments.size());
        assertEquals("api/login.py", comments.get(0).getFilePath());
        assertEquals("security", comments.get(0).getCategory());
        assertEquals("security-reviewer", comments.get(0).getSourceStage());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(geminiClient).generate(prompt.capture(), eq("security-reviewer"));
        assertThat(prompt.getValue())
                .contains("File: api/login.py")
                .contains("Language: python")
                .contains("Context: No additional context")
                .contains("+     q = \"SELECT * FROM u WHERE n='\" + req.name + \"'\" (line 10)")
                .contains("-     q = safe(req)")
                .doesNotContain("def login(req):");
    }

    @Test
    @DisplayName("Files with only context lines are not sent to the model")
    void testAnalyzeContextOnly_ShouldSkipFile() {
        // Given
        FileDiff file = file("a.py", ChangeLine.context(1, "x = 1"));

        // When
        List<ReviewComment> comments = stage.analyze(List.of(file), "python", "ctx");

        // Then
        assertThat(comments).isEmpty();
        verify(geminiClient, never()).generate(anyString(), anyString());
    }

    @Test
    @DisplayName("An unparseable answer costs only that file")
    void testAnalyzeBadAnswer_ShouldContinueWithNextFile() {
        // Given
        FileDiff first = file("a.py", ChangeLine.addition(1, "eval(x)"));
        FileDiff second = file("b.py", ChangeLine.addition(4, "os.system(cmd)"));
        when(geminiClient.generate(anyString(), anyString()))
                .thenReturn("Sorry, I cannot help with that")
                .thenReturn("[{\"severity\": \"error\", \"message\": \"Command injection\"}]");

        // When
        List<ReviewComment> comments = stage.analyze(List.of(first, second), "python", null);

        // Then
        assertThat(comments).extracting(ReviewComment::getFilePath).containsExactly("b.py");
        verify(geminiClient, times(2)).generate(anyString(), anyString());
    }

    @Test
    @DisplayName("A failed model call fails the stage")
    void testAnalyzeClientFailure_ShouldPropagate() {
        // Given
        when(geminiClient.generate(anyString(), anyString()))
                .thenThrow(new GeminiException("Gemini API call failed for stage: security-reviewer", null));

        // When / Then
        assertThrows(GeminiException.class,
                () -> stage.analyze(List.of(file("a.py", ChangeLine.addition(1, "x"))), "python", null));
    }

    @Test
    @DisplayName("Rendering stops at the configured number of changed lines")
    void testRenderChanges_ShouldRespectLimit() {
        // Given
        FileDiff file = file("big.py",
                ChangeLine.addition(1, "a"),
                ChangeLine.context(2, "b"),
                ChangeLine.addition(3, "c"),
                ChangeLine.deletion(3, "d"));

        // When
        String rendered = LlmAnalysisStage.renderChanges(file, 2);

        // Then
        assertEquals("+ a (line 1)\n+ c (line 3)", rendered);
    }

    private static FileDiff file(String path, ChangeLine... changes) {
        return new FileDiff(path, path, "python", List.of(new Hunk(1, 1, "", List.of(changes))));
    }
}
