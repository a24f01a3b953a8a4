package com.purchasingpower.prreview.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.prreview.configuration.AppProperties;
import com.purchasingpower.prreview.exception.FetchException;
import com.purchasingpower.prreview.model.diff.FileDiff;
import com.purchasingpower.prreview.parser.LanguageClassifier;
import com.purchasingpower.prreview.parser.UnifiedDiffParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("GitHub Diff Source Tests")
class GitHubDiffSourceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should rebuild a parseable diff from per-file patches, skipping binaries")
    void testAssembleDiff_ShouldProduceParseableText() throws Exception {
        // Given
        List<JsonNode> files = new ArrayList<>();
        mapper.readTree("""
                [
                  {"filename": "app/main.py", "status": "modified",
                   "patch": "@@ -1,2 +1,2 @@\\n import os\\n-print(1)\\n+print(2)"},
                  {"filename": "docs/logo.png", "status": "added"},
                  {"filename": "web/app.ts", "status": "added",
                   "patch": "@@ -0,0 +1 @@\\n+export const x = 1;"}
                ]
                """).forEach(files::add);

        // When
        String diff = GitHubDiffSource.assembleDiff(files);
        List<FileDiff> parsed = new UnifiedDiffParser(new LanguageClassifier()).parse(diff);

        // Then
        assertThat(diff).startsWith("--- a/app/main.py\n+++ b/app/main.py\n@@ -1,2 +1,2 @@");
        assertThat(diff).doesNotContain("logo.png");
        assertThat(parsed).extracting(FileDiff::getPath).containsExactly("app/main.py", "web/app.ts");
        assertThat(parsed).extracting(FileDiff::getLanguage).containsExactly("python", "typescript");
    }

    @Test
    @DisplayName("No patches at all assemble to empty text")
    void testAssembleDiffNoPatches_ShouldBeEmpty() throws Exception {
        List<JsonNode> files = new ArrayList<>();
        mapper.readTree("[{\"filename\": \"a.bin\"}]").forEach(files::add);

        assertEquals("", GitHubDiffSource.assembleDiff(files));
    }

    @Test
    @DisplayName("Should flatten the pull request payload into metadata")
    void testToMetadata_ShouldExtractFields() throws Exception {
        // Given
        JsonNode pr = mapper.readTree("""
                {"number": 5, "title": "Add reports", "body": null, "state": "open",
                 "user": {"login": "octo"}, "base": {"ref": "main"}, "head": {"ref": "feature/reports"},
                 "changed_files": 3, "additions": 40, "deletions": 2}
                """);

        // When
        Map<String, Object> metadata = GitHubDiffSource.toMetadata(pr);

        // Then
        assertEquals(5, metadata.get("number"));
        assertEquals("Add reports", metadata.get("title"));
        assertEquals("", metadata.get("description"));
        assertEquals("octo", metadata.get("author"));
        assertEquals("main", metadata.get("base_branch"));
        assertEquals("feature/reports", metadata.get("head_branch"));
        assertEquals(3, metadata.get("files_changed"));
        assertEquals(40, metadata.get("additions"));
        assertEquals(2, metadata.get("deletions"));
    }

    @Test
    @DisplayName("Should refuse to fetch without any token")
    void testFetchWithoutToken_ShouldThrow() {
        // Given
        GitHubDiffSource source = new GitHubDiffSource(WebClient.builder(), new AppProperties());

        // When / Then
        assertThatThrownBy(() -> source.fetch("https://github.com/acme/shop/pull/7", null))
                .isInstanceOf(FetchException.class)
                .hasMessageStartingWith("GitHub token not configured");
    }

    @Test
    @DisplayName("Should reject a malformed URL before any network call")
    void testFetchBadUrl_ShouldThrow() {
        GitHubDiffSource source = new GitHubDiffSource(WebClient.builder(), new AppProperties());

        assertThatThrownBy(() -> source.fetch("https://github.com/acme/shop", "tkn"))
                .isInstanceOf(FetchException.class)
                .hasMessageStartingWith("Invalid GitHub PR URL format");
    }
}
