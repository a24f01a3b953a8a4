package com.purchasingpower.prreview.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.prreview.configuration.AppProperties;
import com.purchasingpower.prreview.configuration.GitHubProperties;
import com.purchasingpower.prreview.exception.FetchException;
import com.purchasingpower.prreview.model.CallContext;
import com.purchasingpower.prreview.model.ServiceType;
import com.purchasingpower.prreview.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Fetches a pull request from the GitHub REST API and rebuilds a unified diff from the
 * per-file patches GitHub returns.
 */
@Slf4j
@Service
public class GitHubDiffSource implements DiffSource {

    static final int PAGE_SIZE = 100;

    private final GitHubProperties props;
    private final WebClient webClient;

    public GitHubDiffSource(WebClient.Builder builder, AppProperties appProperties) {
        this.props = appProperties.getGithub();
        this.webClient = builder.clone()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github.v3+json")
                .defaultHeader(HttpHeaders.USER_AGENT, "PR-Review-Orchestrator")
                .build();
    }

    @Override
    public FetchedDiff fetch(String reference, String token) {
        PullRequestReference pr = PullRequestReference.parse(reference);

        boolean userSupplied = token != null && !token.isBlank();
        String authToken = userSupplied ? token : props.getToken();
        if (authToken == null || authToken.isBlank()) {
            throw new FetchException("GitHub token not configured. "
                    + "For public repositories, set GITHUB_TOKEN. "
                    + "For private repositories, provide github_token in the request body.");
        }
        log.info("Using GitHub token from {} (masked: {})",
                userSupplied ? "request" : "configuration", ExternalCallLogger.maskToken(authToken));

        CallContext call = ExternalCallLogger.startCall(ServiceType.GITHUB, "fetchPullRequest", log);
        call.logRequest("Fetching PR #" + pr.getNumber() + " from " + pr.slug());

        try {
            JsonNode prNode = get(authToken, "/repos/{owner}/{repo}/pulls/{number}",
                    pr.getOwner(), pr.getRepo(), pr.getNumber());
            Map<String, Object> metadata = toMetadata(prNode);

            List<JsonNode> files = listFiles(authToken, pr);
            String diffText = assembleDiff(files);

            int changedFiles = prNode.path("changed_files").asInt(files.size());
            call.logResponse("Fetched PR data",
                    "Files Changed", changedFiles,
                    "Diff Length", diffText.length() + " chars");

            if (diffText.isEmpty() && changedFiles > 0) {
                throw new FetchException("No analyzable text changes found. The PR may contain only "
                        + "binary files (PDFs, images, docs) or large files.");
            }
            return new FetchedDiff(metadata, diffText);

        } catch (WebClientResponseException e) {
            FetchException failure = translate(e, pr, userSupplied);
            call.logError(failure.getMessage(), e);
            throw failure;
        } catch (FetchException e) {
            call.logError(e.getMessage(), null);
            throw e;
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                String message = "GitHub API request timed out after " + props.getTimeout().toSeconds() + " seconds";
                call.logError(message, e);
                throw new FetchException(message, e);
            }
            call.logError("Unexpected error", e);
            throw new FetchException("Error fetching PR data: " + e.getMessage(), e);
        }
    }

    private List<JsonNode> listFiles(String token, PullRequestReference pr) {
        List<JsonNode> all = new ArrayList<>();
        int page = 1;
        while (true) {
            JsonNode pageNode = get(token, "/repos/{owner}/{repo}/pulls/{number}/files?per_page={size}&page={page}",
                    pr.getOwner(), pr.getRepo(), pr.getNumber(), PAGE_SIZE, page);
            if (pageNode == null || !pageNode.isArray()) {
                break;
            }
            pageNode.forEach(all::add);
            if (pageNode.size() < PAGE_SIZE) {
                break;
            }
            page++;
        }
        return all;
    }

    private JsonNode get(String token, String uri, Object... variables) {
        return webClient.get()
                .uri(uri, variables)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(props.getTimeout())
                .block();
    }

    /**
     * Rebuilds a unified diff: for every file with a textual patch emit the old/new file
     * markers, the patch and a blank separator. Files without a patch (binary, too large)
     * are skipped.
     */
    static String assembleDiff(List<JsonNode> files) {
        List<String> parts = new ArrayList<>();
        for (JsonNode file : files) {
            String filename = file.path("filename").asText("");
            JsonNode patch = file.path("patch");
            if (patch.isTextual() && !patch.asText().isEmpty()) {
                parts.add("--- a/" + filename);
                parts.add("+++ b/" + filename);
                parts.add(patch.asText());
                parts.add("");
            } else {
                log.warn("No patch found for file: {} (status: {})", filename, file.path("status").asText(""));
            }
        }
        return String.join("\n", parts);
    }

    static Map<String, Object> toMetadata(JsonNode pr) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("number", pr.path("number").asInt());
        metadata.put("title", pr.path("title").asText(""));
        metadata.put("description", pr.path("body").isTextual() ? pr.path("body").asText() : "");
        metadata.put("author", pr.path("user").path("login").asText(""));
        metadata.put("state", pr.path("state").asText(""));
        metadata.put("base_branch", pr.path("base").path("ref").asText(""));
        metadata.put("head_branch", pr.path("head").path("ref").asText(""));
        metadata.put("files_changed", pr.path("changed_files").asInt());
        metadata.put("additions", pr.path("additions").asInt());
        metadata.put("deletions", pr.path("deletions").asInt());
        return metadata;
    }

    private static FetchException translate(WebClientResponseException e, PullRequestReference pr, boolean userSupplied) {
        int status = e.getStatusCode().value();
        String tokenHint = userSupplied
                ? ""
                : " If this is a private repository, provide your github_token in the request body.";
        String message = switch (status) {
            case 401 -> "GitHub authentication failed. Please check your token is valid and not expired." + tokenHint;
            case 403 -> "Access denied to repository '" + pr.slug() + "'. This may be a private repository. "
                    + "Ensure your GitHub token has access to this repository." + tokenHint;
            case 404 -> "Repository '" + pr.slug() + "' or PR #" + pr.getNumber() + " not found." + tokenHint;
            default -> "GitHub API error: HTTP " + status + " - " + ExternalCallLogger.truncate(e.getResponseBodyAsString(), 200);
        };
        return new FetchException(message, status, e);
    }
}
