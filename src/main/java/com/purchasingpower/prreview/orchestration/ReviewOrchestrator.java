package com.purchasingpower.prreview.orchestration;

import com.purchasingpower.prreview.configuration.AppProperties;
import com.purchasingpower.prreview.configuration.ReviewProperties;
import com.purchasingpower.prreview.exception.DiffParseException;
import com.purchasingpower.prreview.exception.FetchException;
import com.purchasingpower.prreview.exception.StageExecutionException;
import com.purchasingpower.prreview.model.diff.FileDiff;
import com.purchasingpower.prreview.model.review.ReviewComment;
import com.purchasingpower.prreview.model.review.ReviewReport;
import com.purchasingpower.prreview.parser.LanguageClassifier;
import com.purchasingpower.prreview.parser.UnifiedDiffParser;
import com.purchasingpower.prreview.source.DiffSource;
import com.purchasingpower.prreview.source.FetchedDiff;
import com.purchasingpower.prreview.stage.AnalysisStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one review: optional fetch, parse, fan-out to every registered stage, join, aggregate.
 *
 * <p>Only a failed fetch or an empty diff fails the run. Each stage runs on the stage
 * executor under its own timeout, counted from dispatch; a stage that throws or overruns
 * contributes nothing, gets a {@link StageDiagnostic}, and its task is cancelled without
 * touching the others. The join waits for every stage (or its deadline) before aggregating.
 * Stage outputs are concatenated in registration order, which keeps deduplication deterministic.
 */
@Slf4j
@Service
public class ReviewOrchestrator {

    private final List<AnalysisStage> stages;
    private final DiffSource diffSource;
    private final UnifiedDiffParser diffParser;
    private final LanguageClassifier languageClassifier;
    private final CommentAggregator aggregator;
    private final AsyncTaskExecutor stageExecutor;
    private final ReviewProperties reviewProperties;

    public ReviewOrchestrator(List<AnalysisStage> stages,
                              DiffSource diffSource,
                              UnifiedDiffParser diffParser,
                              LanguageClassifier languageClassifier,
                              CommentAggregator aggregator,
                              @Qualifier("reviewStageExecutor") AsyncTaskExecutor stageExecutor,
                              AppProperties appProperties) {
        this.stages = List.copyOf(stages);
        this.diffSource = diffSource;
        this.diffParser = diffParser;
        this.languageClassifier = languageClassifier;
        this.aggregator = aggregator;
        this.stageExecutor = stageExecutor;
        this.reviewProperties = appProperties.getReview();
    }

    public ReviewRunState run(ReviewRequest request) {
        ReviewRunState state = new ReviewRunState(request);
        log.info("Starting review run for {} with {} stage(s)", request, stages.size());

        if (request.hasReference() && !fetch(state)) {
            return state;
        }
        if (!parse(state)) {
            return state;
        }

        List<ReviewComment> comments = dispatch(state);

        state.transitionTo(ReviewPhase.AGGREGATING);
        ReviewReport report = aggregator.aggregate(comments);
        state.complete(report);

        log.info("Review run done: {} issue(s), stage outcomes {}", report.getTotalIssues(), summarize(state));
        return state;
    }

    private boolean fetch(ReviewRunState state) {
        state.transitionTo(ReviewPhase.FETCHING);
        ReviewRequest request = state.getRequest();
        try {
            FetchedDiff fetched = diffSource.fetch(request.getReference(), request.getToken());
            state.setMetadata(fetched.getMetadata());
            state.setDiffText(fetched.getDiffText());
            return true;
        } catch (FetchException e) {
            log.error("Fetch failed for {}: {}", request.getReference(), e.getMessage());
            state.fail(e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Diff source raised an unexpected error for {}", request.getReference(), e);
            state.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return false;
        }
    }

    private boolean parse(ReviewRunState state) {
        state.transitionTo(ReviewPhase.PARSING);
        try {
            state.setFiles(diffParser.parse(state.getDiffText()));
        } catch (DiffParseException e) {
            log.error("Parse failed: {}", e.getMessage());
            state.fail(e.getMessage());
            return false;
        }

        if (state.getLanguage() == null || state.getLanguage().isBlank()) {
            state.setLanguage(languageClassifier.classifyPrimary(
                    state.getFiles().stream().map(FileDiff::getPath).toList()));
        }
        log.info("Parsed {} file(s), language: {}", state.getFiles().size(), state.getLanguage());
        return true;
    }

    private List<ReviewComment> dispatch(ReviewRunState state) {
        state.transitionTo(ReviewPhase.DISPATCHED);

        List<FileDiff> files = state.getFiles();
        String language = state.getLanguage();
        String context = state.getRequest().getContext();

        long dispatchedAt = System.nanoTime();
        List<PendingStage> pending = new ArrayList<>(stages.size());
        for (AnalysisStage stage : stages) {
            pending.add(submit(stage, files, language, context));
        }

        List<ReviewComment> all = new ArrayList<>();
        for (PendingStage stage : pending) {
            all.addAll(join(stage, dispatchedAt, state));
        }
        return all;
    }

    private PendingStage submit(AnalysisStage stage, List<FileDiff> files, String language, String context) {
        Duration timeout = reviewProperties.timeoutFor(stage.getName());
        try {
            Future<List<ReviewComment>> future = stageExecutor.submit(() -> {
                List<ReviewComment> comments = stage.analyze(files, language, context);
                return comments == null ? List.<ReviewComment>of() : comments;
            });
            return new PendingStage(stage.getName(), timeout, future, null);
        } catch (TaskRejectedException e) {
            return new PendingStage(stage.getName(), timeout, null, e);
        }
    }

    private List<ReviewComment> join(PendingStage stage, long dispatchedAt, ReviewRunState state) {
        String name = stage.name();
        if (stage.future() == null) {
            recordFailure(state, StageExecutionException.failure(name, stage.rejection()), 0);
            return List.of();
        }

        long deadline = dispatchedAt + stage.timeout().toNanos();
        try {
            List<ReviewComment> comments = stage.future().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            long elapsedMs = elapsedMs(dispatchedAt);
            state.addStageDiagnostic(StageDiagnostic.succeeded(name, comments.size(), elapsedMs));
            log.debug("Stage {} returned {} comment(s) in {}ms", name, comments.size(), elapsedMs);
            return comments;

        } catch (TimeoutException e) {
            stage.future().cancel(true);
            recordFailure(state, StageExecutionException.timeout(name, stage.timeout().toMillis()), elapsedMs(dispatchedAt));
        } catch (ExecutionException e) {
            recordFailure(state, StageExecutionException.failure(name, e.getCause()), elapsedMs(dispatchedAt));
        } catch (CancellationException e) {
            recordFailure(state, StageExecutionException.failure(name, e), elapsedMs(dispatchedAt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stage.future().cancel(true);
            recordFailure(state, StageExecutionException.failure(name, e), elapsedMs(dispatchedAt));
        }
        return List.of();
    }

    private void recordFailure(ReviewRunState state, StageExecutionException failure, long elapsedMs) {
        if (failure.isTimedOut()) {
            log.warn("{}, continuing without its findings", failure.getMessage());
            state.addStageDiagnostic(StageDiagnostic.timedOut(failure.getStageName(), elapsedMs, failure.getMessage()));
        } else {
            log.warn("{}, continuing without its findings", failure.getMessage(), failure.getCause());
            state.addStageDiagnostic(StageDiagnostic.failed(failure.getStageName(), elapsedMs, failure.getMessage()));
        }
    }

    private static long elapsedMs(long since) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - since);
    }

    private static String summarize(ReviewRunState state) {
        return state.getStageDiagnostics().stream()
                .map(d -> d.getStageName() + "=" + d.getOutcome())
                .toList()
                .toString();
    }

    public List<String> stageNames() {
        return stages.stream().map(AnalysisStage::getName).toList();
    }

    private record PendingStage(String name,
                                Duration timeout,
                                Future<List<ReviewComment>> future,
                                TaskRejectedException rejection) {
    }
}
