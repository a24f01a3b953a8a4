package com.purchasingpower.prreview.orchestration;

import com.purchasingpower.prreview.model.diff.FileDiff;
import com.purchasingpower.prreview.model.review.ReviewReport;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one review run, owned by the coordinating thread.
 *
 * <p>Stages never see this object; they get an immutable snapshot of the parsed files.
 * Phase changes go through {@link #transitionTo} so illegal jumps fail fast.
 */
@Getter
public class ReviewRunState {

    private final ReviewRequest request;
    private ReviewPhase phase = ReviewPhase.START;

    @Setter
    private String language;

    @Setter
    private String diffText;

    @Setter
    private Map<String, Object> metadata;

    private List<FileDiff> files = List.of();
    private final List<StageDiagnostic> stageDiagnostics = new ArrayList<>();
    private ReviewReport report;
    private String error;

    public ReviewRunState(ReviewRequest request) {
        this.request = request;
        this.language = request.getLanguage();
        this.diffText = request.getInlineDiff();
    }

    public void transitionTo(ReviewPhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal review phase transition " + phase + " -> " + next);
        }
        phase = next;
    }

    public void fail(String error) {
        transitionTo(ReviewPhase.FAILED);
        this.error = error;
    }

    public void complete(ReviewReport report) {
        transitionTo(ReviewPhase.DONE);
        this.report = report;
    }

    public void setFiles(List<FileDiff> files) {
        this.files = List.copyOf(files);
    }

    public void addStageDiagnostic(StageDiagnostic diagnostic) {
        stageDiagnostics.add(diagnostic);
    }

    public List<StageDiagnostic> getStageDiagnostics() {
        return Collections.unmodifiableList(stageDiagnostics);
    }

    public boolean isSucceeded() {
        return phase == ReviewPhase.DONE;
    }
}
