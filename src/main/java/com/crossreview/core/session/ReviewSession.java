package com.crossreview.core.session;

import com.crossreview.core.llm.CancellationToken;
import com.crossreview.core.model.FileClassification;
import com.crossreview.core.model.Finding;
import com.crossreview.core.model.ReviewStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Mutable state of one review session.
 * <p>
 * Reads are thread-safe snapshots. Writes only happen inside {@link #commit}, which runs the
 * mutation under the session's monitor and only while the session is still active. Cancelling
 * or replacing a session takes the same monitor, so once {@link #deactivate()} returns no
 * further commit (and therefore no cache write or event issued from one) can happen.
 */
public class ReviewSession {

    private static final Logger log = LoggerFactory.getLogger(ReviewSession.class);

    private final String id;
    private final String projectPath;
    private final List<String> files;
    private final CancellationToken token = new CancellationToken();
    private final Instant createdAt;

    private boolean active = true;
    private ReviewStage stage = ReviewStage.CREATED;
    private List<FileClassification> classifications = List.of();
    private List<String> lowRiskFiles = List.of();
    private List<String> highRiskFiles = List.of();
    private int highRiskCursor;
    private final List<Finding> findings = new ArrayList<>();
    private String lastError;
    private Instant updatedAt;

    public ReviewSession(String id, String projectPath, List<String> files) {
        this.id = id;
        this.projectPath = projectPath;
        this.files = List.copyOf(files);
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    /**
     * Applies {@code mutation} if the session is still active.
     *
     * @return false when the session was cancelled or replaced and the mutation was discarded
     */
    public synchronized boolean commit(Consumer<ReviewSession> mutation) {
        if (!active) {
            log.debug("Discarding commit for inactive session {}", id);
            return false;
        }
        mutation.accept(this);
        updatedAt = Instant.now();
        return true;
    }

    /**
     * Marks the session inactive and cancels its token. Waits for an in-progress commit to finish.
     */
    void deactivate() {
        synchronized (this) {
            if (!active) {
                return;
            }
            active = false;
            if (stage != ReviewStage.CANCELLED) {
                stage = ReviewStage.CANCELLED;
            }
            updatedAt = Instant.now();
        }
        token.cancel();
    }

    /**
     * Moves to {@code next}. Only valid inside {@link #commit}.
     *
     * @throws IllegalStateException if the state machine does not allow the transition
     */
    public void transitionTo(ReviewStage next) {
        if (!stage.canTransitionTo(next)) {
            throw new IllegalStateException("Session " + id + " cannot move from " + stage + " to " + next);
        }
        log.debug("Session {} {} -> {}", id, stage, next);
        stage = next;
    }

    public void setClassifications(List<FileClassification> classifications) {
        this.classifications = List.copyOf(classifications);
    }

    public void setPartition(List<String> lowRisk, List<String> highRisk) {
        this.lowRiskFiles = List.copyOf(lowRisk);
        this.highRiskFiles = List.copyOf(highRisk);
        this.highRiskCursor = 0;
    }

    public void advanceCursor() {
        highRiskCursor++;
    }

    public void addFindings(List<Finding> newFindings) {
        findings.addAll(newFindings);
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public String getId() {
        return id;
    }

    public String getProjectPath() {
        return projectPath;
    }

    public List<String> getFiles() {
        return files;
    }

    public CancellationToken getToken() {
        return token;
    }

    public synchronized boolean isActive() {
        return active;
    }

    public synchronized ReviewStage getStage() {
        return stage;
    }

    public synchronized List<FileClassification> getClassifications() {
        return classifications;
    }

    public synchronized List<String> getLowRiskFiles() {
        return lowRiskFiles;
    }

    public synchronized List<String> getHighRiskFiles() {
        return highRiskFiles;
    }

    public synchronized int getHighRiskCursor() {
        return highRiskCursor;
    }

    public synchronized List<Finding> getFindings() {
        return List.copyOf(findings);
    }

    public synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(id, projectPath, files, stage, classifications, lowRiskFiles,
                highRiskFiles, highRiskCursor, List.copyOf(findings), lastError, createdAt, updatedAt);
    }
}
