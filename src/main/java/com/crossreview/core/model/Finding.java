package com.crossreview.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single review finding.
 * <p>
 * Low-risk findings carry no {@code verificationStatus}; high-risk findings only ever leave
 * the pipeline with {@link VerificationStatus#VERIFIED}.
 *
 * @param id                 unique within the session (null until the orchestrator assigns one)
 * @param fileIdentity       identity of the file the finding belongs to
 * @param path               normalized project-relative path
 * @param line               first line (1-based)
 * @param endLine            last line, nullable
 * @param severity           critical, error, warning or suggestion
 * @param category           free-form category, e.g. "Security"
 * @param title              short title
 * @param description        explanation of the issue
 * @param suggestion         how to fix it, nullable
 * @param aiPrompt           copyable prompt asking an agent to fix it, nullable
 * @param codeChange         exact old/new code, nullable
 * @param confidence         consensus confidence, nullable for low-risk findings
 * @param sourceAgents       ids of the reviewers that reported the issue
 * @param verificationStatus verified/rejected, nullable for low-risk findings
 * @param verification       the verifier's result, nullable
 * @param cached             true when served from the review cache
 */
public record Finding(
    String id,
    FileIdentity fileIdentity,
    String path,
    int line,
    Integer endLine,
    Severity severity,
    String category,
    String title,
    String description,
    String suggestion,
    String aiPrompt,
    CodeChange codeChange,
    Double confidence,
    Set<String> sourceAgents,
    VerificationStatus verificationStatus,
    VerificationResult verification,
    boolean cached
) implements Serializable {

    public Finding {
        sourceAgents = sourceAgents == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(sourceAgents));
    }

    public Finding withId(String newId) {
        return new Finding(newId, fileIdentity, path, line, endLine, severity, category, title,
                description, suggestion, aiPrompt, codeChange, confidence, sourceAgents,
                verificationStatus, verification, cached);
    }

    public Finding withFileIdentity(FileIdentity identity, String normalizedPath) {
        return new Finding(id, identity, normalizedPath, line, endLine, severity, category, title,
                description, suggestion, aiPrompt, codeChange, confidence, sourceAgents,
                verificationStatus, verification, cached);
    }

    public Finding withConsensus(Set<String> agents, double newConfidence) {
        return new Finding(id, fileIdentity, path, line, endLine, severity, category, title,
                description, suggestion, aiPrompt, codeChange, newConfidence, agents,
                verificationStatus, verification, cached);
    }

    public Finding withVerification(VerificationResult result) {
        VerificationStatus status = result != null && result.accurate()
                ? VerificationStatus.VERIFIED
                : VerificationStatus.REJECTED;
        return new Finding(id, fileIdentity, path, line, endLine, severity, category, title,
                description, suggestion, aiPrompt, codeChange, confidence, sourceAgents,
                status, result, cached);
    }

    public Finding withDescription(String newDescription) {
        return new Finding(id, fileIdentity, path, line, endLine, severity, category, title,
                newDescription, suggestion, aiPrompt, codeChange, confidence, sourceAgents,
                verificationStatus, verification, cached);
    }

    public Finding asCached() {
        return new Finding(id, fileIdentity, path, line, endLine, severity, category, title,
                description, suggestion, aiPrompt, codeChange, confidence, sourceAgents,
                verificationStatus, verification, true);
    }

    @JsonIgnore
    public boolean isVerified() {
        return verificationStatus == VerificationStatus.VERIFIED;
    }
}
