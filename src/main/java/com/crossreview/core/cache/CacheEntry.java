package com.crossreview.core.cache;

import com.crossreview.core.model.ContentFingerprint;
import com.crossreview.core.model.FileClassification;
import com.crossreview.core.model.FileIdentity;
import com.crossreview.core.model.Finding;
import com.crossreview.core.model.RiskLevel;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Prior review output for one file at one diff version.
 * <p>
 * Low-risk and high-risk reviews produce findings of a different shape (only the high-risk
 * protocol yields consensus and verification), so each review kind has its own slot and a lookup
 * for one kind never returns the other's findings.
 *
 * @param identity         file identity (partition key)
 * @param fingerprint      diff fingerprint (version key)
 * @param classification   stored classification, nullable until the classification stage has run
 * @param lowRiskFindings  findings of a low-risk batch review, nullable until one has run; empty means "reviewed, clean"
 * @param highRiskFindings verified findings of the high-risk protocol, nullable until it has run
 * @param updatedAt        time of the last write
 */
public record CacheEntry(
    FileIdentity identity,
    ContentFingerprint fingerprint,
    FileClassification classification,
    List<Finding> lowRiskFindings,
    List<Finding> highRiskFindings,
    Instant updatedAt
) implements Serializable {

    public CacheEntry {
        lowRiskFindings = lowRiskFindings == null ? null : List.copyOf(lowRiskFindings);
        highRiskFindings = highRiskFindings == null ? null : List.copyOf(highRiskFindings);
    }

    public Optional<FileClassification> cachedClassification() {
        return Optional.ofNullable(classification).map(FileClassification::asCached);
    }

    /**
     * Stored findings of the given review kind, or nothing when that kind of review has not run.
     */
    public List<Finding> findings(RiskLevel reviewedAs) {
        return reviewedAs == RiskLevel.HIGH_RISK ? highRiskFindings : lowRiskFindings;
    }

    public Optional<List<Finding>> cachedFindings(RiskLevel reviewedAs) {
        return Optional.ofNullable(findings(reviewedAs))
                .map(list -> list.stream().map(Finding::asCached).toList());
    }

    CacheEntry merge(FileClassification newClassification, RiskLevel reviewedAs, List<Finding> newFindings) {
        List<Finding> low = lowRiskFindings;
        List<Finding> high = highRiskFindings;
        if (newFindings != null) {
            if (reviewedAs == RiskLevel.HIGH_RISK) {
                high = newFindings;
            } else {
                low = newFindings;
            }
        }
        return new CacheEntry(identity, fingerprint,
                newClassification != null ? newClassification : classification,
                low, high, Instant.now());
    }
}
