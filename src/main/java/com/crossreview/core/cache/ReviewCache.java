package com.crossreview.core.cache;

import com.crossreview.core.identity.FileIdentityService;
import com.crossreview.core.model.ContentFingerprint;
import com.crossreview.core.model.FileClassification;
import com.crossreview.core.model.FileIdentity;
import com.crossreview.core.model.Finding;
import com.crossreview.core.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Content-addressed store of prior classifications and findings, shared by all sessions.
 * <p>
 * One entry per {@link FileIdentity}. A lookup hits only when the stored fingerprint equals the
 * requested one; writing under a new fingerprint supersedes the old entry. Writes under the same
 * fingerprint merge: a classification write keeps stored findings, and a findings write only
 * replaces the slot of its own review kind. Concurrent writers to the same key are last-write-wins.
 */
@Service
public class ReviewCache {

    private static final Logger log = LoggerFactory.getLogger(ReviewCache.class);

    private final ConcurrentHashMap<FileIdentity, CacheEntry> entries = new ConcurrentHashMap<>();

    public Optional<CacheEntry> get(FileIdentity identity, ContentFingerprint fingerprint) {
        CacheEntry entry = entries.get(identity);
        if (entry == null || !entry.fingerprint().equals(fingerprint)) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void putClassification(FileIdentity identity, ContentFingerprint fingerprint,
                                  FileClassification classification) {
        if (classification == null) {
            return;
        }
        write(identity, fingerprint, classification, null, null);
        log.debug("Cached classification {} @ {}", identity, fingerprint.shortHex());
    }

    /**
     * Stores the findings of one review kind. Findings written by the other kind are kept.
     */
    public void putFindings(FileIdentity identity, ContentFingerprint fingerprint, RiskLevel reviewedAs,
                            List<Finding> findings) {
        if (reviewedAs == null || findings == null) {
            throw new IllegalArgumentException("Review kind and findings are required");
        }
        List<Finding> stored = findings.stream()
                .map(f -> f.withId(null))
                .toList();
        write(identity, fingerprint, null, reviewedAs, stored);
        log.debug("Cached {} {} finding(s) for {} @ {}", stored.size(), reviewedAs, identity, fingerprint.shortHex());
    }

    private void write(FileIdentity identity, ContentFingerprint fingerprint, FileClassification classification,
                       RiskLevel reviewedAs, List<Finding> findings) {
        entries.compute(identity, (key, existing) -> {
            CacheEntry base = existing != null && existing.fingerprint().equals(fingerprint)
                    ? existing
                    : new CacheEntry(identity, fingerprint, null, null, null, Instant.now());
            return base.merge(classification, reviewedAs, findings);
        });
    }

    /**
     * @return number of entries removed
     */
    public int invalidate(Collection<FileIdentity> identities) {
        int removed = 0;
        for (FileIdentity identity : identities) {
            if (entries.remove(identity) != null) {
                removed++;
            }
        }
        log.info("Invalidated {} cache entr{}", removed, removed == 1 ? "y" : "ies");
        return removed;
    }

    /**
     * Drops every entry whose identity was derived from the given project root.
     *
     * @return number of entries removed
     */
    public int invalidateProject(String projectRoot) {
        String prefix = FileIdentityService.projectPrefix(projectRoot);
        var doomed = entries.keySet().stream()
                .filter(id -> id.value().startsWith(prefix))
                .toList();
        doomed.forEach(entries::remove);
        log.info("Invalidated {} cache entries for project {}", doomed.size(), projectRoot);
        return doomed.size();
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
