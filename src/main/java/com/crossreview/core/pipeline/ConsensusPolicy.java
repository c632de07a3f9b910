package com.crossreview.core.pipeline;

import com.crossreview.core.identity.FileIdentityService;
import com.crossreview.core.model.Finding;
import com.crossreview.core.model.SubAgentReview;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Agreement-based confidence for multi-agent findings.
 * <p>
 * Confidence is a fixed function of how many independent reviewers reported an issue and is
 * always recomputed here, whatever number the coordinator wrote.
 */
public final class ConsensusPolicy {

    private static final Logger log = LoggerFactory.getLogger(ConsensusPolicy.class);

    public static final List<String> AGENT_IDS = List.of("reviewer-1", "reviewer-2", "reviewer-3");

    private ConsensusPolicy() {}

    public static String agentId(int agentNumber) {
        return "reviewer-" + agentNumber;
    }

    /**
     * 3 agents: 1.0, 2 agents: 0.85, 1 agent: 0.65, none: 0.0.
     */
    public static double confidenceFor(int agentCount) {
        if (agentCount >= 3) return 1.0;
        if (agentCount == 2) return 0.85;
        if (agentCount == 1) return 0.65;
        return 0.0;
    }

    /**
     * Deterministic local dedupe of sub-agent findings, keyed by path, line, category and title
     * (case and whitespace insensitive). Merged findings keep the longer description.
     */
    public static List<Finding> consolidate(List<SubAgentReview> reviews) {
        Map<String, Finding> merged = new LinkedHashMap<>();
        Map<String, Set<String>> agents = new LinkedHashMap<>();
        for (SubAgentReview review : reviews) {
            for (Finding finding : review.findings()) {
                String key = dedupeKey(finding);
                agents.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(review.agentId());
                merged.merge(key, finding, (existing, incoming) ->
                        length(incoming.description()) > length(existing.description())
                                ? existing.withDescription(incoming.description())
                                : existing);
            }
        }
        var result = new ArrayList<Finding>(merged.size());
        merged.forEach((key, finding) -> {
            Set<String> sources = agents.get(key);
            result.add(finding.withConsensus(sources, confidenceFor(sources.size())));
        });
        return result;
    }

    /**
     * Applies the policy to coordinator output.
     * <p>
     * Source agents are restricted to the known reviewer ids. When the coordinator names none,
     * they are inferred from sub-agent findings at the same path and line. Findings that no
     * reviewer supports are dropped.
     */
    public static List<Finding> enforce(List<Finding> coordinated, List<SubAgentReview> reviews) {
        List<Finding> local = consolidate(reviews);
        var result = new ArrayList<Finding>(coordinated.size());
        for (Finding finding : coordinated) {
            Set<String> sources = new LinkedHashSet<>();
            for (String raw : finding.sourceAgents()) {
                String id = normalizeAgentId(raw);
                if (AGENT_IDS.contains(id)) {
                    sources.add(id);
                }
            }
            if (sources.isEmpty()) {
                String path = FileIdentityService.normalizePath(finding.path());
                for (Finding candidate : local) {
                    if (candidate.line() == finding.line()
                            && FileIdentityService.normalizePath(candidate.path()).equals(path)) {
                        sources.addAll(candidate.sourceAgents());
                    }
                }
            }
            if (sources.isEmpty()) {
                log.warn("Dropping coordinated finding '{}' at {}:{} with no supporting reviewer",
                        finding.title(), finding.path(), finding.line());
                continue;
            }
            result.add(finding.withConsensus(sources, confidenceFor(sources.size())));
        }
        return result;
    }

    static String normalizeAgentId(String raw) {
        if (raw == null) return "";
        String id = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        if (id.matches("reviewer\\d")) {
            id = "reviewer-" + id.substring("reviewer".length());
        }
        return id;
    }

    private static String dedupeKey(Finding finding) {
        return FileIdentityService.normalizePath(finding.path()) + "|" + finding.line() + "|"
                + normalizeText(finding.category()) + "|" + normalizeText(finding.title());
    }

    private static String normalizeText(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    private static int length(String text) {
        return text == null ? 0 : text.length();
    }
}
