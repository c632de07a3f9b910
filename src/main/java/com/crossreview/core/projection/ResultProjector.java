package com.crossreview.core.projection;

import com.crossreview.core.identity.FileIdentityService;
import com.crossreview.core.model.CodeChange;
import com.crossreview.core.model.FileClassification;
import com.crossreview.core.model.FileIdentity;
import com.crossreview.core.model.Finding;
import com.crossreview.core.model.RiskLevel;
import com.crossreview.core.model.Severity;
import com.crossreview.core.model.VerificationResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes raw LLM output into typed classifications, findings and verification results.
 * <p>
 * Field presence is never assumed: each element is validated and invalid elements are skipped.
 * The file identity is always derived from the normalized path; an LLM-supplied {@code fileId} is
 * only consulted to recover the path when {@code file} is missing.
 */
@Component
public class ResultProjector {

    private static final Logger log = LoggerFactory.getLogger(ResultProjector.class);

    private final JsonExtractor extractor;
    private final FileIdentityService identityService;

    public ResultProjector(JsonExtractor extractor, FileIdentityService identityService) {
        this.extractor = extractor;
        this.identityService = identityService;
    }

    public ParseResult<List<FileClassification>> classifications(String raw, String projectRoot) {
        return extractor.extractArray(raw).map(array -> {
            var result = new ArrayList<FileClassification>();
            for (JsonNode node : array) {
                toClassification(node, projectRoot).ifPresent(result::add);
            }
            return result;
        });
    }

    public ParseResult<List<Finding>> findings(String raw, String projectRoot) {
        return extractor.extractArray(raw).map(array -> {
            var result = new ArrayList<Finding>();
            for (JsonNode node : array) {
                toFinding(node, projectRoot).ifPresent(result::add);
            }
            return result;
        });
    }

    public ParseResult<VerificationResult> verification(String raw, String findingId) {
        return extractor.extractObject(raw).flatMap(node -> {
            JsonNode accurate = node.get("isAccurate");
            if (accurate == null || !accurate.isBoolean()) {
                return ParseResult.error("Verification is missing boolean 'isAccurate'");
            }
            JsonNode confidence = node.get("confidence");
            if (confidence == null || !confidence.isNumber()) {
                return ParseResult.error("Verification is missing numeric 'confidence'");
            }
            double value = confidence.asDouble();
            if (value < 0.0 || value > 1.0) {
                return ParseResult.error("Verification confidence out of range: " + value);
            }
            return ParseResult.parsed(new VerificationResult(
                    findingId, accurate.booleanValue(), value, text(node, "reasoning").orElse("")));
        });
    }

    private Optional<FileClassification> toClassification(JsonNode node, String projectRoot) {
        if (!node.isObject()) {
            return Optional.empty();
        }
        Optional<String> path = resolvePath(node, projectRoot);
        if (path.isEmpty()) {
            log.warn("Skipping classification without file path: {}", node);
            return Optional.empty();
        }
        RiskLevel riskLevel = RiskLevel.fromWire(text(node, "riskLevel").orElse(null));
        if (riskLevel == null) {
            log.warn("Skipping classification for {} with unknown riskLevel {}", path.get(), node.get("riskLevel"));
            return Optional.empty();
        }
        FileIdentity identity = identityService.identify(projectRoot, path.get());
        return Optional.of(new FileClassification(identity, path.get(), riskLevel,
                text(node, "reasoning").orElse(""), false));
    }

    private Optional<Finding> toFinding(JsonNode node, String projectRoot) {
        if (!node.isObject()) {
            return Optional.empty();
        }
        Optional<String> path = resolvePath(node, projectRoot);
        if (path.isEmpty()) {
            log.warn("Skipping finding without file path: {}", node);
            return Optional.empty();
        }
        Optional<Integer> line = integer(node, "line");
        if (line.isEmpty() || line.get() < 1) {
            log.warn("Skipping finding for {} without a valid line", path.get());
            return Optional.empty();
        }

        Severity severity = text(node, "severity").flatMap(Severity::fromWire).orElse(Severity.WARNING);
        String description = text(node, "description").or(() -> text(node, "message")).orElse("");

        CodeChange codeChange = null;
        JsonNode change = node.get("codeChange");
        if (change != null && change.isObject()
                && change.path("oldCode").isTextual() && change.path("newCode").isTextual()) {
            codeChange = new CodeChange(change.get("oldCode").asText(), change.get("newCode").asText());
        }

        Set<String> agents = new LinkedHashSet<>();
        JsonNode sourceAgents = node.get("sourceAgents");
        if (sourceAgents != null && sourceAgents.isArray()) {
            sourceAgents.forEach(a -> {
                if (a.isTextual() && !a.asText().isBlank()) agents.add(a.asText().trim());
            });
        }

        JsonNode confidence = node.get("confidence");
        Double confidenceValue = confidence != null && confidence.isNumber() ? confidence.asDouble() : null;

        return Optional.of(new Finding(
                null,
                identityService.identify(projectRoot, path.get()),
                path.get(),
                line.get(),
                integer(node, "endLine").orElse(null),
                severity,
                text(node, "category").orElse(""),
                text(node, "title").orElse(""),
                description,
                text(node, "suggestion").orElse(null),
                text(node, "aiPrompt").orElse(null),
                codeChange,
                confidenceValue,
                agents,
                null,
                null,
                false));
    }

    private Optional<String> resolvePath(JsonNode node, String projectRoot) {
        Optional<String> explicit = text(node, "file").or(() -> text(node, "path"));
        if (explicit.isPresent()) {
            return explicit.map(FileIdentityService::normalizePath).filter(p -> !p.isBlank());
        }
        return text(node, "fileId").flatMap(id -> FileIdentityService.relativePath(projectRoot, id));
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return Optional.empty();
        }
        String text = value.asText();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    private static Optional<Integer> integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.asInt());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Integer.parseInt(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
