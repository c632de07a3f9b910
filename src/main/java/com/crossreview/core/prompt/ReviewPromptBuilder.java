package com.crossreview.core.prompt;

import com.crossreview.core.model.Finding;
import com.crossreview.core.model.SubAgentReview;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts pre-fetched file contexts into the prompt text of each review stage.
 * Pure functions, no Spring dependencies and no I/O.
 */
public final class ReviewPromptBuilder {

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ReviewPromptBuilder() {}

    public static String classificationPrompt(List<FileContext> files) {
        var sb = new StringBuilder();
        sb.append("You are analyzing code changes to classify files by risk level.\n\n");
        sb.append("Classify each file as LOW-RISK or HIGH-RISK based on these criteria:\n\n");
        sb.append("LOW-RISK:\n");
        sb.append("- Configuration files, docs, type definitions, formatting changes\n");
        sb.append("- Comments, simple refactoring, test files\n\n");
        sb.append("HIGH-RISK (potential bugs/security):\n");
        sb.append("- Business logic, auth, database queries, API handlers\n");
        sb.append("- Security code, payment processing, user data handling\n\n");

        sb.append("Files to classify:\n");
        for (FileContext file : files) {
            sb.append("- ").append(file.path()).append(" (fileId: ").append(file.identity()).append(")\n");
        }
        sb.append("\nDiffs:\n");
        appendDiffs(sb, files);

        sb.append("Output ONLY a valid JSON array with EXACTLY these fields, one element per file:\n");
        sb.append("[\n");
        sb.append("  {\n");
        sb.append("    \"fileId\": \"").append(exampleId(files)).append("\",\n");
        sb.append("    \"file\": \"").append(examplePath(files)).append("\",\n");
        sb.append("    \"riskLevel\": \"low-risk\",\n");
        sb.append("    \"reasoning\": \"Only config values changed\"\n");
        sb.append("  }\n");
        sb.append("]\n\n");
        sb.append("CRITICAL: Classify EVERY file listed above and copy its exact fileId and path.");
        return sb.toString();
    }

    public static String lowRiskPrompt(List<FileContext> batch) {
        var sb = new StringBuilder();
        sb.append("You are reviewing LOW-RISK code changes for simple issues.\n\n");
        sb.append("Focus ONLY on:\n");
        sb.append("- Typos, unused imports/variables\n");
        sb.append("- Debug output (console.log, System.out.println, print), commented-out code\n");
        sb.append("- Missing null checks, simple style issues\n\n");
        sb.append("DO NOT report: complex logic, architecture, pre-existing issues\n\n");

        sb.append("Files:\n");
        appendDiffs(sb, batch);

        sb.append("Output ONLY a valid JSON array (use [] when there is nothing to report):\n");
        sb.append("[\n");
        sb.append("  {\n");
        sb.append("    \"fileId\": \"").append(exampleId(batch)).append("\",\n");
        sb.append("    \"file\": \"").append(examplePath(batch)).append("\",\n");
        sb.append("    \"line\": 42,\n");
        sb.append("    \"severity\": \"suggestion\",\n");
        sb.append("    \"category\": \"Code Quality\",\n");
        sb.append("    \"title\": \"Unused import\",\n");
        sb.append("    \"description\": \"Import 'fs' is never used\",\n");
        sb.append("    \"suggestion\": \"Remove unused import\",\n");
        sb.append("    \"codeChange\": {\n");
        sb.append("      \"oldCode\": \"import fs from 'fs'\",\n");
        sb.append("      \"newCode\": \"\"\n");
        sb.append("    }\n");
        sb.append("  }\n");
        sb.append("]\n\n");
        sb.append("CRITICAL: Include the exact fileId and path from the input for each finding.");
        return sb.toString();
    }

    /**
     * @param agentNumber   reviewer slot, 1 to 3
     * @param riskReasoning the classification's reasoning, given as a hint
     */
    public static String subAgentPrompt(FileContext file, int agentNumber, String riskReasoning) {
        var sb = new StringBuilder();
        sb.append("You are REVIEWER-").append(agentNumber)
                .append(" conducting an independent review of a HIGH-RISK file.\n\n");
        sb.append("- ONLY analyze MODIFIED code (in the diff)\n");
        sb.append("- DO NOT report issues in unchanged code\n\n");

        sb.append("File: ").append(file.path()).append("\n");
        sb.append("FileId: ").append(file.identity()).append("\n");
        if (riskReasoning != null && !riskReasoning.isBlank()) {
            sb.append("Risk reason: ").append(riskReasoning).append("\n");
        }
        sb.append("\n=== CHANGES (diff) ===\n").append(file.diff()).append("\n");
        sb.append("\n=== FULL FILE ===\n").append(file.content()).append("\n");
        sb.append("\n=== IMPORTS ===\n").append(file.imports()).append("\n\n");

        sb.append("Check for: logic errors, security flaws, data integrity issues, error handling, breaking changes\n\n");
        sb.append("Output ONLY a valid JSON array (use [] when there is nothing to report):\n");
        sb.append("[\n");
        sb.append("  {\n");
        sb.append("    \"file\": \"").append(file.path()).append("\",\n");
        sb.append("    \"line\": 42,\n");
        sb.append("    \"severity\": \"critical\",\n");
        sb.append("    \"category\": \"Security\",\n");
        sb.append("    \"title\": \"SQL injection\",\n");
        sb.append("    \"description\": \"User input concatenated in query\",\n");
        sb.append("    \"suggestion\": \"Use parameterized queries\"\n");
        sb.append("  }\n");
        sb.append("]");
        return sb.toString();
    }

    public static String coordinatorPrompt(FileContext file, List<SubAgentReview> reviews) {
        var sb = new StringBuilder();
        sb.append("You are coordinating findings from ").append(reviews.size()).append(" independent reviewers.\n\n");
        sb.append("Tasks:\n");
        sb.append("1. Deduplicate similar findings\n");
        sb.append("2. Consolidate descriptions\n");
        sb.append("3. Record which reviewers reported each finding in \"sourceAgents\"\n");
        sb.append("4. Calculate confidence (3 agents=1.0, 2=0.85, 1=0.65)\n");
        sb.append("5. Filter out false positives\n");
        sb.append("6. Generate EXACT code fixes with old/new code snippets\n\n");

        sb.append("File: ").append(file.path()).append("\n\n");
        sb.append("Diff:\n").append(file.diff()).append("\n\n");
        sb.append("Full file content:\n").append(file.content()).append("\n\n");
        sb.append("Sub-agent reviews:\n").append(reviewsJson(reviews)).append("\n\n");

        sb.append("For EACH finding, you MUST provide:\n");
        sb.append("- \"aiPrompt\": a clear prompt the user can copy to ask an AI to fix this issue\n");
        sb.append("- \"codeChange\": object with \"oldCode\" and \"newCode\" for automatic fixing (if applicable)\n\n");

        sb.append("Output consolidated findings in this EXACT format (use [] when nothing survives):\n");
        sb.append("[\n");
        sb.append("  {\n");
        sb.append("    \"file\": \"").append(file.path()).append("\",\n");
        sb.append("    \"line\": 42,\n");
        sb.append("    \"endLine\": 45,\n");
        sb.append("    \"severity\": \"critical\",\n");
        sb.append("    \"category\": \"Security\",\n");
        sb.append("    \"title\": \"SQL injection vulnerability\",\n");
        sb.append("    \"description\": \"User input is directly concatenated into SQL query without sanitization\",\n");
        sb.append("    \"suggestion\": \"Use parameterized queries to prevent SQL injection\",\n");
        sb.append("    \"aiPrompt\": \"Fix the SQL injection on line 42 by using a parameterized query\",\n");
        sb.append("    \"codeChange\": {\n");
        sb.append("      \"oldCode\": \"String query = \\\"SELECT * FROM users WHERE id = \\\" + userId;\",\n");
        sb.append("      \"newCode\": \"String query = \\\"SELECT * FROM users WHERE id = ?\\\";\"\n");
        sb.append("    },\n");
        sb.append("    \"sourceAgents\": [\"reviewer-1\", \"reviewer-2\", \"reviewer-3\"],\n");
        sb.append("    \"confidence\": 1.0\n");
        sb.append("  }\n");
        sb.append("]\n\n");
        sb.append("IMPORTANT:\n");
        sb.append("- Always include \"aiPrompt\" for every finding\n");
        sb.append("- Only include \"codeChange\" if you can provide exact old/new code snippets\n");
        sb.append("- \"oldCode\" must match EXACTLY what is in the file (including whitespace)\n");
        sb.append("- \"sourceAgents\" may only contain the reviewer ids listed above");
        return sb.toString();
    }

    public static String verificationPrompt(FileContext file, Finding finding) {
        var sb = new StringBuilder();
        sb.append("You are verifying the accuracy of a code review finding.\n\n");
        sb.append("Verify:\n");
        sb.append("1. The issue exists in MODIFIED code (not pre-existing)\n");
        sb.append("2. The severity is appropriate\n");
        sb.append("3. The suggested fix is valid\n\n");

        sb.append("Finding:\n").append(toJson(findingView(finding, true))).append("\n\n");
        sb.append("File: ").append(file.path()).append("\n\n");
        sb.append("Diff:\n").append(file.diff()).append("\n\n");
        sb.append("Full file:\n").append(file.content()).append("\n\n");

        sb.append("Output ONLY this JSON object:\n");
        sb.append("{\n");
        sb.append("  \"findingId\": \"").append(finding.id()).append("\",\n");
        sb.append("  \"isAccurate\": true,\n");
        sb.append("  \"confidence\": 0.95,\n");
        sb.append("  \"reasoning\": \"Confirmed issue in modified code...\"\n");
        sb.append("}");
        return sb.toString();
    }

    private static void appendDiffs(StringBuilder sb, List<FileContext> files) {
        for (FileContext file : files) {
            sb.append("=== ").append(file.path()).append(" ===\n");
            sb.append("FileId: ").append(file.identity()).append("\n");
            sb.append(file.diff()).append("\n\n");
        }
    }

    private static String exampleId(List<FileContext> files) {
        return files.isEmpty() ? "project:src/config.ts" : files.get(0).identity().value();
    }

    private static String examplePath(List<FileContext> files) {
        return files.isEmpty() ? "src/config.ts" : files.get(0).path();
    }

    private static String reviewsJson(List<SubAgentReview> reviews) {
        var view = reviews.stream()
                .map(review -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("agentId", review.agentId());
                    entry.put("findings", review.findings().stream().map(f -> findingView(f, false)).toList());
                    return entry;
                })
                .toList();
        return toJson(view);
    }

    private static Map<String, Object> findingView(Finding finding, boolean withId) {
        Map<String, Object> view = new LinkedHashMap<>();
        if (withId && finding.id() != null) {
            view.put("id", finding.id());
        }
        view.put("file", finding.path());
        view.put("line", finding.line());
        if (finding.endLine() != null) view.put("endLine", finding.endLine());
        view.put("severity", finding.severity());
        view.put("category", finding.category());
        view.put("title", finding.title());
        view.put("description", finding.description());
        if (finding.suggestion() != null) view.put("suggestion", finding.suggestion());
        if (finding.codeChange() != null) view.put("codeChange", finding.codeChange());
        if (!finding.sourceAgents().isEmpty()) view.put("sourceAgents", finding.sourceAgents());
        return view;
    }

    private static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render prompt JSON", e);
        }
    }
}
