package com.crossreview.dispatch.cli;

import com.crossreview.core.events.ReviewEvent;
import com.crossreview.core.model.FileClassification;
import com.crossreview.core.model.Finding;
import com.crossreview.core.model.RiskLevel;
import com.crossreview.core.model.Severity;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the CrossReview CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CROSSREVIEW v0.1.0|@"));
        System.out.println("----------------------------------");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CROSSREVIEW]|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void classification(FileClassification classification) {
        String risk = classification.riskLevel() == RiskLevel.HIGH_RISK
                ? "@|fg(red) HIGH|@"
                : "@|fg(green) LOW |@";
        String cached = classification.cached() ? " @|faint (cached)|@" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + risk + " " + classification.path() + cached + ": " + classification.reasoning()));
    }

    public static void event(ReviewEvent event) {
        String prefix = switch (event.eventType()) {
            case ReviewEvent.TYPE_HIGH_RISK_STATUS -> "@|fg(blue) [HIGH-RISK]|@";
            case ReviewEvent.TYPE_LOW_RISK_FINDINGS -> "@|fg(green) [LOW-RISK]|@";
            case ReviewEvent.TYPE_HIGH_RISK_FINDINGS -> "@|fg(magenta) [FINDINGS]|@";
            case ReviewEvent.TYPE_FAILED -> "@|fg(red),bold [FAILED]|@";
            default -> null;
        };
        if (prefix == null) {
            return;
        }
        Object detail = event.payload().containsKey("status")
                ? event.payload().get("status")
                : event.payload().getOrDefault("message", event.payload().get("findingCount"));
        String file = event.file() != null ? event.file() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + file + detail));
    }

    public static void finding(Finding finding) {
        String location = finding.path() + ":" + finding.line()
                + (finding.endLine() != null ? "-" + finding.endLine() : "");
        String confidence = finding.confidence() != null
                ? String.format(" (%.0f%%)", finding.confidence() * 100)
                : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                severityLabel(finding.severity()) + " @|bold " + location + "|@ "
                        + finding.title() + confidence));
        if (finding.description() != null && !finding.description().isBlank()) {
            System.out.println("    " + finding.description());
        }
        if (finding.suggestion() != null && !finding.suggestion().isBlank()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(green) fix:|@ " + finding.suggestion()));
        }
    }

    public static void summary(List<Finding> findings) {
        long blocking = findings.stream()
                .filter(f -> f.severity() == Severity.CRITICAL || f.severity() == Severity.ERROR)
                .count();
        System.out.println("----------------------------------");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Findings:|@ " + findings.size()
                        + (blocking > 0 ? ", @|fg(red) " + blocking + " critical/error|@" : "")));
    }

    private static String severityLabel(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "@|fg(red),bold [CRITICAL]|@";
            case ERROR -> "@|fg(red) [ERROR]|@";
            case WARNING -> "@|fg(yellow) [WARNING]|@";
            case SUGGESTION -> "@|fg(cyan) [SUGGESTION]|@";
        };
    }
}
