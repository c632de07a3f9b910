package com.crossreview.dispatch.cli;

import com.crossreview.core.events.EventBus;
import com.crossreview.core.model.FileClassification;
import com.crossreview.core.model.Finding;
import com.crossreview.core.model.RiskLevel;
import com.crossreview.core.pipeline.HighRiskResult;
import com.crossreview.core.pipeline.LowRiskResult;
import com.crossreview.core.pipeline.ReviewOrchestrator;
import com.crossreview.core.pipeline.StartResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * CLI command: crossreview review &lt;project&gt; &lt;files...&gt;
 * <p>
 * Runs the whole pipeline in one go: classification, automatic confirmation of the proposed
 * risk partition, low-risk batch review, then every high-risk file in turn.
 */
@Command(name = "review", mixinStandardHelpOptions = true, description = "Review changed files")
@Component
public class ReviewCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project root (git working tree)")
    private String projectPath;

    @Parameters(index = "1..*", arity = "1..*", description = "Files relative to the project root")
    private List<String> files;

    @Option(names = {"--session-id", "-s"}, description = "Session id (generated when absent)")
    private String sessionId;

    private final ReviewOrchestrator orchestrator;
    private final EventBus eventBus;

    public ReviewCommand(ReviewOrchestrator orchestrator, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String id = sessionId != null && !sessionId.isBlank()
                ? sessionId
                : "cli-" + UUID.randomUUID().toString().substring(0, 8);
        EventBus.Subscription subscription = eventBus.subscribe(id, ConsoleOutput::event);
        try {
            return review(id);
        } finally {
            subscription.unsubscribe();
        }
    }

    private int review(String id) {
        ConsoleOutput.info("Classifying " + files.size() + " file(s)...");
        StartResult started = orchestrator.start(projectPath, files, id);
        if (!started.success()) {
            ConsoleOutput.error("Classification failed: " + started.message());
            return 1;
        }

        var low = new ArrayList<String>();
        var high = new ArrayList<String>();
        for (FileClassification classification : started.classifications()) {
            ConsoleOutput.classification(classification);
            (classification.riskLevel() == RiskLevel.HIGH_RISK ? high : low).add(classification.path());
        }

        List<Finding> findings = new ArrayList<>();
        LowRiskResult lowRisk = orchestrator.startLowRisk(id, low, high);
        if (!lowRisk.success()) {
            ConsoleOutput.error("Low-risk review failed: " + lowRisk.message());
            return 1;
        }
        findings.addAll(lowRisk.findings());

        for (int step = 0; step < high.size(); step++) {
            HighRiskResult result = orchestrator.advanceHighRisk(id);
            if (!result.success()) {
                ConsoleOutput.error("High-risk review failed: " + result.message());
                return 1;
            }
            findings.addAll(result.findings());
            if (result.complete()) {
                break;
            }
        }

        System.out.println();
        findings.sort(Comparator.comparing(Finding::severity)
                .thenComparing(Finding::path)
                .thenComparingInt(Finding::line));
        findings.forEach(ConsoleOutput::finding);
        ConsoleOutput.summary(findings);
        return 0;
    }
}
