package com.crossreview.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the review pipeline.
 */
@Service
public class ReviewMetrics {

    private final MeterRegistry registry;

    public ReviewMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param stage   classify, low-risk, sub-agent, coordinator or verify
     * @param success whether the task produced output
     */
    public void recordLlmTask(String stage, boolean success, long ms) {
        Timer.builder("crossreview.llm.task.duration")
                .tag("stage", stage)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCacheLookup(String stage, boolean hit) {
        Counter.builder("crossreview.cache.lookups")
                .tag("stage", stage)
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordVerification(boolean verified) {
        Counter.builder("crossreview.verification.results")
                .tag("result", verified ? "verified" : "rejected")
                .register(registry)
                .increment();
    }

    public void recordStageFailure(String stage) {
        Counter.builder("crossreview.stage.failures")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordFindings(String stage, int count) {
        DistributionSummary.builder("crossreview.findings.per_call")
                .description("Findings returned per stage call")
                .tag("stage", stage)
                .register(registry)
                .record(count);
    }
}
