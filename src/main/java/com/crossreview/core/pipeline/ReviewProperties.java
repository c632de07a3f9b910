package com.crossreview.core.pipeline;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "crossreview.review")
public class ReviewProperties {

    private int lowRiskBatchSize = 5;
    private Duration classifyTimeout = Duration.ofSeconds(60);
    private Duration batchTimeout = Duration.ofSeconds(90);
    private Duration agentTimeout = Duration.ofSeconds(120);
    private Duration coordinatorTimeout = Duration.ofSeconds(60);
    private Duration verifyTimeout = Duration.ofSeconds(60);

    public int getLowRiskBatchSize() {
        return lowRiskBatchSize;
    }

    public void setLowRiskBatchSize(int lowRiskBatchSize) {
        this.lowRiskBatchSize = lowRiskBatchSize;
    }

    public Duration getClassifyTimeout() {
        return classifyTimeout;
    }

    public void setClassifyTimeout(Duration classifyTimeout) {
        this.classifyTimeout = classifyTimeout;
    }

    public Duration getBatchTimeout() {
        return batchTimeout;
    }

    public void setBatchTimeout(Duration batchTimeout) {
        this.batchTimeout = batchTimeout;
    }

    public Duration getAgentTimeout() {
        return agentTimeout;
    }

    public void setAgentTimeout(Duration agentTimeout) {
        this.agentTimeout = agentTimeout;
    }

    public Duration getCoordinatorTimeout() {
        return coordinatorTimeout;
    }

    public void setCoordinatorTimeout(Duration coordinatorTimeout) {
        this.coordinatorTimeout = coordinatorTimeout;
    }

    public Duration getVerifyTimeout() {
        return verifyTimeout;
    }

    public void setVerifyTimeout(Duration verifyTimeout) {
        this.verifyTimeout = verifyTimeout;
    }
}
