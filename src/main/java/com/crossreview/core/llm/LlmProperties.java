package com.crossreview.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "crossreview.llm")
public class LlmProperties {

    /** Runner backend: "chat-client" (Spring AI) or "claude-cli". */
    private String runner = "chat-client";
    private int maxConcurrentTasks = 8;
    private String claudeCommand = "claude";
    private List<String> claudeArgs = new ArrayList<>(List.of("-p"));

    public String getRunner() {
        return runner;
    }

    public void setRunner(String runner) {
        this.runner = runner;
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public void setMaxConcurrentTasks(int maxConcurrentTasks) {
        this.maxConcurrentTasks = maxConcurrentTasks;
    }

    public String getClaudeCommand() {
        return claudeCommand;
    }

    public void setClaudeCommand(String claudeCommand) {
        this.claudeCommand = claudeCommand;
    }

    public List<String> getClaudeArgs() {
        return claudeArgs;
    }

    public void setClaudeArgs(List<String> claudeArgs) {
        this.claudeArgs = claudeArgs;
    }
}
