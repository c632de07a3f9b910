package com.crossreview.core.llm;

import com.crossreview.core.metrics.ReviewMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * Runs review tasks by piping the prompt into the {@code claude} CLI in print mode, with the
 * project directory as working directory so the agent can read surrounding files.
 * <p>
 * Cancellation and timeout destroy the process.
 */
@Component
@ConditionalOnProperty(prefix = "crossreview.llm", name = "runner", havingValue = "claude-cli")
public class ClaudeCliTaskRunner extends AbstractLlmTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCliTaskRunner.class);

    private final List<String> command;

    public ClaudeCliTaskRunner(LlmProperties properties, ReviewMetrics metrics) {
        super(properties.getMaxConcurrentTasks(), metrics);
        var cmd = new ArrayList<String>();
        cmd.add(properties.getClaudeCommand());
        cmd.addAll(properties.getClaudeArgs());
        this.command = List.copyOf(cmd);
        log.info("ClaudeCliTaskRunner initialized, command: {}", String.join(" ", command));
    }

    @Override
    protected String execute(LlmTask task, CancellationToken token) throws IOException, InterruptedException {
        if (token.isCancelled()) {
            throw new CancellationException("Task " + task.taskId() + " cancelled");
        }
        var process = new ProcessBuilder(command)
                .directory(new File(task.projectPath()))
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        CancellationToken.Registration kill = token.onCancel(process::destroyForcibly);
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(task.prompt().getBytes(StandardCharsets.UTF_8));
            }

            String output;
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (token.isCancelled()) {
                throw new CancellationException("Task " + task.taskId() + " cancelled");
            }
            if (exitCode != 0) {
                throw new LlmTaskException("claude exited with code " + exitCode + " for task " + task.taskId());
            }
            return output;
        } finally {
            kill.unregister();
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }
}
