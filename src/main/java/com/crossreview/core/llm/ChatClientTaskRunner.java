package com.crossreview.core.llm;

import com.crossreview.core.metrics.ReviewMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;

/**
 * Runs review tasks through Spring AI's {@link ChatClient}.
 * <p>
 * The stage prompt is sent as the user message; output is returned raw and decoded downstream,
 * since review stages expect JSON arrays that the structured-output converter cannot describe.
 */
@Component
@ConditionalOnProperty(prefix = "crossreview.llm", name = "runner", havingValue = "chat-client", matchIfMissing = true)
public class ChatClientTaskRunner extends AbstractLlmTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(ChatClientTaskRunner.class);

    private static final String SYSTEM_PROMPT = """
            You are a meticulous senior code reviewer working inside an automated review pipeline.
            Follow the output format in the user message exactly.
            Respond with JSON only: no prose before or after it.
            """;

    private final ChatClient chatClient;

    @Autowired
    public ChatClientTaskRunner(ChatClient.Builder builder, LlmProperties properties, ReviewMetrics metrics,
                                @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this(builder.build(), properties.getMaxConcurrentTasks(), metrics);
        log.info("ChatClientTaskRunner initialized, base-url: {}", baseUrl);
    }

    ChatClientTaskRunner(ChatClient chatClient, int maxConcurrentTasks, ReviewMetrics metrics) {
        super(maxConcurrentTasks, metrics);
        this.chatClient = chatClient;
    }

    @Override
    protected String execute(LlmTask task, CancellationToken token) {
        if (token.isCancelled()) {
            throw new CancellationException("Task " + task.taskId() + " cancelled");
        }
        String response = chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user(task.prompt())
                .call()
                .content();
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for task " + task.taskId());
        }
        return response;
    }
}
