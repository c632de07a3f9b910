package com.crossreview.core.llm;

import com.crossreview.core.metrics.ReviewMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared plumbing for runner backends: active-task tracking, a concurrency bound, per-task timeout
 * and cooperative cancellation. Subclasses only implement {@link #execute}.
 */
public abstract class AbstractLlmTaskRunner implements LlmTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(AbstractLlmTaskRunner.class);

    private final ConcurrentHashMap<String, ActiveTask> activeTasks = new ConcurrentHashMap<>();
    private final Semaphore permits;
    private final ExecutorService executor;
    private final ReviewMetrics metrics;

    protected AbstractLlmTaskRunner(int maxConcurrentTasks, ReviewMetrics metrics) {
        this.permits = new Semaphore(Math.max(1, maxConcurrentTasks));
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "llm-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Invokes the model. May block; should honour {@code token} where the backend allows it.
     *
     * @return raw model output
     */
    protected abstract String execute(LlmTask task, CancellationToken token) throws Exception;

    @Override
    public LlmTaskResult run(LlmTask task, CancellationToken token) {
        long startMs = System.currentTimeMillis();
        if (token.isCancelled()) {
            return finish(task, LlmTaskResult.failure(task.taskId(), "Task cancelled before start", 0));
        }

        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finish(task, LlmTaskResult.failure(task.taskId(), "Interrupted waiting for a task slot", 0));
        }

        CancellationToken.Linked linked = token.child();
        try {
            if (linked.token().isCancelled()) {
                return finish(task, LlmTaskResult.failure(task.taskId(), "Task cancelled before start", elapsed(startMs)));
            }
            log.info("Starting LLM task {} [{}] ({} chars)", task.taskId(), task.stage(), task.prompt().length());

            Future<String> future = executor.submit(() -> execute(task, linked.token()));
            var active = new ActiveTask(task.taskId(), linked.token(), future, startMs);
            activeTasks.put(task.taskId(), active);
            CancellationToken.Registration stopOnCancel = linked.token().onCancel(() -> future.cancel(true));
            try {
                String output = future.get(task.timeout().toMillis(), TimeUnit.MILLISECONDS);
                if (output == null || output.isBlank()) {
                    return finish(task, LlmTaskResult.failure(task.taskId(), "Empty output", elapsed(startMs)));
                }
                return finish(task, LlmTaskResult.success(task.taskId(), output, elapsed(startMs)));
            } catch (TimeoutException e) {
                linked.token().cancel();
                return finish(task, LlmTaskResult.failure(task.taskId(),
                        "Task timed out after " + task.timeout().toMillis() + "ms", elapsed(startMs)));
            } catch (CancellationException e) {
                return finish(task, LlmTaskResult.failure(task.taskId(), "Task cancelled", elapsed(startMs)));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("LLM task {} failed: {}", task.taskId(), cause.getMessage());
                return finish(task, LlmTaskResult.failure(task.taskId(),
                        cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(),
                        elapsed(startMs)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                linked.token().cancel();
                return finish(task, LlmTaskResult.failure(task.taskId(), "Interrupted", elapsed(startMs)));
            } finally {
                stopOnCancel.unregister();
                activeTasks.remove(task.taskId(), active);
            }
        } finally {
            linked.link().unregister();
            permits.release();
        }
    }

    @Override
    public void cancel(String taskId) {
        ActiveTask active = activeTasks.get(taskId);
        if (active == null) {
            return;
        }
        log.info("Cancelling LLM task {} after {}ms", taskId, System.currentTimeMillis() - active.startMs());
        active.token().cancel();
        active.future().cancel(true);
    }

    @Override
    public Set<String> activeTaskIds() {
        return Set.copyOf(activeTasks.keySet());
    }

    @PreDestroy
    void shutdown() {
        activeTasks.values().forEach(t -> t.token().cancel());
        executor.shutdownNow();
    }

    private LlmTaskResult finish(LlmTask task, LlmTaskResult result) {
        if (result.success()) {
            log.info("LLM task {} complete ({}ms, {} chars)", task.taskId(), result.durationMs(), result.output().length());
        } else {
            log.warn("LLM task {} failed after {}ms: {}", task.taskId(), result.durationMs(), result.error());
        }
        if (metrics != null) {
            metrics.recordLlmTask(task.stage(), result.success(), result.durationMs());
        }
        return result;
    }

    private static long elapsed(long startMs) {
        return System.currentTimeMillis() - startMs;
    }

    private record ActiveTask(String taskId, CancellationToken token, Future<String> future, long startMs) {}
}
