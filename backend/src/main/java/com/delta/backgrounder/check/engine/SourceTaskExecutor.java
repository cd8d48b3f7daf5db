package com.delta.backgrounder.check.engine;

import com.delta.backgrounder.check.http.SourceFetchException;
import com.delta.backgrounder.check.model.SourceResult;
import com.delta.backgrounder.check.model.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Runs independent source tasks concurrently. Every task yields exactly one
 * {@link TaskOutcome}; a failing task never affects the others. An {@link Error} thrown by a
 * task is rethrown to the caller instead.
 */
@Service
public class SourceTaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(SourceTaskExecutor.class);

    private final ExecutorService sourceExecutor;

    public SourceTaskExecutor(@Qualifier("sourceExecutor") ExecutorService sourceExecutor) {
        this.sourceExecutor = sourceExecutor;
    }

    /**
     * Waits for every task and returns outcomes keyed by task id, in the caller's order.
     */
    public Map<String, TaskOutcome> collectAll(Map<String, Callable<SourceResult>> tasks) {
        return stream(tasks, outcome -> {
        });
    }

    /**
     * Same as {@link #collectAll} but hands each outcome to {@code onComplete} as soon as it
     * finishes. The callback runs on the calling thread, once per task, in completion order.
     */
    public Map<String, TaskOutcome> stream(Map<String, Callable<SourceResult>> tasks, Consumer<TaskOutcome> onComplete) {
        BlockingQueue<Completion> completed = new LinkedBlockingQueue<>();
        for (Map.Entry<String, Callable<SourceResult>> entry : tasks.entrySet()) {
            String taskId = entry.getKey();
            Callable<SourceResult> task = entry.getValue();
            try {
                CompletableFuture.runAsync(() -> {
                    try {
                        completed.add(new Completion(invoke(taskId, task), null));
                    } catch (Error e) {
                        completed.add(new Completion(null, e));
                        throw e;
                    }
                }, sourceExecutor);
            } catch (RejectedExecutionException e) {
                log.warn("Source task {} was rejected by the executor", taskId);
                completed.add(new Completion(TaskOutcome.failure(taskId, "rejected", e.getMessage(), Duration.ZERO), null));
            }
        }

        Map<String, TaskOutcome> byId = new LinkedHashMap<>();
        for (int i = 0; i < tasks.size(); i++) {
            Completion completion;
            try {
                completion = completed.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for source tasks", e);
            }
            if (completion.fatal() != null) {
                throw completion.fatal();
            }
            TaskOutcome outcome = completion.outcome();
            byId.put(outcome.taskId(), outcome);
            onComplete.accept(outcome);
        }

        Map<String, TaskOutcome> ordered = new LinkedHashMap<>();
        for (String taskId : tasks.keySet()) {
            ordered.put(taskId, byId.get(taskId));
        }
        return ordered;
    }

    static TaskOutcome invoke(String taskId, Callable<SourceResult> task) {
        long started = System.nanoTime();
        try {
            SourceResult result = task.call();
            return TaskOutcome.success(taskId, result, elapsedSince(started));
        } catch (SourceFetchException e) {
            log.warn("Source task {} failed: {} {}", taskId, e.getErrorCode(), e.getMessage());
            return TaskOutcome.failure(taskId, e.getErrorCode(), e.getMessage(), elapsedSince(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Source task {} interrupted", taskId);
            return TaskOutcome.failure(taskId, "interrupted", e.getMessage(), elapsedSince(started));
        } catch (Exception e) {
            log.warn("Source task {} failed", taskId, e);
            return TaskOutcome.failure(taskId, e.getClass().getSimpleName(), e.getMessage(), elapsedSince(started));
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private record Completion(TaskOutcome outcome, Error fatal) {
    }
}
