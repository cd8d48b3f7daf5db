package com.delta.backgrounder.check.engine;

import com.delta.backgrounder.check.model.BackgroundReport;
import com.delta.backgrounder.check.model.ProgressEvent;
import com.delta.backgrounder.check.model.ProgressPhase;
import com.delta.backgrounder.check.model.RunEvent;
import com.delta.backgrounder.check.model.TaskOutcome;
import com.delta.backgrounder.check.model.TaskState;
import com.delta.backgrounder.check.task.TaskLabels;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Progress state of one run. Events reach the sink in a fixed shape: one running event per
 * task, one completion per task, a single analyzing event, then the report.
 * Not thread-safe; the executor delivers completions on the calling thread.
 */
public class RunProgressTracker {
    static final String ANALYZING_LABEL = "AI analyzing all data...";

    public enum Stage {
        NOT_STARTED,
        RUNNING,
        ANALYZING,
        TERMINAL
    }

    private final Consumer<RunEvent> sink;
    private final Set<String> pending = new LinkedHashSet<>();
    private Stage stage = Stage.NOT_STARTED;
    private int total;
    private int completed;

    public RunProgressTracker(Consumer<RunEvent> sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public Stage stage() {
        return stage;
    }

    public void announce(Collection<String> taskIds) {
        require(Stage.NOT_STARTED, "announce");
        pending.addAll(taskIds);
        total = pending.size();
        stage = Stage.RUNNING;
        String launching = "Launching " + total + " concurrent searches...";
        for (String taskId : pending) {
            sink.accept(new ProgressEvent(
                ProgressPhase.SEARCH_START,
                taskId,
                TaskLabels.friendly(taskId),
                TaskState.RUNNING,
                0,
                total,
                launching
            ));
        }
    }

    public void taskDone(TaskOutcome outcome) {
        require(Stage.RUNNING, "taskDone");
        if (!pending.remove(outcome.taskId())) {
            throw new IllegalStateException("Task " + outcome.taskId() + " was not announced or already reported");
        }
        completed++;
        sink.accept(new ProgressEvent(
            ProgressPhase.TASK_DONE,
            outcome.taskId(),
            TaskLabels.friendly(outcome.taskId()),
            outcome.isSuccessful() ? TaskState.DONE : TaskState.ERROR,
            completed,
            total,
            outcome.isSuccessful() ? outcome.detail() : null
        ));
    }

    public void analyzing() {
        require(Stage.RUNNING, "analyzing");
        if (!pending.isEmpty()) {
            throw new IllegalStateException(pending.size() + " tasks have not reported yet");
        }
        stage = Stage.ANALYZING;
        sink.accept(new ProgressEvent(ProgressPhase.ANALYZING, null, ANALYZING_LABEL, TaskState.RUNNING, total, total, null));
    }

    public void complete(BackgroundReport report) {
        require(Stage.ANALYZING, "complete");
        stage = Stage.TERMINAL;
        sink.accept(report);
    }

    private void require(Stage expected, String operation) {
        if (stage != expected) {
            throw new IllegalStateException("Cannot " + operation + " while " + stage);
        }
    }
}
