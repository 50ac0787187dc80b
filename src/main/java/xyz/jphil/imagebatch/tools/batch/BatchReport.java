package xyz.jphil.imagebatch.tools.batch;

import xyz.jphil.imagebatch.tools.image.FailureKind;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a finished run.
 *
 * @param completed output files written, in input order
 * @param failed    every image that did not make it, with its reason
 */
public record BatchReport(int total, List<Path> completed, List<TaskFailure> failed) {

    public BatchReport {
        completed = List.copyOf(completed);
        failed = List.copyOf(failed);
    }

    public static BatchReport from(List<Task> tasks) {
        var completed = tasks.stream()
            .filter(task -> task.state() == TaskState.COMPLETE)
            .map(Task::destinationPath)
            .toList();
        var failed = tasks.stream()
            .filter(Task::isFailed)
            .map(Task::failure)
            .toList();
        return new BatchReport(tasks.size(), completed, failed);
    }

    public int completedCount() {
        return completed.size();
    }

    public int failedCount() {
        return failed.size();
    }

    public int failureCount(FailureKind kind) {
        return (int) failed.stream().filter(failure -> failure.kind() == kind).count();
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    public String summary() {
        return String.format("%d completed, %d failed (decode: %d, operation: %d, save: %d) of %d images",
            completedCount(), failedCount(), failureCount(FailureKind.DECODE),
            failureCount(FailureKind.OPERATION), failureCount(FailureKind.SAVE), total);
    }
}
