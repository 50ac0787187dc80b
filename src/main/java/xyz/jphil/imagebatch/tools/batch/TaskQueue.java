package xyz.jphil.imagebatch.tools.batch;

import xyz.jphil.imagebatch.tools.image.FailureKind;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * All tasks of one batch run, in creation order. The only place task state
 * changes. Every public method holds the queue lock for its whole duration
 * and only touches task metadata, never image data or files.
 */
public class TaskQueue {

    private final Object lock = new Object();
    private final List<Task> tasks = new ArrayList<>();
    private final Map<Integer, Integer> positions = new HashMap<>();
    private int nextId = 1;

    public int newTask(Path sourcePath) {
        synchronized (lock) {
            int id = nextId++;
            positions.put(id, tasks.size());
            tasks.add(Task.pending(id, sourcePath));
            return id;
        }
    }

    public boolean markDecoded(int id, BufferedImage image) {
        return advance(id, TaskState.DECODED, task -> task.withPayload(image, TaskState.DECODED));
    }

    public boolean markProcessed(int id, BufferedImage image) {
        return advance(id, TaskState.PROCESSED, task -> task.withPayload(image, TaskState.PROCESSED));
    }

    public boolean markComplete(int id) {
        return advance(id, TaskState.COMPLETE, task -> task.withState(TaskState.COMPLETE));
    }

    /**
     * Fails a task that has not reached a terminal state. The first failure
     * wins: later calls for the same id are ignored.
     *
     * @return whether the task changed
     */
    public boolean markFailed(int id, FailureKind kind, String reason) {
        var message = reason == null || reason.isBlank() ? "unknown " + kind.label() + " error" : reason;
        synchronized (lock) {
            int position = positionOf(id);
            var current = tasks.get(position);
            if (current.state().isTerminal()) {
                return false;
            }
            tasks.set(position, current.failed(kind, message));
            return true;
        }
    }

    /**
     * Records the output path of a task that is past decoding. Ignored for
     * failed tasks.
     */
    public boolean setDestination(int id, Path destination) {
        synchronized (lock) {
            int position = positionOf(id);
            var current = tasks.get(position);
            if (current.isFailed()) {
                return false;
            }
            if (current.state().ordinal() < TaskState.DECODED.ordinal() || current.state().isTerminal()) {
                throw new IllegalStateException("Cannot set output path of " + current);
            }
            tasks.set(position, current.withDestination(destination));
            return true;
        }
    }

    /**
     * Takes the first task in state {@code from} and moves it to the in-flight
     * state {@code claimed}, so no other worker can take it.
     */
    public Optional<Task> claimNext(TaskState from, TaskState claimed) {
        if (!claimed.isInFlight() || !from.precedes(claimed)) {
            throw new IllegalArgumentException("Cannot claim " + from + " tasks as " + claimed);
        }
        synchronized (lock) {
            for (int position = 0; position < tasks.size(); position++) {
                var task = tasks.get(position);
                if (task.state() == from) {
                    var inFlight = task.withState(claimed);
                    tasks.set(position, inFlight);
                    return Optional.of(inFlight);
                }
            }
            return Optional.empty();
        }
    }

    public Task task(int id) {
        synchronized (lock) {
            return tasks.get(positionOf(id));
        }
    }

    public List<Task> tasksInState(TaskState state) {
        synchronized (lock) {
            return tasks.stream().filter(task -> task.state() == state).toList();
        }
    }

    public List<Integer> idsInState(TaskState state) {
        synchronized (lock) {
            return tasks.stream().filter(task -> task.state() == state).map(Task::id).toList();
        }
    }

    public int countInState(TaskState state) {
        synchronized (lock) {
            return (int) tasks.stream().filter(task -> task.state() == state).count();
        }
    }

    public List<Task> snapshot() {
        synchronized (lock) {
            return List.copyOf(tasks);
        }
    }

    public int size() {
        synchronized (lock) {
            return tasks.size();
        }
    }

    public boolean hasFailures() {
        synchronized (lock) {
            return tasks.stream().anyMatch(Task::isFailed);
        }
    }

    public int failureCount() {
        return countInState(TaskState.FAILED);
    }

    public List<TaskFailure> failures() {
        synchronized (lock) {
            return tasks.stream().filter(Task::isFailed).map(Task::failure).toList();
        }
    }

    public List<TaskFailure> failures(FailureKind kind) {
        return failures().stream().filter(failure -> failure.kind() == kind).toList();
    }

    private boolean advance(int id, TaskState target, UnaryOperator<Task> transition) {
        synchronized (lock) {
            int position = positionOf(id);
            var current = tasks.get(position);
            if (current.isFailed() || current.state() == target) {
                return false;
            }
            if (!current.state().precedes(target)) {
                throw new IllegalStateException(String.format("%s cannot go back to %s", current, target));
            }
            tasks.set(position, transition.apply(current));
            return true;
        }
    }

    private int positionOf(int id) {
        var position = positions.get(id);
        if (position == null) {
            throw new NoSuchTaskException(id);
        }
        return position;
    }
}
