package xyz.jphil.imagebatch.tools.batch;

import xyz.jphil.imagebatch.tools.image.FailureKind;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * One input file on its way through the pipeline.
 * Immutable: {@link TaskQueue} swaps in a new value on every transition, so a
 * Task handed out by a query never changes underneath its reader.
 *
 * @param payload         decoded or processed image, null before decoding and after a terminal state
 * @param destinationPath output file, null until paths are resolved and again once the task fails
 * @param failure         set only in state {@link TaskState#FAILED}
 */
public record Task(int id, Path sourcePath, BufferedImage payload, Path destinationPath,
                   TaskState state, TaskFailure failure) {

    static Task pending(int id, Path sourcePath) {
        return new Task(id, sourcePath, null, null, TaskState.PENDING, null);
    }

    Task withState(TaskState next) {
        var image = next.isTerminal() ? null : payload;
        return new Task(id, sourcePath, image, destinationPath, next, failure);
    }

    Task withPayload(BufferedImage image, TaskState next) {
        return new Task(id, sourcePath, image, destinationPath, next, failure);
    }

    Task withDestination(Path destination) {
        return new Task(id, sourcePath, payload, destination, state, failure);
    }

    Task failed(FailureKind kind, String reason) {
        var cause = new TaskFailure(id, sourcePath, kind, reason);
        return new Task(id, sourcePath, null, null, TaskState.FAILED, cause);
    }

    public boolean isFailed() {
        return state == TaskState.FAILED;
    }

    public String displayName() {
        var fileName = sourcePath.getFileName();
        return fileName != null ? fileName.toString() : sourcePath.toString();
    }

    @Override
    public String toString() {
        return String.format("Task#%d[%s, %s]", id, displayName(), state);
    }
}
