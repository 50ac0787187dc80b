package xyz.jphil.imagebatch.tools.batch;

import xyz.jphil.imagebatch.tools.image.FailureKind;
import xyz.jphil.imagebatch.tools.image.ImageCodec;
import xyz.jphil.imagebatch.tools.image.ImageFormat;
import xyz.jphil.imagebatch.tools.image.ImageOperation;
import xyz.jphil.imagebatch.tools.image.TaskException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs one operation over many images.
 *
 * <p>Stages run strictly one after another: decode, resolve output paths and
 * confirm overwrites, apply the operation, save. Inside the decode, operation
 * and save stages a fixed pool of workers repeatedly claims the first task
 * waiting for that stage from the {@link TaskQueue}, works on it without
 * holding the queue lock, then records the result. A failing image is marked
 * failed and skipped by every later stage; only configuration errors, a
 * declined overwrite and the abort policies end the run early.
 */
public class BatchRunner {

    private final ImageCodec codec;
    private final ImageOperation operation;
    private final ProgressReporter reporter;
    private final OverwritePrompt prompt;
    private final BatchOptions options;
    private final TaskQueue queue = new TaskQueue();

    public BatchRunner(ImageCodec codec, ImageOperation operation, ProgressReporter reporter,
                       OverwritePrompt prompt, BatchOptions options) {
        this.codec = codec;
        this.operation = operation;
        this.reporter = reporter;
        this.prompt = prompt;
        this.options = options;
    }

    TaskQueue queue() {
        return queue;
    }

    public BatchReport run(List<Path> sources) throws BatchException {
        var resolver = new OutputPathResolver(options.destination(), options.nameExpression(), options.targetFormat());
        var format = ImageFormat.fromExtension(options.targetFormat()).orElse(null);
        ExecutorService executor = null;
        try {
            resolver.validate();
            for (var source : sources) {
                queue.newTask(source);
            }

            executor = Executors.newFixedThreadPool(options.workerCount());

            runStage(executor, "Decoding", TaskState.PENDING, TaskState.DECODING, this::decode);
            if (options.abortOnError()) {
                abortIfFailed("Image processing exited with %d errors", queue.failures());
            }

            assignDestinations(resolver);

            runStage(executor, operation.verb(), TaskState.DECODED, TaskState.PROCESSING, this::process);
            if (options.abortOnProcessError()) {
                abortIfFailed("Image processing stopped before saving after %d operation errors",
                    queue.failures(FailureKind.OPERATION));
            }

            runStage(executor, "Saving", TaskState.PROCESSED, TaskState.SAVING, task -> save(task, format));

            var report = BatchReport.from(queue.snapshot());
            reporter.finish(report.summary());
            return report;
        } catch (BatchException e) {
            reporter.finish("Stopped with " + BatchReport.from(queue.snapshot()).summary());
            throw e;
        } finally {
            if (executor != null) {
                shutdown(executor);
            }
        }
    }

    private void assignDestinations(OutputPathResolver resolver) throws ConfigurationException, UserAbortException {
        var decoded = queue.tasksInState(TaskState.DECODED);
        if (decoded.isEmpty()) {
            return;
        }
        var outputs = resolver.resolve(decoded.stream().map(Task::sourcePath).toList());
        new OverwriteGuard(reporter, prompt).check(outputs, options.overwrite());
        for (int i = 0; i < decoded.size(); i++) {
            queue.setDestination(decoded.get(i).id(), outputs.get(i));
        }
    }

    private void abortIfFailed(String headline, List<TaskFailure> failures) throws BatchFailedException {
        if (failures.isEmpty()) {
            return;
        }
        var message = String.format(headline, failures.size());
        reporter.message("Aborting: " + message);
        throw new BatchFailedException(message, failures);
    }

    /**
     * Claims tasks in state {@code from} until none is left, on every worker of
     * the pool, and waits for all of them.
     */
    private void runStage(ExecutorService executor, String title, TaskState from, TaskState claimed,
                          Consumer<Task> step) throws BatchInterruptedException {
        int size = queue.countInState(from);
        reporter.stage(title, size);
        if (size == 0) {
            return;
        }

        var moreWork = new AtomicBoolean(true);
        List<Future<?>> workers = new ArrayList<>();
        for (int i = 0; i < Math.min(options.workerCount(), size); i++) {
            workers.add(executor.submit(() -> {
                while (moreWork.get()) {
                    Optional<Task> next = queue.claimNext(from, claimed);
                    if (next.isEmpty()) {
                        moreWork.set(false);
                        break;
                    }
                    step.accept(next.get());
                }
            }));
        }

        try {
            for (var worker : workers) {
                worker.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new BatchInterruptedException(title.toLowerCase(), e);
        } catch (ExecutionException e) {
            // steps record RuntimeExceptions on the task, so only an Error gets here
            throw new IllegalStateException(title + " worker died", e.getCause());
        }
    }

    private void decode(Task task) {
        reporter.taskStarted(describe("Decoding", task));
        try {
            var image = codec.decode(task.sourcePath());
            queue.markDecoded(task.id(), image);
            reporter.taskFinished(describe("Decoded", task));
        } catch (TaskException e) {
            fail(task, e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            fail(task, FailureKind.DECODE, e.toString());
        }
    }

    private void process(Task task) {
        reporter.taskStarted(describe(operation.verb(), task));
        try {
            var image = operation.apply(task.payload());
            queue.markProcessed(task.id(), image);
            reporter.taskFinished(describe("Processed", task));
        } catch (TaskException e) {
            fail(task, e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            fail(task, FailureKind.OPERATION, e.toString());
        }
    }

    private void save(Task task, ImageFormat format) {
        reporter.taskStarted(describe("Saving", task));
        try {
            codec.save(task.payload(), task.destinationPath(), format);
            queue.markComplete(task.id());
            reporter.taskFinished("Saved " + task.destinationPath());
        } catch (TaskException e) {
            fail(task, e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            fail(task, FailureKind.SAVE, e.toString());
        }
    }

    private void fail(Task task, FailureKind kind, String reason) {
        if (queue.markFailed(task.id(), kind, reason)) {
            reporter.taskFailed(queue.task(task.id()).failure().describe());
        }
    }

    private static String describe(String verb, Task task) {
        return String.format("%s #%d %s", verb, task.id(), task.displayName());
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
