package xyz.jphil.imagebatch.tools.batch;

import org.junit.jupiter.api.Test;
import xyz.jphil.imagebatch.tools.image.FailureKind;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class TaskQueueTest {

    private static final BufferedImage IMAGE = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);

    @Test
    void idsStartAtOneAndFollowInsertionOrder() {
        var queue = new TaskQueue();
        int a = queue.newTask(Path.of("a.png"));
        int b = queue.newTask(Path.of("b.png"));
        int c = queue.newTask(Path.of("c.png"));

        assertEquals(List.of(1, 2, 3), List.of(a, b, c));
        assertEquals(3, queue.size());
        assertEquals(List.of(1, 2, 3), queue.idsInState(TaskState.PENDING));
        assertEquals(Path.of("b.png"), queue.task(b).sourcePath());
    }

    @Test
    void walksTheWholeLifecycle() {
        var queue = new TaskQueue();
        int id = queue.newTask(Path.of("a.png"));

        assertTrue(queue.markDecoded(id, IMAGE));
        assertSame(IMAGE, queue.task(id).payload());
        assertTrue(queue.setDestination(id, Path.of("out/a.png")));
        assertTrue(queue.markProcessed(id, IMAGE));
        assertTrue(queue.markComplete(id));

        var task = queue.task(id);
        assertEquals(TaskState.COMPLETE, task.state());
        assertEquals(Path.of("out/a.png"), task.destinationPath());
        assertNull(task.payload(), "terminal tasks release their image");
        assertFalse(queue.hasFailures());
    }

    @Test
    void repeatedTransitionIsANoOp() {
        var queue = new TaskQueue();
        int id = queue.newTask(Path.of("a.png"));
        assertTrue(queue.markDecoded(id, IMAGE));
        assertFalse(queue.markDecoded(id, IMAGE));
        assertEquals(TaskState.DECODED, queue.task(id).state());
    }

    @Test
    void failureIsSticky() {
        var queue = new TaskQueue();
        int id = queue.newTask(Path.of("a.png"));
        assertTrue(queue.markFailed(id, FailureKind.DECODE, "File not found: a.png"));

        assertFalse(queue.markDecoded(id, IMAGE));
        assertFalse(queue.markProcessed(id, IMAGE));
        assertFalse(queue.markComplete(id));
        assertFalse(queue.setDestination(id, Path.of("out.png")));
        assertFalse(queue.markFailed(id, FailureKind.SAVE, "later"));

        var task = queue.task(id);
        assertEquals(TaskState.FAILED, task.state());
        assertEquals(FailureKind.DECODE, task.failure().kind());
        assertEquals("File not found: a.png", task.failure().reason());
        assertEquals(1, queue.failureCount());
    }

    @Test
    void completedTaskCannotFail() {
        var queue = new TaskQueue();
        int id = queue.newTask(Path.of("a.png"));
        queue.markDecoded(id, IMAGE);
        queue.markProcessed(id, IMAGE);
        queue.markComplete(id);

        assertFalse(queue.markFailed(id, FailureKind.SAVE, "too late"));
        assertEquals(TaskState.COMPLETE, queue.task(id).state());
    }

    @Test
    void blankReasonIsReplaced() {
        var queue = new TaskQueue();
        int id = queue.newTask(Path.of("a.png"));
        queue.markFailed(id, FailureKind.OPERATION, " ");
        assertEquals("unknown operation error", queue.task(id).failure().reason());
    }

    @Test
    void goingBackwardsIsRejected() {
        var queue = new TaskQueue();
        int id = queue.newTask(Path.of("a.png"));
        queue.markDecoded(id, IMAGE);
        queue.markProcessed(id, IMAGE);

        assertThrows(IllegalStateException.class, () -> queue.markDecoded(id, IMAGE));
    }

    @Test
    void destinationNeedsADecodedTask() {
        var queue = new TaskQueue();
        int id = queue.newTask(Path.of("a.png"));
        assertThrows(IllegalStateException.class, () -> queue.setDestination(id, Path.of("out.png")));
    }

    @Test
    void unknownIdIsReported() {
        var queue = new TaskQueue();
        queue.newTask(Path.of("a.png"));

        var e = assertThrows(NoSuchTaskException.class, () -> queue.task(42));
        assertEquals(42, e.taskId());
        assertThrows(NoSuchTaskException.class, () -> queue.markFailed(0, FailureKind.DECODE, "x"));
    }

    @Test
    void failuresAreListedInInsertionOrderByKind() {
        var queue = new TaskQueue();
        for (var name : List.of("a.png", "b.png", "c.png", "d.png")) {
            queue.newTask(Path.of(name));
        }
        queue.markFailed(3, FailureKind.DECODE, "broken");
        queue.markDecoded(2, IMAGE);
        queue.markFailed(2, FailureKind.OPERATION, "bad size");
        queue.markFailed(1, FailureKind.DECODE, "missing");

        assertTrue(queue.hasFailures());
        assertEquals(List.of(1, 2, 3), queue.failures().stream().map(TaskFailure::taskId).toList());
        assertEquals(List.of(Path.of("a.png"), Path.of("c.png")),
            queue.failures(FailureKind.DECODE).stream().map(TaskFailure::sourcePath).toList());
        assertEquals(List.of(4), queue.idsInState(TaskState.PENDING));
        assertEquals("c.png [decode]: broken", queue.failures().get(2).describe());
    }

    @Test
    void claimTakesFirstTaskAndHidesIt() {
        var queue = new TaskQueue();
        queue.newTask(Path.of("a.png"));
        queue.newTask(Path.of("b.png"));

        var first = queue.claimNext(TaskState.PENDING, TaskState.DECODING).orElseThrow();
        var second = queue.claimNext(TaskState.PENDING, TaskState.DECODING).orElseThrow();

        assertEquals(1, first.id());
        assertEquals(2, second.id());
        assertEquals(TaskState.DECODING, queue.task(1).state());
        assertTrue(queue.claimNext(TaskState.PENDING, TaskState.DECODING).isEmpty());
    }

    @Test
    void claimSkipsFailedTasks() {
        var queue = new TaskQueue();
        int a = queue.newTask(Path.of("a.png"));
        int b = queue.newTask(Path.of("b.png"));
        queue.markDecoded(a, IMAGE);
        queue.markDecoded(b, IMAGE);
        queue.markFailed(a, FailureKind.OPERATION, "nope");

        var claimed = queue.claimNext(TaskState.DECODED, TaskState.PROCESSING).orElseThrow();
        assertEquals(b, claimed.id());
        assertSame(IMAGE, claimed.payload());
    }

    @Test
    void claimRejectsStatesThatAreNotInFlight() {
        var queue = new TaskQueue();
        assertThrows(IllegalArgumentException.class, () -> queue.claimNext(TaskState.PENDING, TaskState.DECODED));
        assertThrows(IllegalArgumentException.class, () -> queue.claimNext(TaskState.PROCESSED, TaskState.DECODING));
    }

    @Test
    void concurrentClaimsNeverHandOutATaskTwice() throws Exception {
        var queue = new TaskQueue();
        int tasks = 500;
        for (int i = 0; i < tasks; i++) {
            queue.newTask(Path.of("img" + i + ".png"));
        }

        Set<Integer> claimed = ConcurrentHashMap.newKeySet();
        var duplicates = ConcurrentHashMap.<Integer>newKeySet();
        var executor = Executors.newFixedThreadPool(8);
        for (int w = 0; w < 8; w++) {
            executor.submit(() -> {
                var next = queue.claimNext(TaskState.PENDING, TaskState.DECODING);
                while (next.isPresent()) {
                    if (!claimed.add(next.get().id())) {
                        duplicates.add(next.get().id());
                    }
                    queue.markDecoded(next.get().id(), IMAGE);
                    next = queue.claimNext(TaskState.PENDING, TaskState.DECODING);
                }
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        assertTrue(duplicates.isEmpty(), "claimed twice: " + duplicates);
        assertEquals(tasks, claimed.size());
        assertEquals(tasks, queue.countInState(TaskState.DECODED));
        assertEquals(new HashSet<>(queue.idsInState(TaskState.DECODED)), claimed);
    }

    @Test
    void snapshotDoesNotChangeAfterwards() {
        var queue = new TaskQueue();
        int id = queue.newTask(Path.of("a.png"));
        var before = queue.snapshot();
        queue.markFailed(id, FailureKind.DECODE, "gone");

        assertEquals(TaskState.PENDING, before.get(0).state());
        assertThrows(UnsupportedOperationException.class, () -> before.add(null));
    }
}
