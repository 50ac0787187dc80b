package xyz.jphil.imagebatch.tools.batch;

public class NoSuchTaskException extends RuntimeException {

    private final int taskId;

    public NoSuchTaskException(int taskId) {
        super("No such task: " + taskId);
        this.taskId = taskId;
    }

    public int taskId() {
        return taskId;
    }
}
