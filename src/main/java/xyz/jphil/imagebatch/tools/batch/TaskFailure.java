package xyz.jphil.imagebatch.tools.batch;

import xyz.jphil.imagebatch.tools.image.FailureKind;

import java.nio.file.Path;

public record TaskFailure(int taskId, Path sourcePath, FailureKind kind, String reason) {

    public String describe() {
        return String.format("%s [%s]: %s", sourcePath, kind.label(), reason);
    }
}
