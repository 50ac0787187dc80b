package xyz.jphil.imagebatch.tools.batch;

import java.nio.file.Path;

/**
 * Settings of one batch run.
 *
 * @param destination         output directory
 * @param nameExpression      output file name pattern, null to keep input names
 * @param targetFormat        output format extension, null to keep formats
 * @param abortOnError        stop before processing when any image failed to decode
 * @param abortOnProcessError stop before saving when any operation failed
 * @param workerCount         size of the worker pool
 */
public record BatchOptions(Path destination, String nameExpression, String targetFormat,
                           boolean overwrite, boolean abortOnError, boolean abortOnProcessError,
                           int workerCount) {

    public BatchOptions {
        if (destination == null) {
            throw new IllegalArgumentException("destination is required");
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, got " + workerCount);
        }
    }

    public static BatchOptions defaults(Path destination) {
        return new BatchOptions(destination, null, null, false, false, false,
            Runtime.getRuntime().availableProcessors());
    }

    public BatchOptions withWorkers(int workers) {
        return new BatchOptions(destination, nameExpression, targetFormat, overwrite, abortOnError,
            abortOnProcessError, workers);
    }

    public boolean abortsOnFailure() {
        return abortOnError || abortOnProcessError;
    }
}
