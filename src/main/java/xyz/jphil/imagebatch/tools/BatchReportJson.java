package xyz.jphil.imagebatch.tools;

import org.json.JSONArray;
import org.json.JSONObject;
import xyz.jphil.imagebatch.tools.batch.BatchReport;
import xyz.jphil.imagebatch.tools.image.FailureKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes a {@link BatchReport} as JSON for {@code --report}:
 * <pre>
 * {"meta": {"command", "timestampUTCISO", "total"},
 *  "counts": {"completed", "failed", "decode", "operation", "save"},
 *  "completed": ["out/a.png", ...],
 *  "failed": [{"id", "file", "kind", "reason"}, ...]}
 * </pre>
 */
public class BatchReportJson {

    public static JSONObject toJson(BatchReport report, String command) {
        var utcTimestamp = Instant.now()
            .atOffset(ZoneOffset.UTC)
            .format(DateTimeFormatter.ISO_INSTANT);

        var meta = new JSONObject()
            .put("command", command)
            .put("timestampUTCISO", utcTimestamp)
            .put("total", report.total());

        var counts = new JSONObject()
            .put("completed", report.completedCount())
            .put("failed", report.failedCount());
        for (var kind : FailureKind.values()) {
            counts.put(kind.label(), report.failureCount(kind));
        }

        var completed = new JSONArray();
        report.completed().forEach(path -> completed.put(path.toString()));

        var failed = new JSONArray();
        for (var failure : report.failed()) {
            failed.put(new JSONObject()
                .put("id", failure.taskId())
                .put("file", failure.sourcePath().toString())
                .put("kind", failure.kind().label())
                .put("reason", failure.reason()));
        }

        return new JSONObject()
            .put("meta", meta)
            .put("counts", counts)
            .put("completed", completed)
            .put("failed", failed);
    }

    public static void write(BatchReport report, String command, Path file) throws IOException {
        Files.writeString(file, toJson(report, command).toString(2));
    }
}
