package work.bindlang.export;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import work.bindlang.model.Attempt;
import work.bindlang.model.FailureReason;
import work.bindlang.shared.Version;

/**
 * Writes binding attempts as a JSON document (with a metadata summary) or as JSONL.
 */
public final class AuditExporter {
    private AuditExporter() {}

    public static void export(List<Attempt> attempts, Path path, ExportFormat format) {
        switch (format) {
            case JSON -> toJson(attempts, path, true);
            case JSONL -> toJsonl(attempts, path);
        }
    }

    /**
     * Exports only the failed attempts and returns how many were written.
     */
    public static int exportFailures(List<Attempt> attempts, Path path, ExportFormat format) {
        var failures = attempts.stream().filter(a -> !a.success()).toList();
        export(failures, path, format);
        return failures.size();
    }

    public static void toJson(List<Attempt> attempts, Path path, boolean includeMetadata) {
        Map<String, Object> document = new LinkedHashMap<>();
        if (includeMetadata) {
            document.put("metadata", metadata(attempts));
        }
        document.put("auditTrail", attempts.stream().map(Attempt::toSerializableMap).toList());
        JsonDocuments.writePretty(path, document);
    }

    public static void toJsonl(List<Attempt> attempts, Path path) {
        JsonDocuments.writeLines(path, attempts.stream().map(Attempt::toSerializableMap).toList());
    }

    public static Map<String, Object> metadata(List<Attempt> attempts) {
        int total = attempts.size();
        int successes = (int) attempts.stream().filter(Attempt::success).count();
        Map<String, Integer> breakdown = new TreeMap<>();
        for (Attempt attempt : attempts) {
            if (attempt.success()) continue;
            for (FailureReason reason : attempt.failureReasons()) {
                breakdown.merge(reason.kind().wireName(), 1, Integer::sum);
            }
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("exportTimestamp", LocalDateTime.now().toString());
        metadata.put("version", Version.current());
        metadata.put("totalAttempts", total);
        metadata.put("successCount", successes);
        metadata.put("failureCount", total - successes);
        metadata.put("successRate", total > 0 ? successes * 100.0 / total : 0.0);
        metadata.put("failureTypeBreakdown", breakdown);
        return metadata;
    }
}
