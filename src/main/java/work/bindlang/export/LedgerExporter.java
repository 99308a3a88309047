package work.bindlang.export;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import work.bindlang.lifecycle.Transition;
import work.bindlang.shared.Version;

/**
 * Writes the transition ledger as a JSON document (with per-transition counts) or as JSONL.
 */
public final class LedgerExporter {
    private LedgerExporter() {}

    public static void export(List<Transition> transitions, Path path, ExportFormat format) {
        switch (format) {
            case JSON -> toJson(transitions, path, true);
            case JSONL -> JsonDocuments.writeLines(path, transitions.stream().map(Transition::toSerializableMap).toList());
        }
    }

    public static void toJson(List<Transition> transitions, Path path, boolean includeMetadata) {
        Map<String, Object> document = new LinkedHashMap<>();
        if (includeMetadata) {
            Map<String, Integer> breakdown = new TreeMap<>();
            for (Transition transition : transitions) {
                breakdown.merge(transition.from().wireName() + " -> " + transition.to().wireName(), 1, Integer::sum);
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("exportTimestamp", LocalDateTime.now().toString());
            metadata.put("version", Version.current());
            metadata.put("totalTransitions", transitions.size());
            metadata.put("transitionBreakdown", breakdown);
            document.put("metadata", metadata);
        }
        document.put("ledger", transitions.stream().map(Transition::toSerializableMap).toList());
        JsonDocuments.writePretty(path, document);
    }
}
