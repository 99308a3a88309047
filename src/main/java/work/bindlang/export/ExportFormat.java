package work.bindlang.export;

import java.util.Locale;

public enum ExportFormat {
    JSON,
    JSONL;

    public static ExportFormat from(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return ExportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported format: '" + value + "'. Use 'json' or 'jsonl'.");
        }
    }
}
