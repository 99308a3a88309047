package work.bindlang.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Shared JSON / JSONL file writing for the exporters.
 */
final class JsonDocuments {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter PRETTY = JSON.writerWithDefaultPrettyPrinter();

    private JsonDocuments() {}

    static void writePretty(Path path, Map<String, Object> document) {
        try {
            prepareParent(path);
            PRETTY.writeValue(path.toFile(), document);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write " + path, ex);
        }
    }

    static void writeLines(Path path, List<Map<String, Object>> records) {
        try {
            prepareParent(path);
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                for (var record : records) {
                    writer.write(JSON.writeValueAsString(record));
                    writer.newLine();
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write " + path, ex);
        }
    }

    private static void prepareParent(Path path) throws IOException {
        var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
