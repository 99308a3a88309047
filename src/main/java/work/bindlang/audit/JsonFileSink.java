package work.bindlang.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import work.bindlang.model.Attempt;

/**
 * Collects attempts in memory and writes them as one pretty-printed JSON array on close.
 * Nothing is written when no attempt was recorded.
 */
public final class JsonFileSink implements AuditSink {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private final Path path;
    private final List<Attempt> attempts = new ArrayList<>();

    public JsonFileSink(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public void write(Attempt attempt) {
        attempts.add(attempt);
    }

    @Override
    public void flush() {}

    @Override
    public void close() {
        if (attempts.isEmpty()) {
            return;
        }
        try {
            var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            var payload = attempts.stream().map(Attempt::toSerializableMap).toList();
            WRITER.writeValue(path.toFile(), payload);
            attempts.clear();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write audit file " + path, ex);
        }
    }
}
