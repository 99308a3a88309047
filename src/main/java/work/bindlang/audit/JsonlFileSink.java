package work.bindlang.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import work.bindlang.model.Attempt;

/**
 * Streams attempts as newline-delimited JSON, writing to disk every {@code bufferSize} attempts.
 */
public final class JsonlFileSink implements AuditSink {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Path path;
    private final int bufferSize;
    private final List<Attempt> buffer = new ArrayList<>();
    private BufferedWriter writer;

    public JsonlFileSink(Path path) {
        this(path, 10, true);
    }

    public JsonlFileSink(Path path, int bufferSize, boolean append) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be >= 1");
        }
        this.path = path;
        this.bufferSize = bufferSize;
        try {
            var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.writer = append
                ? Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)
                : Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to open audit file " + path, ex);
        }
    }

    public Path path() {
        return path;
    }

    @Override
    public void write(Attempt attempt) {
        if (writer == null) {
            throw new IllegalStateException("Sink is closed: " + path);
        }
        buffer.add(attempt);
        if (buffer.size() >= bufferSize) {
            flush();
        }
    }

    @Override
    public void flush() {
        if (writer == null || buffer.isEmpty()) {
            return;
        }
        try {
            for (Attempt attempt : buffer) {
                writer.write(toJson(attempt));
                writer.newLine();
            }
            writer.flush();
            buffer.clear();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write audit file " + path, ex);
        }
    }

    @Override
    public void close() {
        if (writer == null) {
            return;
        }
        try {
            flush();
            writer.close();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to close audit file " + path, ex);
        } finally {
            writer = null;
        }
    }

    private static String toJson(Attempt attempt) {
        try {
            return JSON.writeValueAsString(attempt.toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Unable to serialize attempt for " + attempt.unitId(), ex);
        }
    }
}
