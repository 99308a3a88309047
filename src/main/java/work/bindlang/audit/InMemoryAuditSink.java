package work.bindlang.audit;

import java.util.ArrayList;
import java.util.List;
import work.bindlang.model.Attempt;

/**
 * Keeps written attempts in memory; handy for tests and embedding.
 */
public final class InMemoryAuditSink implements AuditSink {
    private final List<Attempt> attempts = new ArrayList<>();
    private int flushCount;
    private boolean closed;

    @Override
    public void write(Attempt attempt) {
        if (closed) {
            throw new IllegalStateException("Sink is closed");
        }
        attempts.add(attempt);
    }

    @Override
    public void flush() {
        flushCount++;
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<Attempt> attempts() {
        return List.copyOf(attempts);
    }

    public List<Attempt> failures() {
        return attempts.stream().filter(a -> !a.success()).toList();
    }

    public List<Attempt> successes() {
        return attempts.stream().filter(Attempt::success).toList();
    }

    public int flushCount() {
        return flushCount;
    }

    public boolean isClosed() {
        return closed;
    }
}
