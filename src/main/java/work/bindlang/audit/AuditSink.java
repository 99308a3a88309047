package work.bindlang.audit;

import work.bindlang.model.Attempt;

/**
 * Pluggable destination for binding attempts. The engine calls {@link #write} once per attempt
 * and {@link #close} on teardown; failures propagate to the caller without retry.
 */
public interface AuditSink extends AutoCloseable {
    void write(Attempt attempt);

    void flush();

    @Override
    void close();
}
