package work.bindlang.audit;

import work.bindlang.model.Attempt;

/**
 * No-op sink used when the engine is built without one.
 */
public final class NullAuditSink implements AuditSink {
    public static final NullAuditSink INSTANCE = new NullAuditSink();

    private NullAuditSink() {}

    @Override
    public void write(Attempt attempt) {}

    @Override
    public void flush() {}

    @Override
    public void close() {}
}
