package work.bindlang.audit;

import java.util.Arrays;
import java.util.List;
import work.bindlang.model.Attempt;

/**
 * Fans every call out to each delegate in order.
 */
public final class MultiplexAuditSink implements AuditSink {
    private final List<AuditSink> sinks;

    public MultiplexAuditSink(AuditSink... sinks) {
        this(Arrays.asList(sinks));
    }

    public MultiplexAuditSink(List<AuditSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void write(Attempt attempt) {
        for (AuditSink sink : sinks) {
            sink.write(attempt);
        }
    }

    @Override
    public void flush() {
        for (AuditSink sink : sinks) {
            sink.flush();
        }
    }

    @Override
    public void close() {
        RuntimeException failure = null;
        for (AuditSink sink : sinks) {
            try {
                sink.close();
            } catch (RuntimeException ex) {
                if (failure == null) {
                    failure = ex;
                } else {
                    failure.addSuppressed(ex);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
