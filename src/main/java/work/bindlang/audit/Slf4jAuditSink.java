package work.bindlang.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.bindlang.model.Attempt;
import work.bindlang.model.FailureReason;

/**
 * Emits each attempt as a log line: successes at INFO, failures at DEBUG.
 */
public final class Slf4jAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jAuditSink.class);

    @Override
    public void write(Attempt attempt) {
        if (attempt.success()) {
            log.info("Unit {} bound at {}", attempt.unitId(), attempt.timestamp());
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("Unit {} not bound: {}", attempt.unitId(),
                attempt.failureReasons().stream().map(FailureReason::message).toList());
        }
    }

    @Override
    public void flush() {}

    @Override
    public void close() {}
}
