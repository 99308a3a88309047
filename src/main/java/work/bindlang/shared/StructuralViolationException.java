package work.bindlang.shared;

/**
 * Base type for fatal invariant violations (dependency cycles, illegal lifecycle transitions).
 * Guard mismatches are never reported through this channel.
 */
public abstract class StructuralViolationException extends RuntimeException {
    protected StructuralViolationException(String message) {
        super(message);
    }
}
