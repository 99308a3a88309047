package work.bindlang.guard;

/**
 * Malformed temporal expression. Always caught by the temporal checkers and turned into a
 * failure diagnostic.
 */
public final class TemporalExpressionException extends IllegalArgumentException {
    public TemporalExpressionException(String message) {
        super(message);
    }

    public TemporalExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
