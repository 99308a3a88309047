package work.bindlang.template;

/**
 * A unit (or template definition) does not satisfy a template's constraints.
 */
public final class TemplateViolationException extends IllegalArgumentException {
    public TemplateViolationException(String message) {
        super(message);
    }
}
