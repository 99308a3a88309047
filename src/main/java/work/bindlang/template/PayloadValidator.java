package work.bindlang.template;

import java.util.Map;

/**
 * Extra payload validation run after the required-field check. Throw
 * {@link TemplateViolationException} to reject.
 */
@FunctionalInterface
public interface PayloadValidator {
    PayloadValidator NONE = payload -> {};

    void validate(Map<String, Object> payload);
}
