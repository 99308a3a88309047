package work.bindlang.lifecycle;

import java.util.Locale;

/**
 * Lifecycle states of a registered unit.
 */
public enum UnitState {
    CREATED,
    DORMANT,
    ACTIVATED,
    ARCHIVED,
    EXPIRED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
