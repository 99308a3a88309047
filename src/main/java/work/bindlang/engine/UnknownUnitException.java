package work.bindlang.engine;

import java.util.NoSuchElementException;

/**
 * Lookup of an id that is not in the registry.
 */
public final class UnknownUnitException extends NoSuchElementException {
    private final String unitId;

    public UnknownUnitException(String unitId) {
        super("Unit not registered: " + unitId);
        this.unitId = unitId;
    }

    public String unitId() {
        return unitId;
    }
}
