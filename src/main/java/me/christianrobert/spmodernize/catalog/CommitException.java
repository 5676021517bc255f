package me.christianrobert.spmodernize.catalog;

import me.christianrobert.spmodernize.core.model.UnitIdentity;

/**
 * Writing a definition to the store failed. The store is left as it was before the call.
 */
public class CommitException extends RuntimeException {

    private final UnitIdentity unit;

    public CommitException(UnitIdentity unit, String message, Throwable cause) {
        super(message, cause);
        this.unit = unit;
    }

    public CommitException(UnitIdentity unit, String message) {
        super(message);
        this.unit = unit;
    }

    public UnitIdentity getUnit() {
        return unit;
    }
}
