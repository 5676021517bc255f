package me.christianrobert.spmodernize.modernize.model;

import me.christianrobert.spmodernize.core.model.UnitIdentity;

/**
 * No UPDATED journal record exists that a rollback could restore.
 */
public class RollbackNotFoundException extends RuntimeException {

    private final UnitIdentity unit;

    public RollbackNotFoundException(UnitIdentity unit, String message) {
        super(message);
        this.unit = unit;
    }

    public UnitIdentity getUnit() {
        return unit;
    }
}
