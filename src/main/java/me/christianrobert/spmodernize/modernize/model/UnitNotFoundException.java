package me.christianrobert.spmodernize.modernize.model;

import me.christianrobert.spmodernize.core.model.UnitIdentity;

public class UnitNotFoundException extends RuntimeException {

    private final UnitIdentity unit;

    public UnitNotFoundException(UnitIdentity unit) {
        super("Stored procedure not found: " + unit);
        this.unit = unit;
    }

    public UnitIdentity getUnit() {
        return unit;
    }
}
