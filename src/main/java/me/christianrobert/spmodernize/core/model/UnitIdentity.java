package me.christianrobert.spmodernize.core.model;

import java.util.Objects;

/**
 * Identity of a stored routine: schema (namespace) plus routine name.
 * Names are compared exactly as the catalog reports them.
 */
public class UnitIdentity {

    private final String schema;
    private final String name;

    public UnitIdentity(String schema, String name) {
        if (schema == null || schema.trim().isEmpty()) {
            throw new IllegalArgumentException("Schema must not be empty");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Unit name must not be empty");
        }
        this.schema = schema;
        this.name = name;
    }

    public static UnitIdentity of(String schema, String name) {
        return new UnitIdentity(schema, name);
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    /**
     * @return bracket-quoted two-part name, e.g. {@code [dbo].[MyProc]}
     */
    public String getQuotedName() {
        return quote(schema) + "." + quote(name);
    }

    private static String quote(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnitIdentity that = (UnitIdentity) o;
        return schema.equals(that.schema) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, name);
    }

    @Override
    public String toString() {
        return schema + "." + name;
    }
}
