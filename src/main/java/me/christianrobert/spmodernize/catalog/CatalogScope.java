package me.christianrobert.spmodernize.catalog;

/**
 * Which units a catalog lookup returns. Null schema or name means "any".
 */
public class CatalogScope {

    private final String schema;
    private final String name;
    private final boolean legacyOnly;

    public CatalogScope(String schema, String name, boolean legacyOnly) {
        this.schema = blankToNull(schema);
        this.name = blankToNull(name);
        this.legacyOnly = legacyOnly;
    }

    public static CatalogScope all() {
        return new CatalogScope(null, null, false);
    }

    public static CatalogScope legacyIn(String schema) {
        return new CatalogScope(schema, null, true);
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    /** Only units whose text contains at least one deprecated construct. */
    public boolean isLegacyOnly() {
        return legacyOnly;
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    @Override
    public String toString() {
        return "CatalogScope{schema=" + (schema != null ? schema : "*")
                + ", name=" + (name != null ? name : "*") + ", legacyOnly=" + legacyOnly + "}";
    }
}
