package me.christianrobert.spmodernize.core.model;

/**
 * A stored routine as seen by the catalog: identity plus the definition text
 * at the time of enumeration. The text is owned by the definition store.
 */
public class SourceUnit {

    private final UnitIdentity identity;
    private final String text;

    public SourceUnit(UnitIdentity identity, String text) {
        this.identity = identity;
        this.text = text != null ? text : "";
    }

    public UnitIdentity getIdentity() {
        return identity;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "SourceUnit{" + identity + ", length=" + text.length() + "}";
    }
}
