package me.christianrobert.spmodernize.journal;

/**
 * Lifecycle of a backup record. Transitions only ever go one step forward:
 * BACKED_UP → UPDATED → ROLLED_BACK.
 */
public enum BackupStatus {

    /** Original text saved, rewritten text not (yet) committed. */
    BACKED_UP,

    /** Rewritten text committed to the definition store. */
    UPDATED,

    /** Original text restored; terminal. */
    ROLLED_BACK;

    public boolean canTransitionTo(BackupStatus target) {
        return target != null && target.ordinal() == ordinal() + 1;
    }

    /**
     * @return the only status a record may be in before moving to this one, or null for BACKED_UP
     */
    public BackupStatus predecessor() {
        return ordinal() == 0 ? null : values()[ordinal() - 1];
    }

    public static BackupStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
