package me.christianrobert.spmodernize.modernize.model;

/**
 * Switches for one apply or batch run. The defaults never touch the database:
 * backups on, preview only.
 */
public class ModernizationOptions {

    private final boolean backupEnabled;
    private final boolean previewOnly;

    public ModernizationOptions(boolean backupEnabled, boolean previewOnly) {
        this.backupEnabled = backupEnabled;
        this.previewOnly = previewOnly;
    }

    public static ModernizationOptions defaults() {
        return new ModernizationOptions(true, true);
    }

    /** Commit with backups. */
    public static ModernizationOptions commit() {
        return new ModernizationOptions(true, false);
    }

    public boolean isBackupEnabled() {
        return backupEnabled;
    }

    public boolean isPreviewOnly() {
        return previewOnly;
    }

    @Override
    public String toString() {
        return "ModernizationOptions{backupEnabled=" + backupEnabled + ", previewOnly=" + previewOnly + "}";
    }
}
