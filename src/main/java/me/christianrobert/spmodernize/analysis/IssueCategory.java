package me.christianrobert.spmodernize.analysis;

/**
 * Groups of deprecated constructs reported by the {@link DeprecatedSyntaxDetector}.
 */
public enum IssueCategory {

    ERROR_HANDLING("Error Handling"),
    DATA_TYPES("Data Types"),
    JOIN_SYNTAX("JOIN Syntax"),
    SETTINGS("Settings"),
    FUNCTIONS("Functions");

    private final String displayName;

    IssueCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
