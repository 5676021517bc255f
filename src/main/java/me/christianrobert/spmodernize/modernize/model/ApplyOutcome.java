package me.christianrobert.spmodernize.modernize.model;

public enum ApplyOutcome {
    /** Nothing to modernize; no record written. */
    UNCHANGED,
    /** Rewrite computed (and backed up if enabled) but not committed. */
    PREVIEWED,
    /** Rewritten text committed to the definition store. */
    APPLIED,
    /** Journal or commit failure. */
    FAILED
}
