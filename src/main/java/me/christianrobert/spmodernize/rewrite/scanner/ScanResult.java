package me.christianrobert.spmodernize.rewrite.scanner;

/**
 * Tagged result of a single {@link StatementScanner} lookup.
 *
 * <ul>
 *   <li>FOUND - a statement was bounded; {@code start..end} is the span to replace</li>
 *   <li>AMBIGUOUS - the keyword was found but the statement could not be bounded with
 *       confidence; the occurrence stays untouched and scanning resumes at {@link #getResumeOffset()}</li>
 *   <li>NOT_FOUND - no further occurrence in the text</li>
 * </ul>
 */
public class ScanResult {

    public enum Kind {
        FOUND,
        AMBIGUOUS,
        NOT_FOUND
    }

    private static final ScanResult NOT_FOUND = new ScanResult(Kind.NOT_FOUND, -1, -1, -1, null, null);

    private final Kind kind;
    private final int start;
    private final int end;
    private final int resumeOffset;
    private final ParsedLegacyStatement statement;
    private final String reason;

    private ScanResult(Kind kind, int start, int end, int resumeOffset,
                       ParsedLegacyStatement statement, String reason) {
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.resumeOffset = resumeOffset;
        this.statement = statement;
        this.reason = reason;
    }

    public static ScanResult found(int start, int end, ParsedLegacyStatement statement) {
        return new ScanResult(Kind.FOUND, start, end, end, statement, null);
    }

    public static ScanResult ambiguous(int keywordStart, int resumeOffset, String reason) {
        return new ScanResult(Kind.AMBIGUOUS, keywordStart, resumeOffset, resumeOffset, null, reason);
    }

    public static ScanResult notFound() {
        return NOT_FOUND;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFound() {
        return kind == Kind.FOUND;
    }

    public boolean isAmbiguous() {
        return kind == Kind.AMBIGUOUS;
    }

    public boolean isNotFound() {
        return kind == Kind.NOT_FOUND;
    }

    /** Offset of the RAISERROR keyword. */
    public int getStart() {
        return start;
    }

    /** Exclusive end of the statement span (FOUND only). */
    public int getEnd() {
        return end;
    }

    public int getResumeOffset() {
        return resumeOffset;
    }

    public ParsedLegacyStatement getStatement() {
        return statement;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        switch (kind) {
            case FOUND:
                return "ScanResult{FOUND, span=" + start + ".." + end + ", " + statement + "}";
            case AMBIGUOUS:
                return "ScanResult{AMBIGUOUS, at=" + start + ", reason='" + reason + "'}";
            default:
                return "ScanResult{NOT_FOUND}";
        }
    }
}
