package me.christianrobert.spmodernize.analysis;

/**
 * One kind of deprecated construct found in a unit, with the number of occurrences.
 */
public class SyntaxIssue {

    private final IssueCategory category;
    private final String construct;
    private final String recommendation;
    private final int occurrences;

    public SyntaxIssue(IssueCategory category, String construct, String recommendation, int occurrences) {
        this.category = category;
        this.construct = construct;
        this.recommendation = recommendation;
        this.occurrences = occurrences;
    }

    public IssueCategory getCategory() {
        return category;
    }

    public String getConstruct() {
        return construct;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public int getOccurrences() {
        return occurrences;
    }

    public String getDescription() {
        return category.getDisplayName() + ": " + construct + " (" + occurrences + "x) - " + recommendation;
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
