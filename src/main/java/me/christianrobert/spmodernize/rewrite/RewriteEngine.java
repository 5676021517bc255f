package me.christianrobert.spmodernize.rewrite;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.spmodernize.rewrite.rule.RewriteRuleSet;
import me.christianrobert.spmodernize.rewrite.scanner.ClassifiedParameters;
import me.christianrobert.spmodernize.rewrite.scanner.ParameterClassifier;
import me.christianrobert.spmodernize.rewrite.scanner.ParsedLegacyStatement;
import me.christianrobert.spmodernize.rewrite.scanner.ScanResult;
import me.christianrobert.spmodernize.rewrite.scanner.StatementScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites procedure source: every RAISERROR that can be bounded becomes {@code ;THROW},
 * then the {@link RewriteRuleSet} runs once over the result.
 *
 * <p>Text without any legacy construct is returned unchanged, and
 * {@code rewrite(rewrite(t)).equals(rewrite(t))} holds for every input.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
@ApplicationScoped
public class RewriteEngine {

    private static final Logger log = LoggerFactory.getLogger(RewriteEngine.class);

    private final StatementScanner scanner;
    private final ParameterClassifier classifier;
    private final RewriteRuleSet ruleSet;

    public RewriteEngine() {
        this(new StatementScanner(), new ParameterClassifier(), new RewriteRuleSet());
    }

    public RewriteEngine(StatementScanner scanner, ParameterClassifier classifier, RewriteRuleSet ruleSet) {
        this.scanner = scanner;
        this.classifier = classifier;
        this.ruleSet = ruleSet;
    }

    public String rewrite(String originalText) {
        return rewriteWithReport(originalText).getRewrittenText();
    }

    public RewriteResult rewriteWithReport(String originalText) {
        String text = originalText != null ? originalText : "";

        List<String> skipped = new ArrayList<>();
        List<String> reviewNotes = new ArrayList<>();
        int converted = 0;

        // A converted message can itself contain RAISERROR, so passes repeat until one converts nothing.
        // Every conversion removes one keyword occurrence, which bounds the number of passes.
        String afterStatements = text;
        while (true) {
            List<String> passSkipped = new ArrayList<>();
            StringBuilder out = new StringBuilder(afterStatements.length());
            int passConverted = convertStatements(afterStatements, out, passSkipped, reviewNotes);
            if (passConverted == 0) {
                skipped.addAll(passSkipped);
                reviewNotes.addAll(passSkipped);
                for (String note : passSkipped) {
                    log.warn(note);
                }
                break;
            }
            converted += passConverted;
            afterStatements = out.toString();
        }

        List<String> appliedRules = new ArrayList<>();
        String rewritten = ruleSet.apply(afterStatements, converted > 0, appliedRules);

        if (appliedRules.contains(RewriteRuleSet.LEFT_OUTER_JOIN_MARKER)
                || appliedRules.contains(RewriteRuleSet.RIGHT_OUTER_JOIN_MARKER)) {
            reviewNotes.add("Legacy outer join operators were replaced textually; FROM and WHERE clauses need restructuring");
        }

        RewriteResult result = new RewriteResult(text, rewritten, converted, skipped, appliedRules, reviewNotes);
        log.debug("Rewrite finished: {}", result);
        return result;
    }

    /**
     * One left-to-right pass over {@code text}. Ambiguous occurrences are copied unchanged.
     *
     * @return the number of statements converted in this pass
     */
    private int convertStatements(String text, StringBuilder out, List<String> skipped, List<String> reviewNotes) {
        int converted = 0;
        int offset = 0;

        while (true) {
            ScanResult scan = scanner.locateLegacyStatement(text, offset);
            if (scan.isNotFound()) {
                break;
            }

            if (scan.isAmbiguous()) {
                skipped.add("RAISERROR at line " + lineOf(text, scan.getStart()) + " left unchanged: " + scan.getReason());
                out.append(text, offset, scan.getResumeOffset());
                offset = scan.getResumeOffset();
                continue;
            }

            ParsedLegacyStatement statement = scan.getStatement();
            ClassifiedParameters params = classifier.classify(statement);
            collectReviewNotes(text, scan.getStart(), statement, params, reviewNotes);

            out.append(text, offset, scan.getStart());
            String replacement = params.toThrowStatement(endsWithTerminator(out));
            log.debug("Converting '{}' to '{}'", statement.getRawText(), replacement);
            out.append(replacement);
            offset = scan.getEnd();
            converted++;
        }
        out.append(text, offset, text.length());
        return converted;
    }

    private static boolean endsWithTerminator(CharSequence text) {
        for (int i = text.length() - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c == ';';
            }
        }
        return false;
    }

    private void collectReviewNotes(String text, int start, ParsedLegacyStatement statement,
                                    ClassifiedParameters params, List<String> reviewNotes) {
        int line = lineOf(text, start);
        if (statement.isParenthesized() && statement.getParamListText().indexOf('\'') >= 0) {
            reviewNotes.add("RAISERROR at line " + line + " has string literals in its parameter list; "
                    + "commas inside literals are treated as separators");
        }
        if (!statement.isParenthesized() && statement.getMessageText().contains("--")) {
            reviewNotes.add("RAISERROR at line " + line + " has a trailing comment that became part of the message");
        }
        if (params.getDroppedSeverity() != null) {
            reviewNotes.add("RAISERROR at line " + line + " dropped severity " + params.getDroppedSeverity()
                    + "; THROW always raises severity 16");
        }
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
