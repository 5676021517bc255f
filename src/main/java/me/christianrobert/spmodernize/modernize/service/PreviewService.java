package me.christianrobert.spmodernize.modernize.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.spmodernize.analysis.DeprecatedSyntaxDetector;
import me.christianrobert.spmodernize.analysis.SyntaxIssue;
import me.christianrobert.spmodernize.catalog.CatalogProvider;
import me.christianrobert.spmodernize.catalog.CatalogScope;
import me.christianrobert.spmodernize.core.model.SourceUnit;
import me.christianrobert.spmodernize.modernize.model.PreviewEntry;
import me.christianrobert.spmodernize.rewrite.RewriteEngine;
import me.christianrobert.spmodernize.rewrite.RewriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only look at what modernization would do. Writes no journal records and commits nothing.
 */
@ApplicationScoped
public class PreviewService {

    private static final Logger log = LoggerFactory.getLogger(PreviewService.class);

    @Inject
    CatalogProvider catalogProvider;

    @Inject
    DeprecatedSyntaxDetector detector;

    @Inject
    RewriteEngine rewriteEngine;

    public List<PreviewEntry> preview(CatalogScope scope) {
        List<PreviewEntry> entries = new ArrayList<>();
        for (SourceUnit unit : catalogProvider.findUnits(scope)) {
            entries.add(preview(unit));
        }
        log.info("Preview of {}: {} units, {} would change", scope, entries.size(),
                entries.stream().filter(PreviewEntry::isWouldChange).count());
        return entries;
    }

    public PreviewEntry preview(SourceUnit unit) {
        List<SyntaxIssue> issues = detector.detect(unit.getText());
        RewriteResult rewrite = rewriteEngine.rewriteWithReport(unit.getText());
        return new PreviewEntry(unit.getIdentity(), issues, detector.summarize(issues), rewrite.isChanged(),
                rewrite.getConvertedStatements(), rewrite.getReviewNotes());
    }
}
