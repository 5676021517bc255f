package me.christianrobert.spmodernize.modernize.service;

import me.christianrobert.spmodernize.analysis.DeprecatedSyntaxDetector;
import me.christianrobert.spmodernize.catalog.CatalogProvider;
import me.christianrobert.spmodernize.catalog.CatalogScope;
import me.christianrobert.spmodernize.core.model.SourceUnit;
import me.christianrobert.spmodernize.core.model.UnitIdentity;
import me.christianrobert.spmodernize.modernize.model.PreviewEntry;
import me.christianrobert.spmodernize.rewrite.RewriteEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PreviewServiceTest {

    private CatalogProvider catalogProvider;
    private PreviewService previewService;

    @BeforeEach
    void setUp() throws Exception {
        catalogProvider = mock(CatalogProvider.class);

        previewService = new PreviewService();
        injectDependency(previewService, "catalogProvider", catalogProvider);
        injectDependency(previewService, "detector", new DeprecatedSyntaxDetector());
        injectDependency(previewService, "rewriteEngine", new RewriteEngine());
    }

    private void injectDependency(Object target, String fieldName, Object dependency) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, dependency);
    }

    @Test
    void testPreviewReportsIssuesPerUnit() {
        CatalogScope scope = CatalogScope.legacyIn("dbo");
        when(catalogProvider.findUnits(scope)).thenReturn(List.of(
                new SourceUnit(UnitIdentity.of("dbo", "usp_Legacy"),
                        "CREATE PROCEDURE dbo.usp_Legacy AS\nRAISERROR('x', 16, 1)\nRAISERROR @bad\nSELECT GETDATE()"),
                new SourceUnit(UnitIdentity.of("dbo", "usp_Clean"), "CREATE PROCEDURE dbo.usp_Clean AS SELECT 1")));

        List<PreviewEntry> entries = previewService.preview(scope);

        assertEquals(2, entries.size());

        PreviewEntry legacy = entries.get(0);
        assertTrue(legacy.isWouldChange());
        assertEquals(1, legacy.getConvertibleStatements());
        assertEquals("Error Handling, Functions", legacy.getIssueSummary());
        assertEquals(2, legacy.getIssues().get(0).getOccurrences());
        assertTrue(legacy.getReviewNotes().stream().anyMatch(n -> n.contains("left unchanged")));

        PreviewEntry clean = entries.get(1);
        assertFalse(clean.isWouldChange());
        assertTrue(clean.getIssues().isEmpty());
        assertEquals("No deprecated syntax found", clean.getIssueSummary());
    }
}
