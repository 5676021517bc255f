package me.christianrobert.spmodernize.modernize.service;

import me.christianrobert.spmodernize.catalog.InMemoryDefinitionStore;
import me.christianrobert.spmodernize.core.model.SourceUnit;
import me.christianrobert.spmodernize.core.model.UnitIdentity;
import me.christianrobert.spmodernize.journal.BackupStatus;
import me.christianrobert.spmodernize.journal.InMemoryBackupJournal;
import me.christianrobert.spmodernize.modernize.model.ApplyOutcome;
import me.christianrobert.spmodernize.modernize.model.BatchSummary;
import me.christianrobert.spmodernize.modernize.model.ModernizationOptions;
import me.christianrobert.spmodernize.modernize.model.UnitApplyResult;
import me.christianrobert.spmodernize.rewrite.RewriteEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BatchCoordinatorTest {

    private InMemoryBackupJournal journal;
    private InMemoryDefinitionStore definitionStore;
    private ApplyController applyController;
    private BatchCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        journal = new InMemoryBackupJournal();
        definitionStore = new InMemoryDefinitionStore();

        applyController = new ApplyController();
        injectDependency(applyController, "rewriteEngine", new RewriteEngine());
        injectDependency(applyController, "journal", journal);
        injectDependency(applyController, "definitionStore", definitionStore);

        coordinator = new BatchCoordinator();
        injectDependency(coordinator, "applyController", applyController);
    }

    private void injectDependency(Object target, String fieldName, Object dependency) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, dependency);
    }

    private List<SourceUnit> legacyUnits(int count) {
        List<SourceUnit> units = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            UnitIdentity identity = UnitIdentity.of("dbo", "usp_Proc" + i);
            String text = "CREATE PROCEDURE dbo.usp_Proc" + i + " AS\nRAISERROR('Failure " + i + "', 16, 1)";
            definitionStore.put(identity, text);
            units.add(new SourceUnit(identity, text));
        }
        return units;
    }

    @Test
    void testFailingUnitDoesNotStopBatch() {
        List<SourceUnit> units = legacyUnits(5);
        UnitIdentity failing = units.get(2).getIdentity();
        definitionStore.failCommitsFor(failing);

        BatchSummary summary = coordinator.run(units, ModernizationOptions.commit(), 10, null);

        assertEquals(5, summary.getProcessedCount());
        assertEquals(4, summary.getSucceededCount());
        assertEquals(4, summary.getAppliedCount());
        assertEquals(1, summary.getFailedCount());
        assertFalse(summary.isSuccessful());
        assertTrue(summary.getErrors().containsKey("dbo.usp_Proc3"));
        assertEquals(ApplyOutcome.FAILED, summary.getUnitResults().get("dbo.usp_Proc3").getOutcome());

        assertEquals(4, journal.findByStatus(BackupStatus.UPDATED).size());
        assertEquals(1, journal.findByStatus(BackupStatus.BACKED_UP).size());
        assertEquals(failing, journal.findByStatus(BackupStatus.BACKED_UP).get(0).getUnit());
    }

    @Test
    void testUnexpectedExceptionCountsAsFailure() throws Exception {
        List<SourceUnit> units = legacyUnits(2);
        ApplyController throwing = mock(ApplyController.class);
        when(throwing.apply(eq(units.get(0)), any(ModernizationOptions.class)))
                .thenReturn(UnitApplyResult.unchanged(units.get(0).getIdentity()));
        when(throwing.apply(eq(units.get(1)), any(ModernizationOptions.class)))
                .thenThrow(new IllegalStateException("connection dropped"));
        injectDependency(coordinator, "applyController", throwing);

        BatchSummary summary = coordinator.run(units, ModernizationOptions.commit(), 1, null);

        assertEquals(2, summary.getProcessedCount());
        assertEquals(1, summary.getSucceededCount());
        assertEquals(1, summary.getFailedCount());
        assertEquals("connection dropped", summary.getErrors().get("dbo.usp_Proc2").getError());
    }

    @Test
    void testPreviewBatchCommitsNothing() {
        List<SourceUnit> units = legacyUnits(3);
        units.add(new SourceUnit(UnitIdentity.of("dbo", "usp_Clean"), "CREATE PROCEDURE dbo.usp_Clean AS SELECT 1"));

        BatchSummary summary = coordinator.run(units, ModernizationOptions.defaults(), 10, null);

        assertEquals(3, summary.getPreviewedCount());
        assertEquals(1, summary.getUnchangedCount());
        assertEquals(3, summary.getChangedCount());
        assertEquals(4, summary.getSucceededCount());
        assertEquals(0, definitionStore.getCommitCount());
    }

    @Test
    void testProgressIsReportedEveryIntervalAndAtEnd() {
        List<SourceUnit> units = legacyUnits(5);
        List<Integer> reported = new ArrayList<>();

        coordinator.run(units, ModernizationOptions.defaults(), 2,
                summary -> reported.add(summary.getProcessedCount()));

        assertEquals(List.of(2, 4, 5), reported);
    }

    @Test
    void testEmptyBatch() {
        List<Integer> reported = new ArrayList<>();

        BatchSummary summary = coordinator.run(List.of(), ModernizationOptions.commit(), 10,
                s -> reported.add(s.getProcessedCount()));

        assertEquals(0, summary.getProcessedCount());
        assertTrue(summary.isSuccessful());
        assertEquals(List.of(0), reported);
    }
}
