package me.christianrobert.spmodernize.modernize.job;

import jakarta.enterprise.event.Event;
import me.christianrobert.spmodernize.catalog.CatalogException;
import me.christianrobert.spmodernize.catalog.CatalogProvider;
import me.christianrobert.spmodernize.catalog.CatalogScope;
import me.christianrobert.spmodernize.config.service.ConfigService;
import me.christianrobert.spmodernize.core.event.ModernizationCompletedEvent;
import me.christianrobert.spmodernize.core.job.model.JobProgress;
import me.christianrobert.spmodernize.core.model.SourceUnit;
import me.christianrobert.spmodernize.core.model.UnitIdentity;
import me.christianrobert.spmodernize.modernize.model.BatchSummary;
import me.christianrobert.spmodernize.modernize.model.ModernizationOptions;
import me.christianrobert.spmodernize.modernize.model.UnitApplyResult;
import me.christianrobert.spmodernize.modernize.service.BatchCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.lang.reflect.Field;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BatchModernizationJobTest {

    private CatalogProvider catalogProvider;
    private BatchCoordinator batchCoordinator;
    private Event<ModernizationCompletedEvent> completedEvent;
    private ConfigService configService;
    private BatchModernizationJob job;

    private Consumer<JobProgress> progressCallback;
    private List<JobProgress> progressUpdates;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        // Create mocks
        catalogProvider = mock(CatalogProvider.class);
        batchCoordinator = mock(BatchCoordinator.class);
        completedEvent = mock(Event.class);
        configService = new ConfigService();

        // Create the job instance and inject dependencies manually
        job = new BatchModernizationJob();
        injectDependency(job, "catalogProvider", catalogProvider);
        injectDependency(job, "batchCoordinator", batchCoordinator);
        injectDependency(job, "completedEvent", completedEvent);
        injectDependency(job, "configService", configService);

        progressUpdates = new ArrayList<>();
        progressCallback = progress -> progressUpdates.add(progress);
    }

    private void injectDependency(Object target, String fieldName, Object dependency) throws Exception {
        Field field = null;
        Class<?> clazz = target.getClass();

        // Look through the class hierarchy to find the field
        while (clazz != null && field == null) {
            try {
                field = clazz.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                clazz = clazz.getSuperclass();
            }
        }

        if (field != null) {
            field.setAccessible(true);
            field.set(target, dependency);
        } else {
            throw new NoSuchFieldException("Field " + fieldName + " not found in class hierarchy");
        }
    }

    @Test
    void testJobIdentity() {
        assertEquals("SQLSERVER", job.getTargetDatabase());
        assertEquals("PROCEDURE_MODERNIZATION", job.getWriteOperationType());
        assertEquals(BatchSummary.class, job.getResultType());
        assertTrue(job.getJobId().startsWith("sqlserver-procedure-modernization-"));
    }

    @Test
    void testDefaultsToLegacyOnlyPreview() {
        assertTrue(job.getScope().isLegacyOnly());
        assertTrue(job.getOptions().isPreviewOnly());
        assertTrue(job.getOptions().isBackupEnabled());
    }

    @Test
    void testExecuteWithNoUnits() throws Exception {
        when(catalogProvider.findUnits(any())).thenReturn(List.of());

        BatchSummary result = job.execute(progressCallback).get();

        assertEquals(0, result.getProcessedCount());
        verifyNoInteractions(batchCoordinator);
        verify(completedEvent).fire(any(ModernizationCompletedEvent.class));

        JobProgress last = progressUpdates.get(progressUpdates.size() - 1);
        assertEquals(100, last.getPercentage());
        assertEquals("Completed", last.getCurrentTask());
    }

    @Test
    void testExecuteUsesConfiguredBatchSize() throws Exception {
        List<SourceUnit> units = List.of(
                new SourceUnit(UnitIdentity.of("dbo", "usp_A"), "CREATE PROCEDURE dbo.usp_A AS RAISERROR 50001 @m"));
        CatalogScope scope = CatalogScope.legacyIn("dbo");
        ModernizationOptions options = ModernizationOptions.commit();
        when(catalogProvider.findUnits(scope)).thenReturn(units);
        when(batchCoordinator.run(eq(units), eq(options), eq(3), any())).thenReturn(new BatchSummary(1));

        job.configure(scope, options, 3).execute(progressCallback).get();

        verify(batchCoordinator).run(eq(units), eq(options), eq(3), any());
    }

    @Test
    void testExecuteFallsBackToConfigBatchSize() throws Exception {
        configService.setConfigValue(ConfigService.BATCH_SIZE, "25");
        List<SourceUnit> units = List.of(new SourceUnit(UnitIdentity.of("dbo", "usp_A"), "RAISERROR 50001 @m"));
        when(catalogProvider.findUnits(any())).thenReturn(units);
        when(batchCoordinator.run(anyList(), any(), anyInt(), any())).thenReturn(new BatchSummary(1));

        job.execute(progressCallback).get();

        verify(batchCoordinator).run(eq(units), any(), eq(25), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testBatchProgressIsForwarded() throws Exception {
        List<SourceUnit> units = List.of(
                new SourceUnit(UnitIdentity.of("dbo", "usp_A"), "RAISERROR 50001 @m"),
                new SourceUnit(UnitIdentity.of("dbo", "usp_B"), "RAISERROR 50002 @m"));
        when(catalogProvider.findUnits(any())).thenReturn(units);

        BatchSummary summary = new BatchSummary(2);
        summary.addUnitResult(UnitApplyResult.unchanged(UnitIdentity.of("dbo", "usp_A")));
        when(batchCoordinator.run(anyList(), any(), anyInt(), any())).thenAnswer(invocation -> {
            Consumer<BatchSummary> listener = invocation.getArgument(3);
            listener.accept(summary);
            return summary;
        });

        job.execute(progressCallback).get();

        JobProgress batchProgress = progressUpdates.stream()
                .filter(p -> p.getTotalUnits() != null)
                .findFirst()
                .orElseThrow();
        assertEquals(45, batchProgress.getPercentage());
        assertEquals(1, batchProgress.getProcessedUnits());
        assertEquals(2, batchProgress.getTotalUnits());

        ArgumentCaptor<ModernizationCompletedEvent> captor = ArgumentCaptor.forClass(ModernizationCompletedEvent.class);
        verify(completedEvent).fire(captor.capture());
        assertEquals(job.getJobId(), captor.getValue().getJobId());
        assertTrue(captor.getValue().isPreviewOnly());
        assertSame(summary, captor.getValue().getSummary());
    }

    @Test
    void testCatalogFailureFailsJob() {
        when(catalogProvider.findUnits(any()))
                .thenThrow(new CatalogException("Failed to read stored procedures", new SQLException("login failed")));

        CompletableFuture<BatchSummary> future = job.execute(progressCallback);

        assertTrue(future.isCompletedExceptionally());
        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertTrue(e.getCause().getMessage().contains("PROCEDURE_MODERNIZATION operation failed"));
        verifyNoInteractions(completedEvent);
    }
}
