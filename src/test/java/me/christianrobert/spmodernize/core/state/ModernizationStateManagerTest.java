package me.christianrobert.spmodernize.core.state;

import me.christianrobert.spmodernize.core.event.ModernizationCompletedEvent;
import me.christianrobert.spmodernize.core.model.UnitIdentity;
import me.christianrobert.spmodernize.modernize.model.ApplyOutcome;
import me.christianrobert.spmodernize.modernize.model.BatchSummary;
import me.christianrobert.spmodernize.modernize.model.UnitApplyResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModernizationStateManagerTest {

    @Test
    void testEventsAccumulate() {
        ModernizationStateManager stateManager = new ModernizationStateManager();
        assertNull(stateManager.getLastRun());

        BatchSummary first = new BatchSummary(2);
        first.addUnitResult(UnitApplyResult.unchanged(UnitIdentity.of("dbo", "usp_A")));
        first.addUnitResult(new UnitApplyResult(UnitIdentity.of("dbo", "usp_B"), ApplyOutcome.FAILED, 4L, 1,
                List.of(), List.of(), "Commit failed"));
        stateManager.onModernizationCompleted(new ModernizationCompletedEvent("job-1", false, first));

        BatchSummary second = new BatchSummary(1);
        second.addUnitResult(UnitApplyResult.unchanged(UnitIdentity.of("dbo", "usp_C")));
        ModernizationCompletedEvent secondEvent = new ModernizationCompletedEvent("job-2", true, second);
        stateManager.onModernizationCompleted(secondEvent);

        assertEquals(2, stateManager.getCompletedRuns());
        assertEquals(3, stateManager.getTotalUnitsProcessed());
        assertEquals(1, stateManager.getTotalUnitsFailed());
        assertSame(secondEvent, stateManager.getLastRun());

        stateManager.clear();

        assertEquals(0, stateManager.getCompletedRuns());
        assertNull(stateManager.getLastRun());
    }
}
