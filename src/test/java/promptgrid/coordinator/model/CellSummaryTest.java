package promptgrid.coordinator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellSummaryTest {

    private static final WorkCell CELL = WorkCell.builder()
            .id("c1")
            .modelId("m")
            .promptId("p")
            .datasetId("d")
            .build();

    @Test
    void progressCountsTerminalTasks() {
        CellSummary summary = new CellSummary(CELL, 4, 2, 3, 1);

        assertEquals(10, summary.total());
        assertEquals(4, summary.terminal());
        assertEquals(40, summary.progressPercent());
    }

    @Test
    void emptyCellIsComplete() {
        assertEquals(100, new CellSummary(CELL, 0, 0, 0, 0).progressPercent());
    }

    @Test
    void progressRoundsDown() {
        assertEquals(66, new CellSummary(CELL, 1, 0, 2, 0).progressPercent());
    }
}
