package promptgrid.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RowTaskTest {

    @Test
    void buildMinimalTask() {
        RowTask task = RowTask.builder()
                .cellId("c1")
                .rowId("r1")
                .build();

        assertEquals(RowTaskStatus.PENDING, task.status());
        assertEquals(0, task.retryCount());
        assertEquals(3, task.maxRetries());
        assertNull(task.claimedBy());
        assertNull(task.claimedAt());
        assertFalse(task.isTerminal());
    }

    @Test
    void requiresCellAndRow() {
        assertThrows(NullPointerException.class, () -> RowTask.builder().rowId("r1").build());
        assertThrows(NullPointerException.class, () -> RowTask.builder().cellId("c1").build());
    }

    @Test
    void canRetry() {
        RowTask.Builder base = RowTask.builder().cellId("c1").rowId("r1").maxRetries(3);

        assertTrue(base.retryCount(0).build().canRetry());
        assertTrue(base.retryCount(2).build().canRetry());
        assertFalse(base.retryCount(3).build().canRetry());
        assertFalse(RowTask.builder().cellId("c1").rowId("r1").maxRetries(0).build().canRetry());
    }

    @Test
    void terminalStatuses() {
        assertTrue(RowTaskStatus.DONE.isTerminal());
        assertTrue(RowTaskStatus.FAILED.isTerminal());
        assertFalse(RowTaskStatus.PENDING.isTerminal());
        assertFalse(RowTaskStatus.IN_PROGRESS.isTerminal());
    }

    @Test
    void withClaimedAtKeepsEverythingElse() {
        Instant t0 = Instant.parse("2024-05-01T10:00:00Z");
        RowTask task = RowTask.builder()
                .id(7)
                .cellId("c1")
                .rowId("r1")
                .status(RowTaskStatus.IN_PROGRESS)
                .retryCount(1)
                .claimedBy("w1")
                .claimedAt(t0)
                .build();

        RowTask touched = task.withClaimedAt(t0.plusSeconds(30));

        assertEquals(t0.plusSeconds(30), touched.claimedAt());
        assertEquals(t0, task.claimedAt());
        assertEquals("w1", touched.claimedBy());
        assertEquals(1, touched.retryCount());
        assertEquals(task, touched);
    }
}
