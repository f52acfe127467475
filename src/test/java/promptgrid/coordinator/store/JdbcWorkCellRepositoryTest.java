package promptgrid.coordinator.store;

import promptgrid.coordinator.model.CellLease;
import promptgrid.coordinator.model.CellRegistration;
import promptgrid.coordinator.model.CellStatus;
import promptgrid.coordinator.model.CellSummary;
import promptgrid.coordinator.model.Prediction;
import promptgrid.coordinator.model.RowTask;
import promptgrid.coordinator.model.RowTaskStatus;
import promptgrid.coordinator.model.WorkCell;
import promptgrid.support.TestStore;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcWorkCellRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private TestStore store;
    private JdbcWorkCellRepository cells;
    private JdbcRowTaskRepository tasks;

    @BeforeEach
    void setup() {
        store = TestStore.open();
        cells = store.cells;
        tasks = store.tasks;

        store.model("bert", "transformers");
        store.model("gpt", "hosted-llm");
        store.prompt("p1");
        store.dataset("d1", 5);
    }

    @AfterEach
    void teardown() {
        store.close();
    }

    @Test
    void createWithTasksExpandsEveryRow() {
        CellRegistration reg = cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);

        assertTrue(reg.created());
        WorkCell cell = reg.cell();
        assertEquals(CellStatus.AVAILABLE, cell.status());
        assertEquals(0, cell.activeWorkers());
        assertEquals(5, cell.totalTasks());

        List<RowTask> rowTasks = tasks.findByCell("c1");
        assertEquals(5, rowTasks.size());
        assertTrue(rowTasks.stream().allMatch(t -> t.status() == RowTaskStatus.PENDING && t.retryCount() == 0));
        assertTrue(rowTasks.stream().allMatch(t -> t.maxRetries() == 3));
    }

    @Test
    void createWithTasksIsNoOpForExistingCombination() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);

        CellRegistration again = cells.createWithTasks("c2", "bert", "p1", "d1", 3, T0);

        assertFalse(again.created());
        assertEquals("c1", again.cell().id());
        assertTrue(cells.findById("c2").isEmpty());
        assertEquals(5, tasks.findByCell("c1").size());
    }

    @Test
    void claimHonorsFamiliesAndMarksCellInUse() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);

        assertTrue(cells.claim("w1", Set.of("hosted-llm"), T0).isEmpty());
        assertTrue(cells.claim("w1", Set.of(), T0).isEmpty());

        Optional<WorkCell> claimed = cells.claim("w1", Set.of("transformers"), T0);

        assertTrue(claimed.isPresent());
        assertEquals(CellStatus.IN_USE, claimed.get().status());
        assertEquals(1, claimed.get().activeWorkers());
        assertEquals(List.of(new CellLease("c1", "w1", T0)), cells.findLeases("c1"));
    }

    @Test
    void claimPrefersAvailableCellsAndLetsWorkersJoin() {
        store.prompt("p2");
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);
        cells.createWithTasks("c2", "bert", "p2", "d1", 3, T0.plusSeconds(1));

        WorkCell first = cells.claim("w1", Set.of("transformers"), T0).orElseThrow();
        WorkCell second = cells.claim("w2", Set.of("transformers"), T0).orElseThrow();
        WorkCell third = cells.claim("w3", Set.of("transformers"), T0).orElseThrow();

        assertEquals("c1", first.id());
        assertEquals("c2", second.id(), "an AVAILABLE cell wins over joining an IN_USE one");
        assertEquals("c1", third.id());
        assertEquals(2, third.activeWorkers());
    }

    @Test
    void workerNeverHoldsTwoLeasesOnOneCell() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);

        assertTrue(cells.claim("w1", Set.of("transformers"), T0).isPresent());
        assertTrue(cells.claim("w1", Set.of("transformers"), T0).isEmpty());
        assertEquals(1, cells.findById("c1").orElseThrow().activeWorkers());
    }

    @Test
    void cellWithoutPendingTasksIsNotClaimable() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);
        tasks.claimBatch("c1", "someone", 10, T0);

        assertTrue(cells.claim("w1", Set.of("transformers"), T0).isEmpty());
    }

    @Test
    void lastReleaseWithAllTasksTerminalMarksDone() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 0, T0);
        cells.claim("w1", Set.of("transformers"), T0);
        drain("c1", "w1");

        CellStatus status = cells.release("c1", "w1", T0.plusSeconds(5));

        assertEquals(CellStatus.DONE, status);
        WorkCell cell = cells.findById("c1").orElseThrow();
        assertEquals(0, cell.activeWorkers());
        assertEquals(T0.plusSeconds(5), cell.finishedAt());
        assertTrue(cells.findLeases("c1").isEmpty());
    }

    @Test
    void releaseWithPendingTasksMakesCellAvailable() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);
        cells.claim("w1", Set.of("transformers"), T0);

        assertEquals(CellStatus.AVAILABLE, cells.release("c1", "w1", T0));
        assertEquals(0, cells.findById("c1").orElseThrow().activeWorkers());
    }

    @Test
    void releaseWhileOthersWorkKeepsCellInUse() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);
        cells.claim("w1", Set.of("transformers"), T0);
        cells.claim("w2", Set.of("transformers"), T0);
        drain("c1", "w1");

        assertEquals(CellStatus.IN_USE, cells.release("c1", "w1", T0));
        assertEquals(1, cells.findById("c1").orElseThrow().activeWorkers());

        assertEquals(CellStatus.DONE, cells.release("c1", "w2", T0));
    }

    @Test
    void releaseWithoutLeaseChangesNothing() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);
        cells.claim("w1", Set.of("transformers"), T0);

        assertEquals(CellStatus.IN_USE, cells.release("c1", "stranger", T0));
        assertEquals(1, cells.findById("c1").orElseThrow().activeWorkers());
    }

    @Test
    void expireLeaseIsGuardedByRenewal() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);
        cells.claim("w1", Set.of("transformers"), T0);

        List<CellLease> expired = cells.findExpiredLeases(T0.plusSeconds(60));
        assertEquals(1, expired.size());

        // Worker renews between the watchdog's read and write
        assertTrue(cells.renewLease("c1", "w1", T0.plusSeconds(30)));
        assertTrue(cells.expireLease(expired.get(0), T0.plusSeconds(61)).isEmpty());
        assertEquals(1, cells.findById("c1").orElseThrow().activeWorkers());

        CellLease renewed = cells.findExpiredLeases(T0.plusSeconds(120)).get(0);
        assertEquals(Optional.of(CellStatus.AVAILABLE), cells.expireLease(renewed, T0.plusSeconds(121)));
        assertEquals(0, cells.findById("c1").orElseThrow().activeWorkers());
        assertFalse(cells.renewLease("c1", "w1", T0.plusSeconds(122)));
    }

    @Test
    void reopenOnlyDoneCellsWithPendingTasks() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);
        cells.claim("w1", Set.of("transformers"), T0);
        drain("c1", "w1");
        cells.release("c1", "w1", T0);

        assertTrue(cells.findDoneWithPending().isEmpty());
        assertTrue(cells.reopen("c1", T0).isEmpty(), "all tasks terminal: never reopened");

        assertTrue(tasks.requeueDone("c1", "d1-002", T0));
        assertEquals(List.of("c1"), cells.findDoneWithPending().stream().map(WorkCell::id).toList());

        assertEquals(Optional.of(CellStatus.AVAILABLE), cells.reopen("c1", T0));
        WorkCell reopened = cells.findById("c1").orElseThrow();
        assertEquals(1, reopened.reopenCount());
        assertNull(reopened.finishedAt());
        assertTrue(cells.reopen("c1", T0).isEmpty());
    }

    @Test
    void settleCompletesIdleCellsWithOnlyTerminalTasks() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);
        assertTrue(cells.findSettleable().isEmpty());

        store.execute("UPDATE row_tasks SET status = 'FAILED' WHERE cell_id = 'c1'");

        assertEquals(1, cells.findSettleable().size());
        assertTrue(cells.settle("c1", T0));
        assertEquals(CellStatus.DONE, cells.findById("c1").orElseThrow().status());
        assertFalse(cells.settle("c1", T0));
    }

    @Test
    void emptyDatasetCellIsSettleable() {
        store.dataset("empty", 0);
        CellRegistration reg = cells.createWithTasks("c0", "bert", "p1", "empty", 3, T0);

        assertEquals(0, reg.cell().totalTasks());
        assertTrue(cells.claim("w1", Set.of("transformers"), T0).isEmpty());
        assertTrue(cells.settle("c0", T0));
    }

    @Test
    void releaseRollsBackWhenLeaseHasNoMatchingWorkerCount() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);
        cells.claim("w1", Set.of("transformers"), T0).orElseThrow();
        store.execute("UPDATE work_cells SET active_workers = 0 WHERE id = 'c1'");

        assertThrows(RuntimeException.class, () -> cells.release("c1", "w1", T0.plusSeconds(1)));

        // Nothing was applied: the lease is still there and the status unresolved
        assertEquals(1, cells.findLeases("c1").size());
        assertEquals(CellStatus.IN_USE, cells.findById("c1").orElseThrow().status());
    }

    @Test
    void summariesCountTasksByStatus() {
        cells.createWithTasks("c1", "bert", "p1", "d1", 3, T0);
        store.dataset("d2", 2);
        cells.createWithTasks("c2", "gpt", "p1", "d2", 3, T0.plusSeconds(1));
        List<RowTask> claimed = tasks.claimBatch("c1", "w1", 2, T0);
        tasks.complete(claimed.get(0), prediction(claimed.get(0), "w1"), T0);

        List<CellSummary> summaries = cells.summaries();

        assertEquals(2, summaries.size());
        CellSummary c1 = summaries.get(0);
        assertEquals("c1", c1.cell().id());
        assertEquals(3, c1.pending());
        assertEquals(1, c1.inProgress());
        assertEquals(1, c1.done());
        assertEquals(0, c1.failed());
        assertEquals(20, c1.progressPercent());

        CellSummary c2 = cells.summary("c2").orElseThrow();
        assertEquals(2, c2.pending());
        assertTrue(cells.summary("nope").isEmpty());
    }

    private void drain(String cellId, String workerId) {
        Instant at = T0;
        List<RowTask> batch;
        while (!(batch = tasks.claimBatch(cellId, workerId, 10, at)).isEmpty()) {
            for (RowTask task : batch) {
                tasks.complete(task, prediction(task, workerId), at);
            }
            at = at.plus(Duration.ofMillis(1));
        }
    }

    private static Prediction prediction(RowTask task, String workerId) {
        return Prediction.builder()
                .cellId(task.cellId())
                .rowId(task.rowId())
                .modelId("bert")
                .promptId("p1")
                .datasetId("d1")
                .label("yes")
                .latencyMs(3)
                .workerId(workerId)
                .build();
    }
}
