package promptgrid.coordinator.store;

import promptgrid.coordinator.model.Prediction;
import promptgrid.coordinator.model.PredictionQuery;
import promptgrid.coordinator.model.RowTask;
import promptgrid.support.TestStore;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcPredictionRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private TestStore store;
    private JdbcPredictionRepository predictions;

    @BeforeEach
    void setup() {
        store = TestStore.open();
        predictions = store.predictions;

        store.model("bert", "transformers");
        store.model("llama", "local-llm");
        store.prompt("p1");
        store.dataset("d1", 2);
        store.cells.createWithTasks("c-bert", "bert", "p1", "d1", 3, T0);
        store.cells.createWithTasks("c-llama", "llama", "p1", "d1", 3, T0);
    }

    @AfterEach
    void teardown() {
        store.close();
    }

    @Test
    void latestPredictionPerRowWins() {
        predict("c-bert", "bert", "d1-000", "first", T0);
        store.tasks.requeueDone("c-bert", "d1-000", T0.plusSeconds(1));
        predict("c-bert", "bert", "d1-000", "second", T0.plusSeconds(2));
        predict("c-bert", "bert", "d1-001", "only", T0.plusSeconds(3));

        assertEquals(3, predictions.countByCell("c-bert"));
        assertEquals(List.of("first", "second", "only"),
                predictions.findByCell("c-bert").stream().map(Prediction::label).toList());

        List<Prediction> latest = predictions.findLatest(PredictionQuery.all().withModelId("bert"));
        assertEquals(2, latest.size());
        assertEquals("second", latest.get(0).label());
        assertEquals("only", latest.get(1).label());
    }

    @Test
    void latestFiltersByFamilyAndCombination() {
        predict("c-bert", "bert", "d1-000", "yes", T0);
        predict("c-llama", "llama", "d1-000", "no", T0);

        List<Prediction> llm = predictions.findLatest(PredictionQuery.all().withFamily("local-llm"));
        assertEquals(1, llm.size());
        assertEquals("llama", llm.get(0).modelId());

        assertEquals(2, predictions.findLatest(PredictionQuery.all().withPromptId("p1").withDatasetId("d1")).size());
        assertTrue(predictions.findLatest(PredictionQuery.all().withDatasetId("other")).isEmpty());
    }

    private void predict(String cellId, String modelId, String rowId, String label, Instant at) {
        // Pending tasks are claimed lowest id first
        RowTask task = store.tasks.claimBatch(cellId, "w1", 1, at).get(0);
        assertEquals(rowId, task.rowId());

        store.tasks.complete(task, Prediction.builder()
                .cellId(cellId)
                .rowId(rowId)
                .modelId(modelId)
                .promptId("p1")
                .datasetId("d1")
                .label(label)
                .latencyMs(1)
                .workerId("w1")
                .build(), at);
    }
}
