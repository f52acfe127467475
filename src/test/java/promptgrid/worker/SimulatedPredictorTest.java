package promptgrid.worker;

import promptgrid.coordinator.model.DatasetRow;
import promptgrid.coordinator.model.Model;
import promptgrid.coordinator.model.Prompt;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedPredictorTest {

    private final Model model = new Model("bert", "BERT", "transformers");
    private final Prompt prompt = new Prompt("p1", "Classify {text}");

    @Test
    void answersWithExpectedLabel() throws Exception {
        SimulatedPredictor predictor = new SimulatedPredictor(0, 0, 0.0);

        assertEquals("positive", predictor.predict(model, prompt, new DatasetRow("r1", "d1", "great", "positive")));
    }

    @Test
    void placeholderLabelIsDeterministic() throws Exception {
        SimulatedPredictor predictor = new SimulatedPredictor(0, 0, 0.0);
        DatasetRow unlabeled = new DatasetRow("r2", "d1", "toaster", null);

        String first = predictor.predict(model, prompt, unlabeled);

        assertTrue(first.equals("label-0") || first.equals("label-1"));
        assertEquals(first, predictor.predict(model, prompt, unlabeled));
    }

    @Test
    void alwaysFailingRateThrows() {
        SimulatedPredictor predictor = new SimulatedPredictor(new WorkerProfile.SimulationSettings(0, 1, 1.0));

        assertThrows(IllegalStateException.class,
                () -> predictor.predict(model, prompt, new DatasetRow("r1", "d1", "great", "positive")));
    }
}
