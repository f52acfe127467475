package promptgrid.worker;

import promptgrid.coordinator.model.DatasetRow;
import promptgrid.coordinator.model.Model;
import promptgrid.coordinator.model.Prompt;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Stand-in backend for local runs: sleeps for a random latency, fails at a
 * configured rate, and otherwise answers with the row's expected label (or a
 * deterministic placeholder when the row has none).
 */
public final class SimulatedPredictor implements Predictor {

    private final int delayMinMs;
    private final int delayMaxMs;
    private final double failRate;

    public SimulatedPredictor(int delayMinMs, int delayMaxMs, double failRate) {
        this.delayMinMs = delayMinMs;
        this.delayMaxMs = delayMaxMs;
        this.failRate = failRate;
    }

    public SimulatedPredictor(WorkerProfile.SimulationSettings settings) {
        this(settings.minDelayMs(), settings.maxDelayMs(), settings.failRate());
    }

    @Override
    public String predict(Model model, Prompt prompt, DatasetRow row) throws Exception {
        int delay = delayMinMs >= delayMaxMs ? delayMinMs
                : ThreadLocalRandom.current().nextInt(delayMinMs, delayMaxMs);
        if (delay > 0) {
            Thread.sleep(delay);
        }

        if (failRate > 0 && ThreadLocalRandom.current().nextDouble() < failRate) {
            throw new IllegalStateException("Simulated failure of " + model.id() + " on row " + row.id());
        }

        if (row.expectedLabel() != null) {
            return row.expectedLabel();
        }
        return "label-" + Math.floorMod((model.id() + prompt.id() + row.id()).hashCode(), 2);
    }
}
