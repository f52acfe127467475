package promptgrid.worker;

import java.util.Objects;
import java.util.Set;

/**
 * A worker process's declaration: who it is, how many loops it runs and
 * which model families it may serve.
 *
 * @param threads   number of independent worker loops
 * @param families  capability set; a loop never claims a cell outside it
 * @param simulated settings for the simulated backend, used when no real
 *                  predictor is registered for a family
 */
public record WorkerProfile(String workerId, int threads, Set<String> families, SimulationSettings simulated) {

    public WorkerProfile {
        Objects.requireNonNull(workerId, "workerId is required");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        families = Set.copyOf(families);
        if (families.isEmpty()) {
            throw new IllegalArgumentException("Worker " + workerId + " declares no model family");
        }
        simulated = simulated != null ? simulated : SimulationSettings.DEFAULT;
    }

    /**
     * Latency and failure behavior of {@link SimulatedPredictor}.
     */
    public record SimulationSettings(int minDelayMs, int maxDelayMs, double failRate) {

        public static final SimulationSettings DEFAULT = new SimulationSettings(10, 50, 0.0);

        public SimulationSettings {
            if (minDelayMs < 0 || maxDelayMs < minDelayMs) {
                throw new IllegalArgumentException(
                        "Invalid delay range " + minDelayMs + ".." + maxDelayMs + "ms");
            }
            if (failRate < 0.0 || failRate > 1.0) {
                throw new IllegalArgumentException("failRate must be within [0, 1], got " + failRate);
            }
        }
    }
}
