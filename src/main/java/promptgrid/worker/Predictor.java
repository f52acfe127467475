package promptgrid.worker;

import promptgrid.coordinator.model.DatasetRow;
import promptgrid.coordinator.model.Model;
import promptgrid.coordinator.model.Prompt;

/**
 * Inference backend for one model family (local transformer, hosted LLM API,
 * local LLM server).
 *
 * Implementations must be safe to call repeatedly with the same input, since
 * a row is predicted again after a failure or a watchdog reset. Latency is not
 * bounded here; the worker loop enforces the timeout.
 */
@FunctionalInterface
public interface Predictor {

    /**
     * Run the prompt against one row.
     *
     * @return the predicted label
     * @throws Exception on any backend failure; the row is retried
     */
    String predict(Model model, Prompt prompt, DatasetRow row) throws Exception;
}
