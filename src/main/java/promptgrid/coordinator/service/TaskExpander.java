package promptgrid.coordinator.service;

import promptgrid.coordinator.config.GridConfig;
import promptgrid.coordinator.model.CellRegistration;
import promptgrid.coordinator.model.Dataset;
import promptgrid.coordinator.model.DatasetRow;
import promptgrid.coordinator.model.Model;
import promptgrid.coordinator.model.Prompt;
import promptgrid.coordinator.model.WorkCell;
import promptgrid.coordinator.repository.CatalogRepository;
import promptgrid.coordinator.repository.WorkCellRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Registration of reference data and fan-out of work cells into row tasks.
 * Every operation is idempotent: repeating it leaves the store unchanged.
 */
public class TaskExpander {

    private static final Logger log = LoggerFactory.getLogger(TaskExpander.class);

    private final CatalogRepository catalog;
    private final WorkCellRepository cells;
    private final GridConfig config;
    private final Clock clock;

    public TaskExpander(CatalogRepository catalog, WorkCellRepository cells, GridConfig config, Clock clock) {
        this.catalog = catalog;
        this.cells = cells;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Ensure the dataset and all of its rows exist.
     *
     * Rows added to a dataset after a cell was created for it get no row task
     * in that cell; expansion happens once, at cell creation.
     *
     * @return number of rows newly stored
     * @throws IllegalArgumentException if a row belongs to another dataset
     */
    public int registerDataset(Dataset dataset, List<DatasetRow> rows) {
        Objects.requireNonNull(dataset, "dataset is required");
        for (DatasetRow row : rows) {
            if (!dataset.id().equals(row.datasetId())) {
                throw new IllegalArgumentException(
                        "Row " + row.id() + " belongs to dataset " + row.datasetId() + ", not " + dataset.id());
            }
        }

        if (catalog.saveDataset(dataset)) {
            log.info("Registered dataset {} ({})", dataset.id(), dataset.name());
        }

        int inserted = catalog.saveRows(rows);
        if (inserted > 0) {
            log.info("Registered {} new rows in dataset {}", inserted, dataset.id());
        }
        return inserted;
    }

    public boolean registerModel(String id, String name, String family) {
        if (family == null || family.isBlank()) {
            throw new IllegalArgumentException("Model " + id + " needs a family");
        }
        boolean created = catalog.saveModel(new Model(id, name, family.trim()));
        if (created) {
            log.info("Registered model {} (family {})", id, family);
        }
        return created;
    }

    public boolean registerPrompt(String id, String template) {
        boolean created = catalog.savePrompt(new Prompt(id, template));
        if (created) {
            log.info("Registered prompt {}", id);
        }
        return created;
    }

    /**
     * Create the work cell for (model, prompt, dataset) with one PENDING row
     * task per dataset row. A second call for the same combination returns the
     * existing cell and writes nothing.
     *
     * @throws IllegalArgumentException if any of the three IDs is unknown
     */
    public CellRegistration registerWorkCell(String modelId, String promptId, String datasetId) {
        if (catalog.findModel(modelId).isEmpty()) {
            throw new IllegalArgumentException("Unknown model: " + modelId);
        }
        if (catalog.findPrompt(promptId).isEmpty()) {
            throw new IllegalArgumentException("Unknown prompt: " + promptId);
        }
        if (catalog.findDataset(datasetId).isEmpty()) {
            throw new IllegalArgumentException("Unknown dataset: " + datasetId);
        }

        // Fast path for the common repeat; the unique constraint still decides under races
        var existing = cells.findByCombination(modelId, promptId, datasetId);
        if (existing.isPresent()) {
            return new CellRegistration(existing.get(), false);
        }

        return cells.createWithTasks(UUID.randomUUID().toString(), modelId, promptId, datasetId,
                config.maxRetries(), clock.instant());
    }

    /**
     * Register the full cross product of models, prompts and datasets.
     *
     * @return one cell per combination, new or existing
     */
    public List<WorkCell> registerGrid(List<String> modelIds, List<String> promptIds, List<String> datasetIds) {
        List<WorkCell> result = new ArrayList<>(modelIds.size() * promptIds.size() * datasetIds.size());
        int created = 0;

        for (String modelId : modelIds) {
            for (String promptId : promptIds) {
                for (String datasetId : datasetIds) {
                    CellRegistration registration = registerWorkCell(modelId, promptId, datasetId);
                    if (registration.created()) {
                        created++;
                    }
                    result.add(registration.cell());
                }
            }
        }

        log.info("Grid registered: {} cells ({} new)", result.size(), created);
        return result;
    }
}
