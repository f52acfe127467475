package promptgrid.coordinator.repository;

import promptgrid.coordinator.model.Dataset;
import promptgrid.coordinator.model.DatasetRow;
import promptgrid.coordinator.model.Model;
import promptgrid.coordinator.model.Prompt;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for the immutable reference data: datasets, rows, models and
 * prompts. Saves are insert-if-absent; an existing entry is never modified.
 */
public interface CatalogRepository {

    /**
     * Save a dataset unless one with the same ID exists.
     *
     * @return true if the dataset was created
     */
    boolean saveDataset(Dataset dataset);

    /**
     * Save rows that do not exist yet, in one transaction.
     *
     * @param rows rows whose dataset already exists
     * @return number of rows actually inserted
     */
    int saveRows(List<DatasetRow> rows);

    /**
     * @return true if the model was created
     */
    boolean saveModel(Model model);

    /**
     * @return true if the prompt was created
     */
    boolean savePrompt(Prompt prompt);

    Optional<Dataset> findDataset(String datasetId);

    Optional<Model> findModel(String modelId);

    Optional<Prompt> findPrompt(String promptId);

    Optional<DatasetRow> findRow(String rowId);

    /**
     * All rows of a dataset, ordered by ID.
     */
    List<DatasetRow> findRows(String datasetId);

    /**
     * Rows by ID. Unknown IDs are absent from the result.
     */
    Map<String, DatasetRow> findRowsByIds(Collection<String> rowIds);

    int countRows(String datasetId);
}
