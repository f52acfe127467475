package promptgrid.coordinator.model;

import java.util.Objects;

/**
 * One immutable input row of a dataset.
 *
 * @param expectedLabel gold label used by downstream scoring, may be null
 */
public record DatasetRow(String id, String datasetId, String content, String expectedLabel) {
    public DatasetRow {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(content, "content is required");
    }
}
