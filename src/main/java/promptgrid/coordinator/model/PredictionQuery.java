package promptgrid.coordinator.model;

/**
 * Filter for reading the prediction log. Null fields do not restrict.
 */
public record PredictionQuery(String modelId, String promptId, String datasetId, String family) {

    public static PredictionQuery all() {
        return new PredictionQuery(null, null, null, null);
    }

    public PredictionQuery withModelId(String modelId) {
        return new PredictionQuery(modelId, promptId, datasetId, family);
    }

    public PredictionQuery withPromptId(String promptId) {
        return new PredictionQuery(modelId, promptId, datasetId, family);
    }

    public PredictionQuery withDatasetId(String datasetId) {
        return new PredictionQuery(modelId, promptId, datasetId, family);
    }

    public PredictionQuery withFamily(String family) {
        return new PredictionQuery(modelId, promptId, datasetId, family);
    }
}
