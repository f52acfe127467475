package promptgrid.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON description of reference data to register; every model x prompt x
 * dataset combination becomes a work cell.
 *
 * <pre>
 * {
 *   "models":   [{"id": "m1", "name": "bert-base", "family": "transformers"}],
 *   "prompts":  [{"id": "p1", "template": "Classify: {text}"}],
 *   "datasets": [{"id": "d1", "name": "reviews",
 *                 "rows": [{"id": "d1-1", "content": "great", "expectedLabel": "pos"}]}]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GridManifest(
        @JsonProperty("models") List<ModelEntry> models,
        @JsonProperty("prompts") List<PromptEntry> prompts,
        @JsonProperty("datasets") List<DatasetEntry> datasets) {

    public GridManifest {
        models = models != null ? models : List.of();
        prompts = prompts != null ? prompts : List.of();
        datasets = datasets != null ? datasets : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelEntry(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("family") String family) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PromptEntry(
            @JsonProperty("id") String id,
            @JsonProperty("template") String template) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DatasetEntry(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("rows") List<RowEntry> rows) {

        public DatasetEntry {
            rows = rows != null ? rows : List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RowEntry(
            @JsonProperty("id") String id,
            @JsonProperty("content") String content,
            @JsonProperty("expectedLabel") String expectedLabel) {
    }
}
