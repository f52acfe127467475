package promptgrid.coordinator.model;

import java.util.Objects;

/**
 * Named, immutable collection of rows to score.
 */
public record Dataset(String id, String name) {
    public Dataset {
        Objects.requireNonNull(id, "id is required");
        name = name != null ? name : id;
    }
}
