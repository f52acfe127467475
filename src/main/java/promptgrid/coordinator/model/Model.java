package promptgrid.coordinator.model;

import java.util.Objects;

/**
 * Inference backend. {@code family} decides which workers may serve it.
 */
public record Model(String id, String name, String family) {
    public Model {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(family, "family is required");
        name = name != null ? name : id;
    }
}
