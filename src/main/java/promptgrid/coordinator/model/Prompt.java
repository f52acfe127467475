package promptgrid.coordinator.model;

import java.util.Objects;

/**
 * Instruction template applied to every row during inference.
 */
public record Prompt(String id, String template) {
    public Prompt {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(template, "template is required");
    }
}
