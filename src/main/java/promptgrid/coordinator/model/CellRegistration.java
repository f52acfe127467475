package promptgrid.coordinator.model;

/**
 * Result of registering a (model, prompt, dataset) combination.
 *
 * @param created false when the combination already existed and nothing was written
 */
public record CellRegistration(WorkCell cell, boolean created) {
}
