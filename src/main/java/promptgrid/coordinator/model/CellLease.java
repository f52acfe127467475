package promptgrid.coordinator.model;

import java.time.Instant;

/**
 * A worker's hold on a work cell. One lease per (cell, worker); the cell's
 * active worker count equals its number of leases.
 */
public record CellLease(String cellId, String workerId, Instant renewedAt) {
}
