package promptgrid.coordinator.model;

/**
 * Coordination status of a work cell.
 */
public enum CellStatus {
    /** No worker holds the cell; it may be claimed if it has pending tasks */
    AVAILABLE,
    /** At least one worker holds the cell */
    IN_USE,
    /** Every row task of the cell is DONE or FAILED */
    DONE
}
