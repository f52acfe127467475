package promptgrid.coordinator.repository;

import promptgrid.coordinator.model.Prediction;
import promptgrid.coordinator.model.PredictionQuery;

import java.util.List;

/**
 * Read access to the append-only prediction log. Records are appended by
 * {@link RowTaskRepository#complete}.
 */
public interface PredictionRepository {

    /**
     * Every prediction of a cell, oldest first.
     */
    List<Prediction> findByCell(String cellId);

    /**
     * The authoritative (most recent) prediction per (cell, row) matching the query.
     */
    List<Prediction> findLatest(PredictionQuery query);

    int countByCell(String cellId);
}
