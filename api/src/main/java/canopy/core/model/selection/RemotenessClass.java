package canopy.core.model.selection;

/**
 * How well ground reference data covers a location.
 */
public enum RemotenessClass {
    WELL_COVERED,
    SPARSE
}
