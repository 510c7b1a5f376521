package canopy.core.model.selection;

/**
 * Economic value of the use case behind a request.
 */
public enum ValueClass {
    STANDARD,
    HIGH_VALUE
}
