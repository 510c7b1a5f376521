package canopy.core.model.selection;

/**
 * How fast the crop changes between observations.
 */
public enum GrowthRateClass {
    NORMAL,
    RAPID
}
