package canopy.core.model.provider;

/**
 * Capabilities the selection policy reasons about.
 */
public enum ProviderTrait {
    /** Optical sensor; degraded by cloud cover. */
    OPTICAL,
    /** Usable through cloud cover or frequent enough to find a clear pass. */
    CLOUD_TOLERANT,
    /** Coarse but available for practically any location and date. */
    ALWAYS_AVAILABLE
}
