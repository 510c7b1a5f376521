package canopy.core.model.provider;

/**
 * Request conditions under which a provider is not attempted at all.
 */
public enum SkipCondition {
    /** Rain or storm at the location. */
    HEAVY_PRECIPITATION("Heavy precipitation at location"),
    /** Location lies in a configured priority area that needs finer resolution. */
    PRIORITY_AREA("Location in high-resolution priority area"),
    /** Crop grows too fast for the provider's revisit interval. */
    RAPID_GROWTH("Rapid growth crop needs more frequent revisits");

    private final String reason;

    SkipCondition(String reason) {
        this.reason = reason;
    }

    /**
     * Detail recorded on the skipped attempt.
     *
     * @return the reason
     */
    public String reason() {
        return reason;
    }
}
