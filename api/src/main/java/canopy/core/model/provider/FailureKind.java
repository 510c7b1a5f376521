package canopy.core.model.provider;

/**
 * Why a provider attempt failed.
 */
public enum FailureKind {
    TIMEOUT,
    UNAVAILABLE,
    INVALID_RESPONSE
}
