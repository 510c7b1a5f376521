package canopy.core.model.estimate;

/**
 * Outcome of one physical provider attempt.
 */
public enum AttemptOutcome {
    SUCCESS,
    TIMEOUT,
    ERROR,
    /** Provider excluded for this request by a hard constraint and never called. */
    SKIPPED
}
