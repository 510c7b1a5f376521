package canopy.core.exception;

/**
 * Every provider failed and the baseline estimator could not produce a result either.
 */
public class ChainExhaustedException extends RuntimeException {

    public ChainExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
