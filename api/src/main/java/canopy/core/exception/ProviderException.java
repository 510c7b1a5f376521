package canopy.core.exception;

import java.util.Objects;

import canopy.core.model.provider.FailureKind;

/**
 * Base class for a single provider attempt failing.
 *
 * <p>These are retryable: the orchestrator retries the same provider up to its
 * configured budget before moving on to the next one.
 */
public abstract class ProviderException extends RuntimeException {

    private final String providerName;
    private final FailureKind kind;

    protected ProviderException(String providerName, FailureKind kind, String message) {
        super(message);
        this.providerName = Objects.requireNonNull(providerName, "providerName must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    protected ProviderException(String providerName, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.providerName = Objects.requireNonNull(providerName, "providerName must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public String providerName() {
        return providerName;
    }

    public FailureKind kind() {
        return kind;
    }
}
