package canopy.core.exception;

import canopy.core.model.provider.FailureKind;

/**
 * A provider could not be reached or reported an error.
 */
public class ProviderUnavailableException extends ProviderException {

    public ProviderUnavailableException(String providerName, String message) {
        super(providerName, FailureKind.UNAVAILABLE, message);
    }

    public ProviderUnavailableException(String providerName, String message, Throwable cause) {
        super(providerName, FailureKind.UNAVAILABLE, message, cause);
    }
}
