package canopy.core.exception;

import canopy.core.model.provider.FailureKind;

/**
 * A provider answered with something that is not a usable reading.
 */
public class ProviderInvalidResponseException extends ProviderException {

    public ProviderInvalidResponseException(String providerName, String message) {
        super(providerName, FailureKind.INVALID_RESPONSE, message);
    }

    public ProviderInvalidResponseException(String providerName, String message, Throwable cause) {
        super(providerName, FailureKind.INVALID_RESPONSE, message, cause);
    }
}
