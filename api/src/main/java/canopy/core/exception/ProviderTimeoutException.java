package canopy.core.exception;

import java.time.Duration;

import canopy.core.model.provider.FailureKind;

/**
 * A provider did not answer within its per-attempt timeout.
 */
public class ProviderTimeoutException extends ProviderException {

    public ProviderTimeoutException(String providerName, Duration timeout) {
        super(
                providerName,
                FailureKind.TIMEOUT,
                "Provider %s timed out after %dms".formatted(providerName, timeout.toMillis()));
    }
}
