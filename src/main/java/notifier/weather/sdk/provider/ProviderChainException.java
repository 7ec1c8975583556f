package notifier.weather.sdk.provider;

import notifier.weather.sdk.ErrorKind;
import notifier.weather.sdk.WeatherException;

/**
 * Every provider in the chain failed. Only the last provider's failure is kept as the cause;
 * earlier failures are logged by the resolver.
 */
public class ProviderChainException extends WeatherException {
    private final int providersTried;

    public ProviderChainException(int providersTried, WeatherException lastError) {
        super(lastError.is(ErrorKind.NOT_FOUND) ? ErrorKind.NOT_FOUND : ErrorKind.EXTERNAL_API,
                "all weather providers failed (tried " + providersTried + " providers): " + lastError.getMessage(),
                lastError);
        this.providersTried = providersTried;
    }

    public int getProvidersTried() {
        return providersTried;
    }
}
