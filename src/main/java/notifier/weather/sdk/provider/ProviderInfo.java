package notifier.weather.sdk.provider;

import java.util.Collections;
import java.util.List;

/**
 * Read-only description of the provider chain, for health and metrics endpoints.
 */
public final class ProviderInfo {
    private final List<String> providerOrder;
    private final boolean cacheEnabled;
    private final boolean loggingEnabled;

    public ProviderInfo(List<String> providerOrder, boolean cacheEnabled, boolean loggingEnabled) {
        this.providerOrder = Collections.unmodifiableList(providerOrder);
        this.cacheEnabled = cacheEnabled;
        this.loggingEnabled = loggingEnabled;
    }

    public List<String> getProviderOrder() {
        return providerOrder;
    }

    public int getTotalProviders() {
        return providerOrder.size();
    }

    public boolean isChainEnabled() {
        return true;
    }

    public boolean isFallbackEnabled() {
        return providerOrder.size() > 1;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public boolean isLoggingEnabled() {
        return loggingEnabled;
    }

    public ProviderInfo withCacheEnabled(boolean enabled) {
        return new ProviderInfo(providerOrder, enabled, loggingEnabled);
    }

    public ProviderInfo withLoggingEnabled(boolean enabled) {
        return new ProviderInfo(providerOrder, cacheEnabled, enabled);
    }

    @Override
    public String toString() {
        return "ProviderInfo{providerOrder=" + providerOrder
                + ", totalProviders=" + getTotalProviders()
                + ", fallbackEnabled=" + isFallbackEnabled()
                + ", cacheEnabled=" + cacheEnabled
                + ", loggingEnabled=" + loggingEnabled + "}";
    }
}
