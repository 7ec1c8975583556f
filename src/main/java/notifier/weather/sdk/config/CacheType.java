package notifier.weather.sdk.config;

import notifier.weather.sdk.WeatherException;

import java.util.Locale;

/**
 * Cache backend selected by {@code CACHE_TYPE}.
 */
public enum CacheType {
    MEMORY("memory"),
    REDIS("redis");

    private final String value;

    CacheType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static CacheType fromString(String text) throws WeatherException {
        String normalized = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        for (CacheType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw WeatherException.configuration("unsupported cache type: " + text);
    }

    @Override
    public String toString() {
        return value;
    }
}
