package notifier.weather.sdk.config;

import io.github.cdimascio.dotenv.Dotenv;
import notifier.weather.sdk.WeatherException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Settings of the weather resolution pipeline: provider credentials and order,
 * cache switch and TTL, cache backend.
 *
 * <p>{@link #load()} reads a {@code .env} file when one exists and falls back to the
 * process environment. Every value is validated; a bad value raises a
 * {@link notifier.weather.sdk.ErrorKind#CONFIGURATION} error.
 */
public class WeatherConfig {
    public static final String DEFAULT_WEATHER_API_URL = "https://api.weatherapi.com/v1";
    public static final String DEFAULT_OPENWEATHERMAP_URL = "https://api.openweathermap.org/data/2.5";
    public static final List<String> DEFAULT_PROVIDER_ORDER = List.of("weatherapi", "openweathermap");
    public static final int MAX_CACHE_TTL_MINUTES = 1440;

    private final String weatherApiKey;
    private final String weatherApiBaseUrl;
    private final String openWeatherMapKey;
    private final String openWeatherMapBaseUrl;
    private final List<String> providerOrder;
    private final boolean cacheEnabled;
    private final boolean loggingEnabled;
    private final Duration cacheTtl;
    private final Duration httpTimeout;
    private final CacheSettings cache;

    private WeatherConfig(Builder builder) {
        this.weatherApiKey = builder.weatherApiKey;
        this.weatherApiBaseUrl = builder.weatherApiBaseUrl;
        this.openWeatherMapKey = builder.openWeatherMapKey;
        this.openWeatherMapBaseUrl = builder.openWeatherMapBaseUrl;
        this.providerOrder = Collections.unmodifiableList(new ArrayList<>(builder.providerOrder));
        this.cacheEnabled = builder.cacheEnabled;
        this.loggingEnabled = builder.loggingEnabled;
        this.cacheTtl = builder.cacheTtl;
        this.httpTimeout = builder.httpTimeout;
        this.cache = builder.cache;
    }

    public static WeatherConfig load() throws WeatherException {
        return from(Dotenv.configure().ignoreIfMissing().load());
    }

    public static WeatherConfig from(Dotenv dotenv) throws WeatherException {
        RedisSettings redis = new RedisSettings(
                value(dotenv, "REDIS_ADDR", RedisSettings.DEFAULT_ADDR),
                value(dotenv, "REDIS_PASSWORD", ""),
                intValue(dotenv, "REDIS_DB", 0),
                Duration.ofSeconds(intValue(dotenv, "REDIS_DIAL_TIMEOUT", 5)),
                Duration.ofSeconds(intValue(dotenv, "REDIS_READ_TIMEOUT", 3)),
                Duration.ofSeconds(intValue(dotenv, "REDIS_WRITE_TIMEOUT", 3)));
        CacheType cacheType = CacheType.fromString(value(dotenv, "CACHE_TYPE", CacheType.MEMORY.value()));

        return builder()
                .weatherApiKey(value(dotenv, "WEATHER_API_KEY", ""))
                .weatherApiBaseUrl(value(dotenv, "WEATHER_API_BASE_URL", DEFAULT_WEATHER_API_URL))
                .openWeatherMapKey(value(dotenv, "OPENWEATHERMAP_API_KEY", ""))
                .openWeatherMapBaseUrl(value(dotenv, "OPENWEATHERMAP_API_BASE_URL", DEFAULT_OPENWEATHERMAP_URL))
                .providerOrder(listValue(dotenv, "WEATHER_PROVIDER_ORDER", DEFAULT_PROVIDER_ORDER))
                .cacheEnabled(boolValue(dotenv, "WEATHER_ENABLE_CACHE", true))
                .loggingEnabled(boolValue(dotenv, "WEATHER_ENABLE_LOGGING", true))
                .cacheTtl(Duration.ofMinutes(intValue(dotenv, "WEATHER_CACHE_TTL_MINUTES", 10)))
                .httpTimeout(Duration.ofSeconds(intValue(dotenv, "WEATHER_HTTP_TIMEOUT_SECONDS", 10)))
                .cache(new CacheSettings(cacheType, redis))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String value(Dotenv dotenv, String key, String defaultValue) {
        String raw = dotenv.get(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        return raw.trim();
    }

    private static int intValue(Dotenv dotenv, String key, int defaultValue) throws WeatherException {
        String raw = value(dotenv, key, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw WeatherException.configuration(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    private static boolean boolValue(Dotenv dotenv, String key, boolean defaultValue) throws WeatherException {
        String raw = value(dotenv, key, null);
        if (raw == null) {
            return defaultValue;
        }
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
                return true;
            case "false":
            case "0":
            case "no":
                return false;
            default:
                throw WeatherException.configuration(key + " must be a boolean, got '" + raw + "'");
        }
    }

    private static List<String> listValue(Dotenv dotenv, String key, List<String> defaultValue) {
        String raw = value(dotenv, key, null);
        if (raw == null) {
            return defaultValue;
        }
        List<String> items = new ArrayList<>();
        for (String part : raw.split(",")) {
            String item = part.trim().toLowerCase(Locale.ROOT);
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    public String getWeatherApiKey() {
        return weatherApiKey;
    }

    public String getWeatherApiBaseUrl() {
        return weatherApiBaseUrl;
    }

    public String getOpenWeatherMapKey() {
        return openWeatherMapKey;
    }

    public String getOpenWeatherMapBaseUrl() {
        return openWeatherMapBaseUrl;
    }

    public List<String> getProviderOrder() {
        return providerOrder;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public boolean isLoggingEnabled() {
        return loggingEnabled;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public CacheSettings getCache() {
        return cache;
    }

    public static class Builder {
        private String weatherApiKey = "";
        private String weatherApiBaseUrl = DEFAULT_WEATHER_API_URL;
        private String openWeatherMapKey = "";
        private String openWeatherMapBaseUrl = DEFAULT_OPENWEATHERMAP_URL;
        private List<String> providerOrder = DEFAULT_PROVIDER_ORDER;
        private boolean cacheEnabled = true;
        private boolean loggingEnabled = true;
        private Duration cacheTtl = Duration.ofMinutes(10);
        private Duration httpTimeout = Duration.ofSeconds(10);
        private CacheSettings cache = CacheSettings.memory();

        private Builder() {
        }

        public Builder weatherApiKey(String weatherApiKey) {
            this.weatherApiKey = weatherApiKey == null ? "" : weatherApiKey;
            return this;
        }

        public Builder weatherApiBaseUrl(String weatherApiBaseUrl) {
            this.weatherApiBaseUrl = weatherApiBaseUrl;
            return this;
        }

        public Builder openWeatherMapKey(String openWeatherMapKey) {
            this.openWeatherMapKey = openWeatherMapKey == null ? "" : openWeatherMapKey;
            return this;
        }

        public Builder openWeatherMapBaseUrl(String openWeatherMapBaseUrl) {
            this.openWeatherMapBaseUrl = openWeatherMapBaseUrl;
            return this;
        }

        public Builder providerOrder(List<String> providerOrder) {
            this.providerOrder = providerOrder;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder loggingEnabled(boolean loggingEnabled) {
            this.loggingEnabled = loggingEnabled;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder cache(CacheSettings cache) {
            this.cache = cache;
            return this;
        }

        public WeatherConfig build() throws WeatherException {
            validateUrl("WEATHER_API_BASE_URL", weatherApiBaseUrl);
            validateUrl("OPENWEATHERMAP_API_BASE_URL", openWeatherMapBaseUrl);
            if (providerOrder == null) {
                throw WeatherException.configuration("WEATHER_PROVIDER_ORDER cannot be null");
            }
            if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()
                    || cacheTtl.compareTo(Duration.ofMinutes(MAX_CACHE_TTL_MINUTES)) > 0) {
                throw WeatherException.configuration(
                        "WEATHER_CACHE_TTL_MINUTES must be between 1 and " + MAX_CACHE_TTL_MINUTES);
            }
            if (httpTimeout == null || httpTimeout.isNegative() || httpTimeout.isZero()) {
                throw WeatherException.configuration("WEATHER_HTTP_TIMEOUT_SECONDS must be positive");
            }
            if (cache == null || cache.getType() == null) {
                throw WeatherException.configuration("cache type is required");
            }
            validateRedis(cache.getRedis());
            return new WeatherConfig(this);
        }

        private static void validateUrl(String key, String url) throws WeatherException {
            if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
                throw WeatherException.configuration(key + " must start with http:// or https://");
            }
        }

        private static void validateRedis(RedisSettings redis) throws WeatherException {
            if (redis == null) {
                throw WeatherException.configuration("redis settings are required");
            }
            if (redis.getAddr() == null || redis.getAddr().isEmpty()) {
                throw WeatherException.configuration("REDIS_ADDR cannot be empty");
            }
            if (redis.getDb() < 0 || redis.getDb() > RedisSettings.MAX_DB) {
                throw WeatherException.configuration("REDIS_DB must be between 0 and " + RedisSettings.MAX_DB);
            }
            if (!isPositive(redis.getDialTimeout()) || !isPositive(redis.getReadTimeout())
                    || !isPositive(redis.getWriteTimeout())) {
                throw WeatherException.configuration("Redis timeouts must be positive");
            }
        }

        private static boolean isPositive(Duration duration) {
            return duration != null && !duration.isNegative() && !duration.isZero();
        }
    }
}
