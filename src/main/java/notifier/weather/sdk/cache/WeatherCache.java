package notifier.weather.sdk.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.WeatherReading;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Stores {@link WeatherReading}s in a {@link CacheStore} as flat JSON records
 * ({@code temperature, humidity, description, city, timestamp}), the timestamp as an ISO-8601 instant.
 */
public class WeatherCache {
    public static final String KEY_PREFIX = "weather:";

    private final CacheStore store;
    private final ObjectMapper mapper;

    public WeatherCache(CacheStore store) {
        this.store = store;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static String keyFor(String city) {
        return KEY_PREFIX + city;
    }

    public Optional<WeatherReading> get(String key) throws WeatherException {
        Optional<byte[]> data = store.get(key);
        if (data.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(data.get(), WeatherReading.class));
        } catch (IOException e) {
            throw WeatherException.externalApi("failed to deserialize weather data", e);
        }
    }

    public void set(String key, WeatherReading reading, Duration ttl) throws WeatherException {
        if (reading == null) {
            throw WeatherException.validation("weather data cannot be null");
        }
        reading.validate();

        byte[] data;
        try {
            data = mapper.writeValueAsBytes(reading);
        } catch (JsonProcessingException e) {
            throw WeatherException.externalApi("failed to serialize weather data", e);
        }
        store.set(key, data, ttl);
    }

    public CacheStore getStore() {
        return store;
    }
}
