package notifier.weather.sdk.cache;

import notifier.weather.sdk.WeatherException;

import java.time.Duration;
import java.util.Optional;

/**
 * Byte-valued key/value store with per-entry TTL.
 *
 * <p>A miss is an empty {@link Optional}; a backend failure is a
 * {@link notifier.weather.sdk.ErrorKind#EXTERNAL_API} exception, so callers can tell
 * "cache errored" from "cache missed". Each {@link #get} counts exactly once as a hit
 * or a miss; no other operation touches the counters.
 */
public interface CacheStore extends AutoCloseable {

    Optional<byte[]> get(String key) throws WeatherException;

    /**
     * @throws WeatherException VALIDATION when the key is empty, the value is null or the TTL is not positive
     */
    void set(String key, byte[] value, Duration ttl) throws WeatherException;

    boolean exists(String key) throws WeatherException;

    void delete(String key) throws WeatherException;

    void clear() throws WeatherException;

    CacheStats getStats();

    /**
     * Short backend name used in metrics and logs, e.g. {@code memory} or {@code redis}.
     */
    String type();

    @Override
    default void close() {
    }
}
