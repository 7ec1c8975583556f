package notifier.weather.sdk;

import notifier.weather.sdk.cache.CacheStore;
import notifier.weather.sdk.cache.MemoryCacheStore;
import notifier.weather.sdk.cache.WeatherCache;
import notifier.weather.sdk.provider.FallbackResolver;
import notifier.weather.sdk.provider.ProviderChainException;
import notifier.weather.sdk.provider.ProviderInfo;
import notifier.weather.sdk.provider.StubProvider;
import notifier.weather.sdk.provider.WeatherResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WeatherServiceTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    private WeatherReading london;
    private StubProvider provider;
    private MemoryCacheStore store;

    @BeforeEach
    void setUp() {
        london = StubProvider.reading("London", 15.0, 76.0, "Partly cloudy");
        provider = StubProvider.returning("weatherapi", london);
        store = new MemoryCacheStore();
    }

    private WeatherService service(WeatherResolver resolver, CacheStore cacheStore, boolean cacheEnabled) {
        return new WeatherService(resolver, cacheStore, cacheEnabled, TTL);
    }

    @Test
    void getWeather_emptyCache_returnsProviderReadingAndCachesIt() throws Exception {
        WeatherService service = service(new FallbackResolver(List.of(provider)), store, true);

        WeatherReading reading = service.getWeather("London");

        assertEquals(london, reading);
        assertEquals(15.0, reading.getTemperature());
        assertEquals(76.0, reading.getHumidity());
        assertEquals("Partly cloudy", reading.getDescription());
        assertTrue(store.get("weather:London").isPresent(), "reading should be cached under weather:London");
    }

    @Test
    void getWeather_twiceWithinTtl_callsProviderOnce() throws Exception {
        WeatherService service = service(new FallbackResolver(List.of(provider)), store, true);

        WeatherReading first = service.getWeather("London");
        WeatherReading second = service.getWeather("London");

        assertEquals(1, provider.calls());
        assertEquals(first, second);
    }

    @Test
    void getWeather_afterTtlExpires_fetchesAgain() throws Exception {
        WeatherService service = new WeatherService(
                new FallbackResolver(List.of(provider)), store, true, Duration.ofMillis(100));

        service.getWeather("London");
        Thread.sleep(150);
        service.getWeather("London");

        assertEquals(2, provider.calls());
    }

    @Test
    void getWeather_emptyCity_failsWithoutTouchingCacheOrProviders() {
        CacheStore cacheStore = mock(CacheStore.class);
        WeatherService service = service(new FallbackResolver(List.of(provider)), cacheStore, true);

        WeatherException empty = assertThrows(WeatherException.class, () -> service.getWeather(""));
        WeatherException blank = assertThrows(WeatherException.class, () -> service.getWeather("   "));
        WeatherException nul = assertThrows(WeatherException.class, () -> service.getWeather(null));

        assertEquals(ErrorKind.VALIDATION, empty.getKind());
        assertEquals(ErrorKind.VALIDATION, blank.getKind());
        assertEquals(ErrorKind.VALIDATION, nul.getKind());
        assertEquals(0, provider.calls());
        verifyNoInteractions(cacheStore);
    }

    @Test
    void getWeather_trimsCityForProvidersAndCacheKey() throws Exception {
        WeatherService service = service(new FallbackResolver(List.of(provider)), store, true);

        service.getWeather("  London \t");

        assertEquals(List.of("London"), provider.cities());
        assertTrue(store.exists(WeatherCache.keyFor("London")));
    }

    @Test
    void getWeather_cityKeyIsCaseSensitive() throws Exception {
        WeatherService service = service(new FallbackResolver(List.of(provider)), store, true);

        service.getWeather("London");
        service.getWeather("london");

        assertEquals(2, provider.calls());
    }

    @Test
    void getWeather_cacheWriteFails_stillReturnsReading() throws Exception {
        CacheStore cacheStore = mock(CacheStore.class);
        when(cacheStore.get(anyString())).thenReturn(Optional.empty());
        doThrow(WeatherException.externalApi("redis set operation failed"))
                .when(cacheStore).set(anyString(), any(byte[].class), any(Duration.class));
        WeatherService service = service(new FallbackResolver(List.of(provider)), cacheStore, true);

        WeatherReading reading = service.getWeather("London");

        assertEquals(london, reading);
        verify(cacheStore).set(eq("weather:London"), any(byte[].class), eq(TTL));
    }

    @Test
    void getWeather_cacheReadFails_fallsThroughToProviders() throws Exception {
        CacheStore cacheStore = mock(CacheStore.class);
        when(cacheStore.get(anyString())).thenThrow(WeatherException.externalApi("redis get operation failed"));
        WeatherService service = service(new FallbackResolver(List.of(provider)), cacheStore, true);

        WeatherReading reading = service.getWeather("London");

        assertEquals(london, reading);
        assertEquals(1, provider.calls());
    }

    @Test
    void getWeather_cacheDisabled_alwaysAsksProvidersAndNeverTouchesCache() throws Exception {
        CacheStore cacheStore = mock(CacheStore.class);
        WeatherService service = service(new FallbackResolver(List.of(provider)), cacheStore, false);

        service.getWeather("London");
        service.getWeather("London");

        assertEquals(2, provider.calls());
        verify(cacheStore, never()).get(anyString());
        verify(cacheStore, never()).set(anyString(), any(byte[].class), any(Duration.class));
    }

    @Test
    void getWeather_cityUnknownToAllProviders_propagatesNotFoundUnwrapped() throws Exception {
        StubProvider first = StubProvider.failing("weatherapi", WeatherException.notFound("city not found"));
        StubProvider second = StubProvider.failing("openweathermap", WeatherException.notFound("city not found"));
        WeatherService service = service(new FallbackResolver(List.of(first, second)), store, true);

        WeatherException e = assertThrows(WeatherException.class, () -> service.getWeather("Atlantis"));

        assertEquals(ErrorKind.NOT_FOUND, e.getKind());
        assertTrue(e instanceof ProviderChainException);
        assertFalse(store.exists("weather:Atlantis"));
    }

    @Test
    void getWeather_providersDown_wrapsAsExternalApi() {
        StubProvider first = StubProvider.failing("weatherapi", WeatherException.notFound("city not found"));
        StubProvider second = StubProvider.failing("openweathermap",
                WeatherException.externalApi("OpenWeatherMap returned status 503"));
        WeatherService service = service(new FallbackResolver(List.of(first, second)), store, true);

        WeatherException e = assertThrows(WeatherException.class, () -> service.getWeather("London"));

        assertEquals(ErrorKind.EXTERNAL_API, e.getKind());
        assertEquals("weather provider failed", e.getMessage());
        assertTrue(e.getCause() instanceof ProviderChainException);
    }

    @Test
    void getWeather_noProvidersConfigured_failsAsExternalApiWithConfigurationCause() {
        WeatherService service = service(new FallbackResolver(List.of()), store, true);

        WeatherException e = assertThrows(WeatherException.class, () -> service.getWeather("London"));

        assertEquals(ErrorKind.EXTERNAL_API, e.getKind());
        WeatherException cause = (WeatherException) e.getCause();
        assertEquals(ErrorKind.CONFIGURATION, cause.getKind());
        assertEquals("no weather providers configured", cause.getMessage());
    }

    @Test
    void getWeather_providerReturnsInvalidReading_failsWithValidationAndSkipsCache() throws Exception {
        StubProvider broken = StubProvider.returning("weatherapi",
                StubProvider.reading("London", 15.0, 140.0, "Partly cloudy"));
        WeatherService service = service(new FallbackResolver(List.of(broken)), store, true);

        WeatherException e = assertThrows(WeatherException.class, () -> service.getWeather("London"));

        assertEquals(ErrorKind.VALIDATION, e.getKind());
        assertTrue(e.getMessage().contains("humidity must be between 0 and 100"));
        assertFalse(store.exists("weather:London"));
    }

    @Test
    void getCacheMetrics_countsHitsAndMisses() throws Exception {
        WeatherService service = service(new FallbackResolver(List.of(provider)), store, true);

        service.getWeather("London");
        service.getWeather("London");
        service.getWeather("London");

        assertEquals(2, service.getCacheMetrics().getHits());
        assertEquals(1, service.getCacheMetrics().getMisses());
        assertEquals(3, service.getCacheMetrics().getTotalOps());
        assertEquals(2.0 / 3.0, service.getCacheMetrics().getHitRatio(), 1e-4);
    }

    @Test
    void getProviderInfo_reportsOrderAndCacheFlag() {
        StubProvider second = StubProvider.returning("openweathermap", london);
        WeatherService service = service(new FallbackResolver(List.of(provider, second)), store, false);

        ProviderInfo info = service.getProviderInfo();

        assertEquals(List.of("weatherapi", "openweathermap"), info.getProviderOrder());
        assertEquals(2, info.getTotalProviders());
        assertTrue(info.isFallbackEnabled());
        assertFalse(info.isCacheEnabled());
        assertFalse(info.isLoggingEnabled());
    }

    @Test
    void constructor_rejectsMissingCollaborators() {
        FallbackResolver resolver = new FallbackResolver(List.of(provider));

        assertThrows(IllegalArgumentException.class, () -> new WeatherService(null, store, true, TTL));
        assertThrows(IllegalArgumentException.class, () -> new WeatherService(resolver, null, true, TTL));
        assertThrows(IllegalArgumentException.class, () -> new WeatherService(resolver, store, true, Duration.ZERO));
    }
}
