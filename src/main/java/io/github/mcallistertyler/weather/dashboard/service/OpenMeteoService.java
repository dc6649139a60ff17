package io.github.mcallistertyler.weather.dashboard.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import io.github.mcallistertyler.weather.dashboard.domain.Coordinates;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class OpenMeteoService {

    private static final Logger log = LoggerFactory.getLogger(OpenMeteoService.class);

    private static final Joiner COMMA = Joiner.on(',');

    private static final ImmutableList<String> HOURLY_FIELDS = ImmutableList.of(
            "temperature_2m", "apparent_temperature", "relative_humidity_2m", "wind_speed_10m",
            "precipitation", "precipitation_probability", "weather_code");
    private static final ImmutableList<String> DAILY_FIELDS = ImmutableList.of(
            "weather_code", "temperature_2m_max", "temperature_2m_min", "precipitation_sum",
            "precipitation_probability_max", "sunrise", "sunset");
    private static final ImmutableList<String> CURRENT_FIELDS = ImmutableList.of(
            "temperature_2m", "apparent_temperature", "relative_humidity_2m", "wind_speed_10m", "weather_code");
    private static final ImmutableList<String> HISTORICAL_FIELDS = ImmutableList.of(
            "temperature_2m_min", "temperature_2m_mean", "temperature_2m_max", "precipitation_sum");
    private static final ImmutableList<String> AIR_QUALITY_FIELDS = ImmutableList.of(
            "pm2_5", "pm10", "european_aqi", "us_aqi");

    enum Endpoint { FORECAST, HISTORICAL, AIR_QUALITY }

    record ProviderRequest(Endpoint endpoint, Coordinates coordinates) {}

    @Value("${api.openmeteo.forecast-host}")
    private String forecastHost;

    @Value("${api.openmeteo.archive-host}")
    private String archiveHost;

    @Value("${api.openmeteo.air-quality-host}")
    private String airQualityHost;

    @Value("${api.openmeteo.user-agent}")
    private String userAgent;

    @Value("${api.openmeteo.forecast-days}")
    private int forecastDays;

    @Value("${api.openmeteo.historical-days}")
    private int historicalDays;

    private final OkHttpClient httpClient;

    private final Clock clock;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final int MAX_CACHE_SIZE = 1000;
    private final Duration CACHE_EXPIRATION = Duration.ofMinutes(30);

    private final LoadingCache<ProviderRequest, JsonNode> responseCache = CacheBuilder.newBuilder()
            .maximumSize(MAX_CACHE_SIZE)
            .recordStats()
            .expireAfterWrite(CACHE_EXPIRATION)
            .build(new CacheLoader<>() {
                @NotNull
                @Override
                public JsonNode load(@NotNull ProviderRequest request) throws IOException {
                    Optional<JsonNode> response = fetchFromApi(request);
                    if (response.isPresent()) {
                        return response.get();
                    }
                    throw new IllegalStateException("No " + request.endpoint() + " response returned for coordinates " + request.coordinates());
                }
            });

    private final Cache<ProviderRequest, JsonNode> lastKnownResponses = CacheBuilder.newBuilder()
            .maximumSize(MAX_CACHE_SIZE)
            .build();

    public OpenMeteoService(OkHttpClient httpClient, Clock clock) {
        this.httpClient = httpClient;
        this.clock = clock;
    }

    public Optional<JsonNode> fetchForecast(Coordinates coordinates) {
        return getResponse(new ProviderRequest(Endpoint.FORECAST, coordinates));
    }

    public Optional<JsonNode> fetchHistorical(Coordinates coordinates) {
        return getResponse(new ProviderRequest(Endpoint.HISTORICAL, coordinates));
    }

    public Optional<JsonNode> fetchAirQuality(Coordinates coordinates) {
        return getResponse(new ProviderRequest(Endpoint.AIR_QUALITY, coordinates));
    }

    private Optional<JsonNode> getResponse(ProviderRequest request) {
        try {
            JsonNode cached = responseCache.getIfPresent(request);
            if (cached != null) {
                log.info("Returning cached {} response for {}", request.endpoint(), request.coordinates());
                return Optional.of(cached);
            }
            JsonNode fetched = responseCache.get(request);
            lastKnownResponses.put(request, fetched);
            return Optional.of(fetched);
        } catch (Exception e) {
            log.error("Failed to retrieve {} response for {}. Returning last known value if any", request.endpoint(), request.coordinates(), e);
            return Optional.ofNullable(lastKnownResponses.getIfPresent(request));
        }
    }

    Optional<JsonNode> fetchFromApi(ProviderRequest request) throws IOException {
        HttpUrl httpUrl = buildUrl(request);
        Request httpRequest = new Request.Builder()
                .url(httpUrl)
                .addHeader("User-Agent", userAgent)
                .get()
                .build();

        try (Response response = httpClient.newCall(httpRequest).execute()) {
            switch (response.code()) {
                case 200:
                    ResponseBody body = response.body();
                    if (body != null) {
                        return Optional.of(objectMapper.readTree(body.string()));
                    }
                    log.warn("Empty body in {} response for {}", request.endpoint(), request.coordinates());
                    break;
                case 429:
                    log.error("Open-Meteo is throttling requests. Consider reducing the number of requests or increasing cache expiry.");
                    break;
                default:
                    log.warn("Unexpected response code {} from {}", response.code(), httpUrl.host());
            }
            return Optional.empty();
        } catch (IOException e) {
            log.error("Error when calling Open-Meteo {} API", request.endpoint(), e);
            throw new IOException("Error when calling Open-Meteo " + request.endpoint() + " API", e);
        }
    }

    HttpUrl buildUrl(ProviderRequest request) {
        Coordinates coordinates = request.coordinates();
        HttpUrl.Builder url = new HttpUrl.Builder()
                .scheme("https")
                .addQueryParameter("latitude", String.valueOf(coordinates.lat()))
                .addQueryParameter("longitude", String.valueOf(coordinates.lon()))
                .addQueryParameter("timezone", clock.getZone().getId());

        switch (request.endpoint()) {
            case FORECAST:
                url.host(forecastHost)
                        .addPathSegments("v1/forecast")
                        .addQueryParameter("hourly", COMMA.join(HOURLY_FIELDS))
                        .addQueryParameter("daily", COMMA.join(DAILY_FIELDS))
                        .addQueryParameter("current", COMMA.join(CURRENT_FIELDS))
                        .addQueryParameter("forecast_days", String.valueOf(forecastDays));
                break;
            case HISTORICAL:
                LocalDate today = LocalDate.now(clock);
                url.host(archiveHost)
                        .addPathSegments("v1/archive")
                        .addQueryParameter("start_date", today.minusDays(historicalDays).toString())
                        .addQueryParameter("end_date", today.minusDays(1).toString())
                        .addQueryParameter("daily", COMMA.join(HISTORICAL_FIELDS));
                break;
            case AIR_QUALITY:
                url.host(airQualityHost)
                        .addPathSegments("v1/air-quality")
                        .addQueryParameter("current", COMMA.join(AIR_QUALITY_FIELDS));
                break;
        }
        return url.build();
    }
}
