package io.github.mcallistertyler.weather.dashboard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.mcallistertyler.weather.dashboard.domain.AirQualityReading;
import io.github.mcallistertyler.weather.dashboard.domain.Coordinates;
import io.github.mcallistertyler.weather.dashboard.domain.CurrentWeather;
import io.github.mcallistertyler.weather.dashboard.domain.ForecastWindow;
import io.github.mcallistertyler.weather.dashboard.domain.HistoricalPoint;
import io.github.mcallistertyler.weather.dashboard.domain.WeatherCondition;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.ResourceUtils;


import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class WeatherDashboardServiceTest {

    private static final Coordinates HANOI = new Coordinates(21.03, 105.85);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private OpenMeteoService openMeteoService;

    private WeatherDashboardService weatherDashboardService;

    @BeforeEach
    public void setUp() {
        ZoneId zone = ZoneId.of("Asia/Ho_Chi_Minh");
        // 05:30 local time
        Clock clock = Clock.fixed(Instant.parse("2023-12-31T22:30:00Z"), zone);
        FieldResolver fieldResolver = new FieldResolver();
        WeatherConditionClassifier classifier = new WeatherConditionClassifier();
        weatherDashboardService = new WeatherDashboardService(
                openMeteoService,
                new TemporalWindower(fieldResolver, classifier, zone),
                new CurrentSnapshotMapper(fieldResolver, classifier, zone),
                clock);
    }

    private JsonNode readResource(String name) throws IOException {
        Path resourcePath = Paths.get(ResourceUtils.getFile("classpath:" + name).toURI());
        return objectMapper.readTree(Files.readString(resourcePath));
    }

    @Test
    public void currentWeatherCombinesConditionsAndNextHours() throws IOException {
        when(openMeteoService.fetchForecast(HANOI)).thenReturn(Optional.of(readResource("example-forecast-response.json")));

        CurrentWeather currentWeather = weatherDashboardService.current(HANOI, 9).orElseThrow();

        assertEquals(LocalDateTime.of(2024, 1, 1, 5, 30), currentWeather.conditions().time());
        assertEquals(19.4, currentWeather.conditions().temperature());
        assertEquals(18.9, currentWeather.conditions().feelsLike());
        assertEquals(82.0, currentWeather.conditions().humidity());
        assertEquals(WeatherCondition.CLEAR, currentWeather.conditions().condition());
        assertEquals(9, currentWeather.hourly().size());
        assertEquals(LocalDateTime.of(2024, 1, 1, 6, 0), currentWeather.hourly().get(0).time());
    }

    @Test
    public void forecastUsesTheClockForTheHourlyWindow() throws IOException {
        when(openMeteoService.fetchForecast(HANOI)).thenReturn(Optional.of(readResource("example-forecast-response.json")));

        ForecastWindow forecastWindow = weatherDashboardService.forecast(HANOI).orElseThrow();

        assertEquals(24, forecastWindow.hourly().size());
        assertEquals(LocalDateTime.of(2024, 1, 1, 6, 0), forecastWindow.hourly().get(0).time());
        assertEquals(7, forecastWindow.daily().size());
    }

    @Test
    public void historicalFormatsDailyArchive() throws IOException {
        when(openMeteoService.fetchHistorical(HANOI)).thenReturn(Optional.of(readResource("example-historical-response.json")));

        List<HistoricalPoint> points = weatherDashboardService.historical(HANOI).orElseThrow();

        assertEquals(4, points.size());
        assertEquals(15.2, points.get(0).temperature());
        assertEquals(18.0, points.get(1).temperature());
        assertEquals(23.5, points.get(2).temperature());
        assertEquals(0.0, points.get(2).precipitation());
        assertEquals(16.0, points.get(3).temperature());
    }

    @Test
    public void airQualityReadsCurrentBlock() throws IOException {
        when(openMeteoService.fetchAirQuality(HANOI)).thenReturn(Optional.of(readResource("example-air-quality-response.json")));

        AirQualityReading reading = weatherDashboardService.airQuality(HANOI).orElseThrow();

        assertEquals(48.7, reading.pm25());
        assertEquals(61.2, reading.pm10());
        assertEquals(68, reading.europeanAqi());
        assertEquals(131, reading.usAqi());
    }

    @Test
    public void missingProviderResponseIsPassedOnAsEmpty() {
        when(openMeteoService.fetchForecast(HANOI)).thenReturn(Optional.empty());
        when(openMeteoService.fetchHistorical(HANOI)).thenReturn(Optional.empty());

        assertTrue(weatherDashboardService.forecast(HANOI).isEmpty());
        assertTrue(weatherDashboardService.current(HANOI, 24).isEmpty());
        assertTrue(weatherDashboardService.historical(HANOI).isEmpty());
    }

    @Test
    public void responseWithoutSectionsGivesEmptyWindows() throws IOException {
        when(openMeteoService.fetchForecast(HANOI)).thenReturn(Optional.of(objectMapper.readTree("{}")));

        ForecastWindow forecastWindow = weatherDashboardService.forecast(HANOI).orElseThrow();
        CurrentWeather currentWeather = weatherDashboardService.current(HANOI, 24).orElseThrow();

        assertTrue(forecastWindow.isEmpty());
        assertTrue(currentWeather.hourly().isEmpty());
        assertEquals(WeatherCondition.UNKNOWN, currentWeather.conditions().condition());
        assertEquals(0.0, currentWeather.conditions().temperature());
    }
}
