package io.github.mcallistertyler.weather.dashboard.service;

import io.github.mcallistertyler.weather.dashboard.domain.AirQualityReading;
import io.github.mcallistertyler.weather.dashboard.domain.Coordinates;
import io.github.mcallistertyler.weather.dashboard.domain.CurrentWeather;
import io.github.mcallistertyler.weather.dashboard.domain.ForecastWindow;
import io.github.mcallistertyler.weather.dashboard.domain.HistoricalPoint;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class WeatherDashboardService {

    private final OpenMeteoService openMeteoService;
    private final TemporalWindower windower;
    private final CurrentSnapshotMapper snapshotMapper;
    private final Clock clock;

    public WeatherDashboardService(OpenMeteoService openMeteoService,
                                   TemporalWindower windower,
                                   CurrentSnapshotMapper snapshotMapper,
                                   Clock clock) {
        this.openMeteoService = openMeteoService;
        this.windower = windower;
        this.snapshotMapper = snapshotMapper;
        this.clock = clock;
    }

    public Optional<CurrentWeather> current(Coordinates coordinates, int hours) {
        LocalDateTime now = LocalDateTime.now(clock);
        return openMeteoService.fetchForecast(coordinates)
                .map(response -> new CurrentWeather(
                        snapshotMapper.currentConditions(response.path("current")),
                        windower.windowHourly(response.path("hourly"), now, hours)));
    }

    public Optional<ForecastWindow> forecast(Coordinates coordinates) {
        LocalDateTime now = LocalDateTime.now(clock);
        return openMeteoService.fetchForecast(coordinates)
                .map(response -> windower.window(response, now, TemporalWindower.DEFAULT_HOURLY_LIMIT));
    }

    public Optional<List<HistoricalPoint>> historical(Coordinates coordinates) {
        return openMeteoService.fetchHistorical(coordinates)
                .map(response -> windower.formatHistorical(response.path("daily")));
    }

    public Optional<AirQualityReading> airQuality(Coordinates coordinates) {
        return openMeteoService.fetchAirQuality(coordinates)
                .map(response -> snapshotMapper.airQuality(response.path("current")));
    }
}
