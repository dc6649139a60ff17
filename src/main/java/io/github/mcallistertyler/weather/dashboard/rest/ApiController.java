package io.github.mcallistertyler.weather.dashboard.rest;

import io.github.mcallistertyler.weather.dashboard.domain.AirQualityReading;
import io.github.mcallistertyler.weather.dashboard.domain.ApiWeatherResponse;
import io.github.mcallistertyler.weather.dashboard.domain.Coordinates;
import io.github.mcallistertyler.weather.dashboard.domain.CurrentWeather;
import io.github.mcallistertyler.weather.dashboard.domain.ForecastWindow;
import io.github.mcallistertyler.weather.dashboard.domain.HistoricalPoint;
import io.github.mcallistertyler.weather.dashboard.service.WeatherDashboardService;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/weather")
public class ApiController {

    private static final Logger log = LoggerFactory.getLogger(ApiController.class);

    private final WeatherDashboardService weatherDashboardService;

    public ApiController(WeatherDashboardService weatherDashboardService) {
        this.weatherDashboardService = weatherDashboardService;
    }

    @GetMapping(value = "/current")
    public ResponseEntity<ApiWeatherResponse<CurrentWeather>> getCurrentWeather(
            @RequestParam(value = "lat", defaultValue = "${dashboard.default-lat}") double lat,
            @RequestParam(value = "lon", defaultValue = "${dashboard.default-lon}") double lon,
            @RequestParam(value = "hours", defaultValue = "${dashboard.hourly-limit}") int hours
    ) {
        Optional<CurrentWeather> currentWeather = weatherDashboardService.current(new Coordinates(lat, lon), hours);
        if (currentWeather.isEmpty()) {
            return noDataResponse("current", lat, lon);
        }
        return ResponseEntity.ok(new ApiWeatherResponse<>(currentWeather.get(), "OK", 200));
    }

    @GetMapping(value = "/forecast")
    public ResponseEntity<ApiWeatherResponse<ForecastWindow>> getForecast(
            @RequestParam(value = "lat", defaultValue = "${dashboard.default-lat}") double lat,
            @RequestParam(value = "lon", defaultValue = "${dashboard.default-lon}") double lon
    ) {
        Optional<ForecastWindow> forecastWindow = weatherDashboardService.forecast(new Coordinates(lat, lon));
        if (forecastWindow.isEmpty()) {
            return noDataResponse("forecast", lat, lon);
        }
        if (forecastWindow.get().isEmpty()) {
            return noContentResponse("forecast", lat, lon);
        }
        return ResponseEntity.ok(new ApiWeatherResponse<>(forecastWindow.get(), "OK", 200));
    }

    @GetMapping(value = "/historical")
    public ResponseEntity<ApiWeatherResponse<List<HistoricalPoint>>> getHistorical(
            @RequestParam(value = "lat", defaultValue = "${dashboard.default-lat}") double lat,
            @RequestParam(value = "lon", defaultValue = "${dashboard.default-lon}") double lon
    ) {
        Optional<List<HistoricalPoint>> historicalPoints = weatherDashboardService.historical(new Coordinates(lat, lon));
        if (historicalPoints.isEmpty()) {
            return noDataResponse("historical", lat, lon);
        }
        if (historicalPoints.get().isEmpty()) {
            return noContentResponse("historical", lat, lon);
        }
        return ResponseEntity.ok(new ApiWeatherResponse<>(historicalPoints.get(), "OK", 200));
    }

    @GetMapping(value = "/air-quality")
    public ResponseEntity<ApiWeatherResponse<AirQualityReading>> getAirQuality(
            @RequestParam(value = "lat", defaultValue = "${dashboard.default-lat}") double lat,
            @RequestParam(value = "lon", defaultValue = "${dashboard.default-lon}") double lon
    ) {
        Optional<AirQualityReading> airQualityReading = weatherDashboardService.airQuality(new Coordinates(lat, lon));
        if (airQualityReading.isEmpty()) {
            return noDataResponse("air quality", lat, lon);
        }
        return ResponseEntity.ok(new ApiWeatherResponse<>(airQualityReading.get(), "OK", 200));
    }

    private <T> ResponseEntity<ApiWeatherResponse<T>> noContentResponse(String kind, double lat, double lon) {
        log.error("No {} data was found for given lat/lon: {}/{}", kind, lat, lon);
        return ResponseEntity.noContent().build();
    }

    private <T> ResponseEntity<ApiWeatherResponse<T>> noDataResponse(String kind, double lat, double lon) {
        log.error("Unable to retrieve {} response from Open-Meteo for given lat/lon: {}/{}", kind, lat, lon);
        return ResponseEntity.badRequest().body(new ApiWeatherResponse<>(null, "No " + kind + " data found for given lat/lon values", 404));
    }
}
