package io.github.mcallistertyler.weather.dashboard.rest;

import com.google.common.collect.ImmutableList;
import io.github.mcallistertyler.weather.dashboard.domain.AirQualityReading;
import io.github.mcallistertyler.weather.dashboard.domain.Coordinates;
import io.github.mcallistertyler.weather.dashboard.domain.CurrentConditions;
import io.github.mcallistertyler.weather.dashboard.domain.CurrentWeather;
import io.github.mcallistertyler.weather.dashboard.domain.DailySample;
import io.github.mcallistertyler.weather.dashboard.domain.ForecastWindow;
import io.github.mcallistertyler.weather.dashboard.domain.HistoricalPoint;
import io.github.mcallistertyler.weather.dashboard.domain.HourlySample;
import io.github.mcallistertyler.weather.dashboard.domain.WeatherCondition;
import io.github.mcallistertyler.weather.dashboard.service.WeatherDashboardService;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;


import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ApiController.class)
public class ApiControllerTest {

    private static final Coordinates HANOI = new Coordinates(21.03, 105.85);

    @MockBean
    private WeatherDashboardService weatherDashboardService;

    @Autowired
    private MockMvc mockMvc;

    private HourlySample hourlySample(int hour) {
        return new HourlySample(LocalDateTime.of(2024, 1, 1, hour, 0), 21.0, null, 76, 7.4, 0.0, 18, WeatherCondition.SHOWERS);
    }

    @Test
    public void currentWeatherUsesDefaultLocationAndLimit() throws Exception {
        CurrentConditions conditions = new CurrentConditions(
                LocalDateTime.of(2024, 1, 1, 5, 30), 19.4, 18.9, 82, 6.1, WeatherCondition.CLEAR);
        when(weatherDashboardService.current(HANOI, 24))
                .thenReturn(Optional.of(new CurrentWeather(conditions, List.of(hourlySample(6), hourlySample(7)))));

        mockMvc.perform(get("/weather/current"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.conditions.temperature").value(19.4))
                .andExpect(jsonPath("$.data.conditions.condition.label").value("Clear"))
                .andExpect(jsonPath("$.data.hourly.length()").value(2))
                .andExpect(jsonPath("$.data.hourly[0].time").value(startsWith("2024-01-01T06:00")))
                .andExpect(jsonPath("$.data.hourly[0].condition.icon").value("rainy"));
    }

    @Test
    public void currentWeatherPassesRequestedHours() throws Exception {
        Coordinates oslo = new Coordinates(59.91, 10.75);
        when(weatherDashboardService.current(oslo, 9)).thenReturn(Optional.empty());

        mockMvc.perform(get("/weather/current").param("lat", "59.911").param("lon", "10.750").param("hours", "9"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(404));
        verify(weatherDashboardService).current(oslo, 9);
    }

    @Test
    public void forecastReturnsHourlyAndDailySeries() throws Exception {
        DailySample day = new DailySample(LocalDate.of(2024, 1, 1), 10, 20, 15, 0, 3.2, 1.5, 40,
                LocalDateTime.of(2024, 1, 1, 6, 34), null, WeatherCondition.RAIN);
        when(weatherDashboardService.forecast(HANOI))
                .thenReturn(Optional.of(new ForecastWindow(List.of(hourlySample(6)), List.of(day))));

        mockMvc.perform(get("/weather/forecast"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.hourly.length()").value(1))
                .andExpect(jsonPath("$.data.daily[0].date").value("2024-01-01"))
                .andExpect(jsonPath("$.data.daily[0].meanTemperature").value(15.0))
                .andExpect(jsonPath("$.data.daily[0].condition.label").value("Rain"));
    }

    @Test
    public void emptyForecastIsNoContent() throws Exception {
        when(weatherDashboardService.forecast(HANOI)).thenReturn(Optional.of(ForecastWindow.empty()));

        mockMvc.perform(get("/weather/forecast"))
                .andExpect(status().isNoContent());
    }

    @Test
    public void historicalReturnsChartPoints() throws Exception {
        when(weatherDashboardService.historical(HANOI))
                .thenReturn(Optional.of(ImmutableList.of(new HistoricalPoint(LocalDate.of(2023, 12, 28), "Thu", 15.2, 0.0))));

        mockMvc.perform(get("/weather/historical"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].label").value("Thu"))
                .andExpect(jsonPath("$.data[0].temperature").value(15.2));
    }

    @Test
    public void missingHistoricalDataIsBadRequest() throws Exception {
        when(weatherDashboardService.historical(HANOI)).thenReturn(Optional.empty());

        mockMvc.perform(get("/weather/historical"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No historical data found for given lat/lon values"));
    }

    @Test
    public void airQualityReturnsReading() throws Exception {
        when(weatherDashboardService.airQuality(HANOI))
                .thenReturn(Optional.of(new AirQualityReading(LocalDateTime.of(2024, 1, 1, 5, 0), 48.7, 61.2, 68, null)));

        mockMvc.perform(get("/weather/air-quality"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pm25").value(48.7))
                .andExpect(jsonPath("$.data.europeanAqi").value(68));
    }
}
