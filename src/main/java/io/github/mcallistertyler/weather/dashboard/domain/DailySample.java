package io.github.mcallistertyler.weather.dashboard.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record DailySample(
        LocalDate date,
        double minTemperature,
        double maxTemperature,
        double meanTemperature,
        double humidity,
        double windSpeed,
        double precipitationAmount,
        double precipitationProbability,
        LocalDateTime sunrise,
        LocalDateTime sunset,
        WeatherCondition condition
) {
}
