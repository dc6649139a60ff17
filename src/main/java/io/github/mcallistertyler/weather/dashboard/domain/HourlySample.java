package io.github.mcallistertyler.weather.dashboard.domain;

import java.time.LocalDateTime;

public record HourlySample(
        LocalDateTime time,
        double temperature,
        Double feelsLike,
        double humidity,
        double windSpeed,
        double precipitationAmount,
        double precipitationProbability,
        WeatherCondition condition
) {
}
