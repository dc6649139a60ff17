package io.github.mcallistertyler.weather.dashboard.domain;

import java.time.LocalDateTime;

public record CurrentConditions(
        LocalDateTime time,
        double temperature,
        Double feelsLike,
        double humidity,
        double windSpeed,
        WeatherCondition condition
) {
}
