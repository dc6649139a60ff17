package io.github.mcallistertyler.weather.dashboard.domain;

import java.time.LocalDateTime;

public record AirQualityReading(
        LocalDateTime time,
        double pm25,
        double pm10,
        Integer europeanAqi,
        Integer usAqi
) {
}
