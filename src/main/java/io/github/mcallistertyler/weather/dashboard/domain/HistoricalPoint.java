package io.github.mcallistertyler.weather.dashboard.domain;

import java.time.LocalDate;

public record HistoricalPoint(LocalDate date, String label, double temperature, double precipitation) {
}
