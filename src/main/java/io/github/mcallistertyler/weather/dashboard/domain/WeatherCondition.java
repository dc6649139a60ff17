package io.github.mcallistertyler.weather.dashboard.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonFormat(shape = JsonFormat.Shape.OBJECT)
public enum WeatherCondition {
    CLEAR("wb_sunny", "Clear"),
    CLOUDY("cloud", "Cloudy"),
    DRIZZLE("grain", "Drizzle"),
    RAIN("rainy", "Rain"),
    SNOW("ac_unit", "Snow"),
    SHOWERS("rainy", "Showers"),
    THUNDER("thunderstorm", "Thunder"),
    UNKNOWN("help_outline", "Unknown");

    private final String icon;
    private final String label;

    WeatherCondition(String icon, String label) {
        this.icon = icon;
        this.label = label;
    }

    @JsonProperty("icon")
    public String icon() {
        return icon;
    }

    @JsonProperty("label")
    public String label() {
        return label;
    }
}
