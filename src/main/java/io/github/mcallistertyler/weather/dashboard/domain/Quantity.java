package io.github.mcallistertyler.weather.dashboard.domain;

import com.google.common.collect.ImmutableList;
import java.util.List;

public enum Quantity {
    TEMPERATURE("temperature_2m", "temperature"),
    FEELS_LIKE("apparent_temperature", "apparentTemperature"),
    HUMIDITY("relative_humidity_2m", "humidity"),
    WIND_SPEED("wind_speed_10m", "wind_speed"),
    PRECIPITATION_AMOUNT("precipitation", "precipitation_sum"),
    PRECIPITATION_PROBABILITY("precipitation_probability", "precipitation_probability_max"),
    WEATHER_CODE("weather_code", "weathercode"),
    MIN_TEMPERATURE("temperature_2m_min"),
    MAX_TEMPERATURE("temperature_2m_max"),
    MEAN_TEMPERATURE("temperature_2m_mean"),
    PRECIPITATION_SUM("precipitation_sum"),
    SUNRISE("sunrise"),
    SUNSET("sunset"),
    PM2_5("pm2_5", "pm25"),
    PM10("pm10"),
    EUROPEAN_AQI("european_aqi"),
    US_AQI("us_aqi");

    private final ImmutableList<String> aliases;

    Quantity(String... aliases) {
        this.aliases = ImmutableList.copyOf(aliases);
    }

    public List<String> aliases() {
        return aliases;
    }
}
