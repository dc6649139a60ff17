package io.github.mcallistertyler.weather.dashboard.domain;

import com.google.common.collect.ImmutableList;
import java.util.List;

public record CurrentWeather(CurrentConditions conditions, List<HourlySample> hourly) {

    public CurrentWeather {
        hourly = ImmutableList.copyOf(hourly);
    }
}
