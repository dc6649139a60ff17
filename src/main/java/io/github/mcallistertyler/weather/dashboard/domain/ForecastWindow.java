package io.github.mcallistertyler.weather.dashboard.domain;

import com.google.common.collect.ImmutableList;
import java.util.List;

public record ForecastWindow(List<HourlySample> hourly, List<DailySample> daily) {

    public ForecastWindow {
        hourly = ImmutableList.copyOf(hourly);
        daily = ImmutableList.copyOf(daily);
    }

    public static ForecastWindow empty() {
        return new ForecastWindow(ImmutableList.of(), ImmutableList.of());
    }

    public boolean isEmpty() {
        return hourly.isEmpty() && daily.isEmpty();
    }
}
