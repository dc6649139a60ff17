package io.github.mcallistertyler.weather.dashboard.service;

import static io.github.mcallistertyler.weather.dashboard.domain.WeatherCondition.CLEAR;
import static io.github.mcallistertyler.weather.dashboard.domain.WeatherCondition.CLOUDY;
import static io.github.mcallistertyler.weather.dashboard.domain.WeatherCondition.DRIZZLE;
import static io.github.mcallistertyler.weather.dashboard.domain.WeatherCondition.RAIN;
import static io.github.mcallistertyler.weather.dashboard.domain.WeatherCondition.SHOWERS;
import static io.github.mcallistertyler.weather.dashboard.domain.WeatherCondition.SNOW;
import static io.github.mcallistertyler.weather.dashboard.domain.WeatherCondition.THUNDER;
import static io.github.mcallistertyler.weather.dashboard.domain.WeatherCondition.UNKNOWN;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableRangeMap;
import com.google.common.collect.Range;
import io.github.mcallistertyler.weather.dashboard.domain.WeatherCondition;
import org.springframework.stereotype.Component;

@Component
public class WeatherConditionClassifier {

    private static final ImmutableMap<Integer, WeatherCondition> KNOWN_CODES =
            ImmutableMap.<Integer, WeatherCondition>builder()
                    .put(0, CLEAR)
                    .put(1, CLEAR)
                    .put(2, CLEAR)
                    .put(3, CLEAR)
                    .put(45, CLOUDY)
                    .put(48, CLOUDY)
                    .put(51, DRIZZLE)
                    .put(53, DRIZZLE)
                    .put(55, DRIZZLE)
                    .put(61, RAIN)
                    .put(63, RAIN)
                    .put(65, RAIN)
                    .put(71, SNOW)
                    .put(73, SNOW)
                    .put(75, SNOW)
                    .put(77, SNOW)
                    .put(80, SHOWERS)
                    .put(81, SHOWERS)
                    .put(82, SHOWERS)
                    .put(85, SNOW)
                    .put(86, SNOW)
                    .put(95, THUNDER)
                    .put(96, THUNDER)
                    .put(99, THUNDER)
                    .build();

    // Upper bounds are inclusive.
    private static final ImmutableRangeMap<Integer, WeatherCondition> CODE_BANDS =
            ImmutableRangeMap.<Integer, WeatherCondition>builder()
                    .put(Range.closed(0, 3), CLEAR)
                    .put(Range.closed(4, 49), CLOUDY)
                    .put(Range.closed(50, 59), DRIZZLE)
                    .put(Range.closed(60, 69), RAIN)
                    .put(Range.closed(70, 79), SNOW)
                    .put(Range.closed(80, 82), SHOWERS)
                    .put(Range.closed(83, 86), SNOW)
                    .put(Range.closed(87, 99), THUNDER)
                    .build();

    public WeatherCondition classify(Integer code) {
        if (code == null) {
            return UNKNOWN;
        }
        WeatherCondition known = KNOWN_CODES.get(code);
        if (known != null) {
            return known;
        }
        WeatherCondition banded = CODE_BANDS.get(code);
        return banded != null ? banded : UNKNOWN;
    }

    static ImmutableMap<Integer, WeatherCondition> knownCodes() {
        return KNOWN_CODES;
    }

    static WeatherCondition band(int code) {
        WeatherCondition banded = CODE_BANDS.get(code);
        return banded != null ? banded : UNKNOWN;
    }
}
