package io.github.mcallistertyler.weather.dashboard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.google.common.collect.ImmutableList;
import io.github.mcallistertyler.weather.dashboard.domain.DailySample;
import io.github.mcallistertyler.weather.dashboard.domain.ForecastWindow;
import io.github.mcallistertyler.weather.dashboard.domain.HistoricalPoint;
import io.github.mcallistertyler.weather.dashboard.domain.HourlySample;
import io.github.mcallistertyler.weather.dashboard.domain.Quantity;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class TemporalWindower {

    public static final int DEFAULT_HOURLY_LIMIT = 24;

    private static final double NO_VALUE = 0.0;

    private final FieldResolver fieldResolver;
    private final WeatherConditionClassifier classifier;
    private final ZoneId referenceZone;

    public TemporalWindower(FieldResolver fieldResolver,
                            WeatherConditionClassifier classifier,
                            ZoneId referenceZone) {
        this.fieldResolver = fieldResolver;
        this.classifier = classifier;
        this.referenceZone = referenceZone;
    }

    public ForecastWindow window(JsonNode response, LocalDateTime now, int limit) {
        if (response == null) {
            return ForecastWindow.empty();
        }
        return new ForecastWindow(
                windowHourly(response.path("hourly"), now, limit),
                windowDaily(response.path("daily")));
    }

    public List<HourlySample> windowHourly(JsonNode hourly, LocalDateTime now) {
        return windowHourly(hourly, now, DEFAULT_HOURLY_LIMIT);
    }

    public List<HourlySample> windowHourly(JsonNode hourly, LocalDateTime now, int limit) {
        JsonNode times = timeArray(hourly);
        if (times.isEmpty() || limit <= 0) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<HourlySample> samples = ImmutableList.builder();
        int selected = 0;
        for (int i = 0; i < times.size() && selected < limit; i++) {
            LocalDateTime time = Timestamps.parseDateTime(times.get(i).asText(null), referenceZone);
            if (time == null || !isAfterCurrentHour(time, now)) {
                continue;
            }
            samples.add(hourlySample(hourly, i, time));
            selected++;
        }
        return samples.build();
    }

    public List<DailySample> windowDaily(JsonNode daily) {
        JsonNode times = timeArray(daily);
        ImmutableList.Builder<DailySample> samples = ImmutableList.builder();
        for (int i = 0; i < times.size(); i++) {
            LocalDate date = Timestamps.parseDate(times.get(i).asText(null), referenceZone);
            if (date != null) {
                samples.add(dailySample(daily, i, date));
            }
        }
        return samples.build();
    }

    public List<HistoricalPoint> formatHistorical(JsonNode daily) {
        JsonNode times = timeArray(daily);
        ImmutableList.Builder<HistoricalPoint> points = ImmutableList.builder();
        for (int i = 0; i < times.size(); i++) {
            LocalDate date = Timestamps.parseDate(times.get(i).asText(null), referenceZone);
            if (date == null) {
                continue;
            }
            Double temperature = fieldResolver.resolve(Quantity.MIN_TEMPERATURE, daily, i, null);
            if (temperature == null) {
                temperature = fieldResolver.resolve(Quantity.MEAN_TEMPERATURE, daily, i, null);
            }
            if (temperature == null) {
                temperature = fieldResolver.resolve(Quantity.MAX_TEMPERATURE, daily, i, NO_VALUE);
            }
            double precipitation = fieldResolver.resolve(Quantity.PRECIPITATION_SUM, daily, i, NO_VALUE);
            points.add(new HistoricalPoint(date, weekdayLabel(date), temperature, precipitation));
        }
        return points.build();
    }

    // Day of month only; the month is not compared.
    static boolean isAfterCurrentHour(LocalDateTime time, LocalDateTime now) {
        return time.getHour() > now.getHour() || time.getDayOfMonth() > now.getDayOfMonth();
    }

    private HourlySample hourlySample(JsonNode hourly, int i, LocalDateTime time) {
        return new HourlySample(
                time,
                fieldResolver.resolve(Quantity.TEMPERATURE, hourly, i, NO_VALUE),
                fieldResolver.resolve(Quantity.FEELS_LIKE, hourly, i, null),
                fieldResolver.resolve(Quantity.HUMIDITY, hourly, i, NO_VALUE),
                fieldResolver.resolve(Quantity.WIND_SPEED, hourly, i, NO_VALUE),
                fieldResolver.resolve(Quantity.PRECIPITATION_AMOUNT, hourly, i, NO_VALUE),
                fieldResolver.resolve(Quantity.PRECIPITATION_PROBABILITY, hourly, i, NO_VALUE),
                classifier.classify(fieldResolver.resolveInt(Quantity.WEATHER_CODE, hourly, i, null)));
    }

    private DailySample dailySample(JsonNode daily, int i, LocalDate date) {
        Double min = fieldResolver.resolve(Quantity.MIN_TEMPERATURE, daily, i, null);
        Double max = fieldResolver.resolve(Quantity.MAX_TEMPERATURE, daily, i, null);
        return new DailySample(
                date,
                min != null ? min : NO_VALUE,
                max != null ? max : NO_VALUE,
                mean(min, max),
                fieldResolver.resolve(Quantity.HUMIDITY, daily, i, NO_VALUE),
                fieldResolver.resolve(Quantity.WIND_SPEED, daily, i, NO_VALUE),
                fieldResolver.resolve(Quantity.PRECIPITATION_AMOUNT, daily, i, NO_VALUE),
                fieldResolver.resolve(Quantity.PRECIPITATION_PROBABILITY, daily, i, NO_VALUE),
                Timestamps.parseDateTime(fieldResolver.resolveText(Quantity.SUNRISE, daily, i, null), referenceZone),
                Timestamps.parseDateTime(fieldResolver.resolveText(Quantity.SUNSET, daily, i, null), referenceZone),
                classifier.classify(fieldResolver.resolveInt(Quantity.WEATHER_CODE, daily, i, null)));
    }

    private static double mean(Double min, Double max) {
        if (min != null && max != null) {
            return (min + max) / 2;
        }
        if (min != null) {
            return min;
        }
        return max != null ? max : NO_VALUE;
    }

    private static JsonNode timeArray(JsonNode section) {
        if (section == null) {
            return MissingNode.getInstance();
        }
        JsonNode times = section.path("time");
        return times.isArray() ? times : MissingNode.getInstance();
    }

    private static String weekdayLabel(LocalDate date) {
        return date.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.US);
    }
}
