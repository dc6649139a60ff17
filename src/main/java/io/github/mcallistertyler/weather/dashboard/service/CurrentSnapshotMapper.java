package io.github.mcallistertyler.weather.dashboard.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.mcallistertyler.weather.dashboard.domain.AirQualityReading;
import io.github.mcallistertyler.weather.dashboard.domain.CurrentConditions;
import io.github.mcallistertyler.weather.dashboard.domain.Quantity;
import java.time.ZoneId;
import org.springframework.stereotype.Component;

@Component
public class CurrentSnapshotMapper {

    private final FieldResolver fieldResolver;
    private final WeatherConditionClassifier classifier;
    private final ZoneId referenceZone;

    public CurrentSnapshotMapper(FieldResolver fieldResolver,
                                 WeatherConditionClassifier classifier,
                                 ZoneId referenceZone) {
        this.fieldResolver = fieldResolver;
        this.classifier = classifier;
        this.referenceZone = referenceZone;
    }

    public CurrentConditions currentConditions(JsonNode current) {
        return new CurrentConditions(
                Timestamps.parseDateTime(timeOf(current), referenceZone),
                fieldResolver.resolveCurrent(Quantity.TEMPERATURE, current, 0.0),
                fieldResolver.resolveCurrent(Quantity.FEELS_LIKE, current, null),
                fieldResolver.resolveCurrent(Quantity.HUMIDITY, current, 0.0),
                fieldResolver.resolveCurrent(Quantity.WIND_SPEED, current, 0.0),
                classifier.classify(fieldResolver.resolveCurrentInt(Quantity.WEATHER_CODE, current, null)));
    }

    public AirQualityReading airQuality(JsonNode current) {
        return new AirQualityReading(
                Timestamps.parseDateTime(timeOf(current), referenceZone),
                fieldResolver.resolveCurrent(Quantity.PM2_5, current, 0.0),
                fieldResolver.resolveCurrent(Quantity.PM10, current, 0.0),
                fieldResolver.resolveCurrentInt(Quantity.EUROPEAN_AQI, current, null),
                fieldResolver.resolveCurrentInt(Quantity.US_AQI, current, null));
    }

    private static String timeOf(JsonNode current) {
        if (current == null) {
            return null;
        }
        JsonNode time = current.path("time");
        return time.isTextual() ? time.asText() : null;
    }
}
