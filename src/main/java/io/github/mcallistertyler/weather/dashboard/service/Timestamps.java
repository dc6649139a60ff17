package io.github.mcallistertyler.weather.dashboard.service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Timestamps {

    private static final Logger log = LoggerFactory.getLogger(Timestamps.class);

    private Timestamps() {
    }

    public static LocalDateTime parseDateTime(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return ((ZonedDateTime) parsed).withZoneSameInstant(zone).toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeException e) {
            log.debug("Ignoring unparseable timestamp {}", text);
            return null;
        }
    }

    public static LocalDate parseDate(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeException e) {
            LocalDateTime dateTime = parseDateTime(text, zone);
            return dateTime != null ? dateTime.toLocalDate() : null;
        }
    }
}
