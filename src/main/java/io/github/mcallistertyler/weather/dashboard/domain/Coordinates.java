package io.github.mcallistertyler.weather.dashboard.domain;

public record Coordinates(double lat, double lon) {

    public Coordinates {
        lat = roundTwoDecimals(lat);
        lon = roundTwoDecimals(lon);
    }

    private static double roundTwoDecimals(double position) {
        return Math.round(position * 100.0) / 100.0;
    }
}
