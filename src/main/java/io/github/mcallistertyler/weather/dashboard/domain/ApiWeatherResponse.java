package io.github.mcallistertyler.weather.dashboard.domain;

public record ApiWeatherResponse<T>(T data, String message, int code) {
}
