package io.github.mcallistertyler.weather.dashboard;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WeatherDashboardApplicationConfig {

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Bean
    public ZoneId referenceZone(@Value("${dashboard.timezone}") String timezone) {
        return ZoneId.of(timezone);
    }

    @Bean
    public Clock clock(ZoneId referenceZone) {
        return Clock.system(referenceZone);
    }
}
