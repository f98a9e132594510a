package com.phillippitts.heynova.config.http;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared infrastructure beans.
 *
 * <p>One {@link OkHttpClient} owns the connection pool and dispatcher; each HTTP collaborator
 * derives its own client with {@code newBuilder().callTimeout(...)} so every call is bounded
 * by that collaborator's configured timeout.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(30))
                .writeTimeout(Duration.ofSeconds(30))
                .retryOnConnectionFailure(false)
                .build();
    }

    /** Wall clock for the time and date skills; replaced by a fixed clock in tests. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
