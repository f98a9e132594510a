package com.phillippitts.heynova.config.skills;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Typed properties for the built-in skills and the services they call.
 *
 * <p>Example application.properties:
 * <pre>
 * skills.weather-api-key=${WEATHER_API_KEY:}
 * skills.websites.youtube=https://www.youtube.com
 * skills.applications.calculator=/System/Applications/Calculator.app
 * </pre>
 *
 * Weather is only registered when an api key is present. Applications are only launchable
 * when their configured path exists.
 */
@Validated
@ConfigurationProperties(prefix = "skills")
public class SkillProperties {

    static final Map<String, String> DEFAULT_WEBSITES = defaultWebsites();

    private final String weatherApiKey;
    private final String weatherUrl;
    private final String translationUrl;
    private final String searchUrl;
    private final Map<String, String> websites;
    private final Map<String, String> applications;

    @Min(500)
    @Max(60_000)
    private final int httpTimeoutMs;

    @ConstructorBinding
    public SkillProperties(String weatherApiKey,
                           String weatherUrl,
                           String translationUrl,
                           String searchUrl,
                           Map<String, String> websites,
                           Map<String, String> applications,
                           Integer httpTimeoutMs) {
        this.weatherApiKey = weatherApiKey == null ? "" : weatherApiKey.trim();
        this.weatherUrl = (weatherUrl == null || weatherUrl.isBlank())
                ? "https://api.openweathermap.org/data/2.5/weather" : weatherUrl.trim();
        this.translationUrl = translationUrl == null ? "https://api.mymemory.translated.net/get" : translationUrl.trim();
        this.searchUrl = (searchUrl == null || searchUrl.isBlank())
                ? "https://www.google.com/search?q=" : searchUrl.trim();
        this.websites = lowerCaseKeys(websites == null || websites.isEmpty() ? DEFAULT_WEBSITES : websites);
        this.applications = lowerCaseKeys(applications == null ? Map.of() : applications);
        this.httpTimeoutMs = httpTimeoutMs == null ? 8_000 : httpTimeoutMs;
    }

    private static Map<String, String> defaultWebsites() {
        Map<String, String> sites = new LinkedHashMap<>();
        sites.put("youtube", "https://www.youtube.com");
        sites.put("google", "https://www.google.com");
        sites.put("github", "https://github.com");
        sites.put("wikipedia", "https://www.wikipedia.org");
        sites.put("stack overflow", "https://stackoverflow.com");
        sites.put("gmail", "https://mail.google.com");
        return Map.copyOf(sites);
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> source) {
        Map<String, String> out = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (k != null && v != null && !v.isBlank()) {
                out.put(k.trim().toLowerCase(Locale.ROOT), v.trim());
            }
        });
        return Map.copyOf(out);
    }

    public String getWeatherApiKey() {
        return weatherApiKey;
    }

    public boolean isWeatherConfigured() {
        return !weatherApiKey.isEmpty();
    }

    public String getWeatherUrl() {
        return weatherUrl;
    }

    public String getTranslationUrl() {
        return translationUrl;
    }

    public boolean isTranslationConfigured() {
        return !translationUrl.isEmpty();
    }

    public String getSearchUrl() {
        return searchUrl;
    }

    public Map<String, String> getWebsites() {
        return websites;
    }

    public Map<String, String> getApplications() {
        return applications;
    }

    public int getHttpTimeoutMs() {
        return httpTimeoutMs;
    }

    public Duration httpTimeout() {
        return Duration.ofMillis(httpTimeoutMs);
    }
}
