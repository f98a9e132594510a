package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.config.skills.SkillProperties;
import com.phillippitts.heynova.exception.BackendUnavailableException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link WeatherClient} for the OpenWeatherMap current weather API
 * ({@code GET /data/2.5/weather?q=<city>&units=metric&appid=<key>}).
 */
@Component
public class OpenWeatherMapClient implements WeatherClient {

    private static final Logger LOG = LogManager.getLogger(OpenWeatherMapClient.class);
    private static final String BACKEND = "weather";

    private final SkillProperties props;
    private final OkHttpClient client;

    public OpenWeatherMapClient(SkillProperties props, OkHttpClient baseClient) {
        this.props = Objects.requireNonNull(props);
        this.client = baseClient.newBuilder()
                .callTimeout(props.httpTimeout())
                .build();
    }

    @Override
    public Optional<WeatherReport> currentWeather(String city) {
        HttpUrl base = HttpUrl.parse(props.getWeatherUrl());
        if (base == null) {
            throw new BackendUnavailableException(BACKEND, "invalid skills.weather-url");
        }
        HttpUrl url = base.newBuilder()
                .addQueryParameter("q", city)
                .addQueryParameter("units", "metric")
                .addQueryParameter("appid", props.getWeatherApiKey())
                .build();
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = client.newCall(request).execute()) {
            if (response.code() == 404) {
                LOG.info("Weather service does not know city '{}'", city);
                return Optional.empty();
            }
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new BackendUnavailableException(BACKEND, "HTTP " + response.code());
            }
            return Optional.of(parse(payload, city));
        } catch (IOException e) {
            throw new BackendUnavailableException(BACKEND, e.toString(), e);
        }
    }

    static WeatherReport parse(String payload, String requestedCity) {
        try {
            JSONObject obj = new JSONObject(payload);
            String description = obj.getJSONArray("weather").getJSONObject(0).optString("description", "").trim();
            double temperature = obj.getJSONObject("main").getDouble("temp");
            String name = obj.optString("name", "");
            return new WeatherReport(name.isBlank() ? requestedCity : name,
                    description.isEmpty() ? "unknown conditions" : description, temperature);
        } catch (JSONException e) {
            throw new BackendUnavailableException(BACKEND, "unreadable response body", e);
        }
    }
}
