package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.config.skills.SkillProperties;
import com.phillippitts.heynova.exception.BackendUnavailableException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link TranslationClient} for the MyMemory API
 * ({@code GET /get?q=<text>&langpair=en|<code>}), which needs no api key.
 */
@Component
public class MyMemoryTranslationClient implements TranslationClient {

    private static final String BACKEND = "translation";

    private final SkillProperties props;
    private final OkHttpClient client;

    public MyMemoryTranslationClient(SkillProperties props, OkHttpClient baseClient) {
        this.props = Objects.requireNonNull(props);
        this.client = baseClient.newBuilder()
                .callTimeout(props.httpTimeout())
                .build();
    }

    @Override
    public String translate(String text, String targetLanguage) {
        HttpUrl base = HttpUrl.parse(props.getTranslationUrl());
        if (base == null) {
            throw new BackendUnavailableException(BACKEND, "invalid skills.translation-url");
        }
        HttpUrl url = base.newBuilder()
                .addQueryParameter("q", text)
                .addQueryParameter("langpair", "en|" + targetLanguage)
                .build();
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new BackendUnavailableException(BACKEND, "HTTP " + response.code());
            }
            return parse(payload);
        } catch (IOException e) {
            throw new BackendUnavailableException(BACKEND, e.toString(), e);
        }
    }

    static String parse(String payload) {
        try {
            JSONObject obj = new JSONObject(payload);
            // MyMemory reports quota and argument errors in-band with HTTP 200
            int status = obj.optInt("responseStatus", 200);
            if (status != 200) {
                throw new BackendUnavailableException(BACKEND, "responseStatus " + status);
            }
            String translated = obj.getJSONObject("responseData").optString("translatedText", "").trim();
            if (translated.isEmpty()) {
                throw new BackendUnavailableException(BACKEND, "empty translation");
            }
            return translated;
        } catch (JSONException e) {
            throw new BackendUnavailableException(BACKEND, "unreadable response body", e);
        }
    }
}
