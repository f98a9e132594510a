package com.phillippitts.heynova.service.fallback;

import com.phillippitts.heynova.config.answer.AnswerProperties;
import com.phillippitts.heynova.config.assistant.AssistantProperties;
import com.phillippitts.heynova.exception.BackendUnavailableException;
import com.phillippitts.heynova.util.TimeUtils;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link GenerativeAnswerBackend} for OpenAI-compatible chat completions
 * ({@code POST /v1/chat/completions}). Answers are kept to {@code answer.max-sentences}
 * sentences because they are spoken aloud.
 */
@Component
public class OpenAiAnswerBackend implements GenerativeAnswerBackend {

    private static final Logger LOG = LogManager.getLogger(OpenAiAnswerBackend.class);

    static final String COMPLETIONS_PATH = "/v1/chat/completions";
    private static final String BACKEND = "generative-answer";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final AnswerProperties props;
    private final String assistantName;
    private final OkHttpClient client;

    public OpenAiAnswerBackend(AnswerProperties props, AssistantProperties assistant, OkHttpClient baseClient) {
        this.props = Objects.requireNonNull(props);
        this.assistantName = assistant.getDisplayName();
        this.client = baseClient.newBuilder()
                .callTimeout(props.timeout())
                .build();
    }

    @Override
    public Optional<String> answer(String question) {
        if (!props.isConfigured()) {
            return Optional.empty();
        }
        Request request = new Request.Builder()
                .url(completionsUrl(props.baseUrl()))
                .header("Authorization", "Bearer " + props.apiKey())
                .post(RequestBody.create(payload(question).toString(), JSON))
                .build();

        long start = System.nanoTime();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new BackendUnavailableException(BACKEND, "HTTP " + response.code());
            }
            Optional<String> answer = parseAnswer(text);
            LOG.debug("Generative answer in {} ms (present={})", TimeUtils.elapsedMillis(start), answer.isPresent());
            return answer;
        } catch (IOException e) {
            throw new BackendUnavailableException(BACKEND, e.toString(), e);
        }
    }

    JSONObject payload(String question) {
        JSONArray messages = new JSONArray()
                .put(new JSONObject()
                        .put("role", "system")
                        .put("content", "You are " + assistantName + ", a voice assistant. Answer in at most "
                                + props.maxSentences() + " short sentences of plain text suitable for speech."))
                .put(new JSONObject()
                        .put("role", "user")
                        .put("content", question));
        return new JSONObject()
                .put("model", props.model())
                .put("messages", messages);
    }

    static Optional<String> parseAnswer(String body) {
        try {
            JSONArray choices = new JSONObject(body).optJSONArray("choices");
            if (choices == null || choices.isEmpty()) {
                return Optional.empty();
            }
            JSONObject message = choices.getJSONObject(0).optJSONObject("message");
            String content = message == null ? "" : message.optString("content", "").trim();
            return content.isEmpty() ? Optional.empty() : Optional.of(content);
        } catch (JSONException e) {
            throw new BackendUnavailableException(BACKEND, "unreadable response body", e);
        }
    }

    static String completionsUrl(String baseUrl) {
        String url = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url + COMPLETIONS_PATH;
    }
}
