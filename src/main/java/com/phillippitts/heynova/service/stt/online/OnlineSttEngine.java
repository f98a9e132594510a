package com.phillippitts.heynova.service.stt.online;

import com.phillippitts.heynova.config.stt.OnlineSttProperties;
import com.phillippitts.heynova.domain.TranscriptionResult;
import com.phillippitts.heynova.exception.BackendUnavailableException;
import com.phillippitts.heynova.exception.UnintelligibleSpeechException;
import com.phillippitts.heynova.service.audio.WavWriter;
import com.phillippitts.heynova.service.stt.AbstractSttEngine;
import com.phillippitts.heynova.service.stt.SttEngineNames;
import com.phillippitts.heynova.service.stt.util.EngineEventPublisher;
import com.phillippitts.heynova.util.TimeUtils;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Online transcription backend for any Whisper-compatible server
 * ({@code POST /v1/audio/transcriptions}: OpenAI, faster-whisper, whisper.cpp server).
 *
 * <p>Failure classification:
 * <ul>
 *   <li>2xx with blank text: {@link UnintelligibleSpeechException}</li>
 *   <li>network error, timeout, non-2xx or unreadable body: {@link BackendUnavailableException}</li>
 * </ul>
 * Each call is bounded by {@code stt.online.timeout-ms}.
 */
@Component
public class OnlineSttEngine extends AbstractSttEngine {

    private static final Logger LOG = LogManager.getLogger(OnlineSttEngine.class);

    static final String TRANSCRIPTION_PATH = "/v1/audio/transcriptions";
    private static final MediaType WAV = MediaType.get("audio/wav");

    private final OnlineSttProperties props;
    private final OkHttpClient baseClient;
    private final ApplicationEventPublisher publisher;

    // @GuardedBy("lock")
    private OkHttpClient client;

    public OnlineSttEngine(OnlineSttProperties props, OkHttpClient baseClient, ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.baseClient = Objects.requireNonNull(baseClient, "baseClient");
        this.publisher = publisher;
    }

    @Override
    protected void doInitialize() {
        if (!props.isConfigured()) {
            throw new BackendUnavailableException(SttEngineNames.ONLINE, "stt.online.url is not configured");
        }
        this.client = baseClient.newBuilder()
                .callTimeout(props.timeout())
                .build();
        LOG.info("Online STT initialized: url={}, model={}, timeout={}ms",
                props.url(), props.model(), props.timeoutMs());
    }

    @Override
    public TranscriptionResult transcribe(byte[] audioData) {
        if (audioData == null || audioData.length == 0) {
            throw new IllegalArgumentException("audioData must not be null or empty");
        }
        ensureInitialized();
        OkHttpClient localClient;
        synchronized (lock) {
            localClient = this.client;
        }

        long start = System.nanoTime();
        try (Response response = localClient.newCall(buildRequest(audioData)).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new BackendUnavailableException(SttEngineNames.ONLINE,
                        "HTTP " + response.code() + " from transcription server");
            }
            String text = parseText(payload);
            LOG.debug("Online STT answered in {} ms ({} chars)", TimeUtils.elapsedMillis(start), text.length());
            if (text.isBlank()) {
                throw new UnintelligibleSpeechException(SttEngineNames.ONLINE);
            }
            return TranscriptionResult.of(text, 1.0, getEngineName());
        } catch (IOException e) {
            // includes InterruptedIOException raised by callTimeout
            EngineEventPublisher.publishFailure(publisher, SttEngineNames.ONLINE, "request failed", e,
                    Map.of("elapsedMs", String.valueOf(TimeUtils.elapsedMillis(start))));
            throw new BackendUnavailableException(SttEngineNames.ONLINE, e.toString(), e);
        } catch (BackendUnavailableException e) {
            EngineEventPublisher.publishFailure(publisher, SttEngineNames.ONLINE, e.getMessage(), e);
            throw e;
        }
    }

    private Request buildRequest(byte[] pcm) {
        RequestBody file = RequestBody.create(WavWriter.toWav(pcm), WAV);
        MultipartBody form = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", "audio.wav", file)
                .addFormDataPart("model", props.model())
                .addFormDataPart("language", props.language())
                .addFormDataPart("response_format", "json")
                .build();
        Request.Builder builder = new Request.Builder()
                .url(transcriptionUrl(props.url()))
                .post(form);
        if (!props.apiKey().isEmpty()) {
            builder.header("Authorization", "Bearer " + props.apiKey());
        }
        return builder.build();
    }

    static String transcriptionUrl(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base.endsWith(TRANSCRIPTION_PATH) ? base : base + TRANSCRIPTION_PATH;
    }

    private static String parseText(String payload) {
        if (payload == null || payload.isBlank()) {
            return "";
        }
        try {
            return new JSONObject(payload).optString("text", "").trim();
        } catch (JSONException e) {
            throw new BackendUnavailableException(SttEngineNames.ONLINE, "unreadable response body", e);
        }
    }

    @Override
    public String getEngineName() {
        return SttEngineNames.ONLINE;
    }

    @Override
    protected void doClose() {
        client = null;
        LOG.info("Online STT closed");
    }
}
