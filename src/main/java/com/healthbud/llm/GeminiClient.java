package com.healthbud.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.healthbud.errors.MalformedResponseException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.time.Duration;

/**
 * Google Gemini generateContent client. Authenticates with the {@code key} query parameter.
 */
public class GeminiClient extends HttpProviderClient {

    public static final HttpUrl DEFAULT_BASE_URL = HttpUrl.get("https://generativelanguage.googleapis.com/");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(25);

    private final HttpUrl baseUrl;

    public GeminiClient(ProviderConfig config, OkHttpClient httpClient, ObjectMapper jsonMapper) {
        this(config, httpClient, jsonMapper, DEFAULT_BASE_URL, DEFAULT_TIMEOUT);
    }

    public GeminiClient(ProviderConfig config, OkHttpClient httpClient, ObjectMapper jsonMapper,
                        HttpUrl baseUrl, Duration callTimeout) {
        super(config, httpClient, jsonMapper, callTimeout);
        this.baseUrl = baseUrl;
    }

    @Override
    public Provider provider() {
        return Provider.GEMINI;
    }

    @Override
    protected Request buildRequest(String systemPrompt, JsonNode userPayload, double temperature) {
        ObjectNode payload = jsonMapper.createObjectNode();

        payload.putObject("systemInstruction")
            .putArray("parts").addObject().put("text", systemPrompt);

        ObjectNode content = payload.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", userPayload.toString());

        payload.putObject("generationConfig")
            .put("temperature", temperature)
            .put("responseMimeType", "application/json");

        HttpUrl url = baseUrl.newBuilder()
            .addPathSegment("v1beta")
            .addPathSegment("models")
            .addPathSegment(config.model + ":generateContent")
            .addQueryParameter("key", config.apiKey.trim())
            .build();

        return new Request.Builder()
            .url(url)
            .post(RequestBody.create(payload.toString(), JSON))
            .build();
    }

    @Override
    protected String extractText(JsonNode envelope) throws MalformedResponseException {
        JsonNode candidates = envelope.path("candidates");
        if (!candidates.isArray() || candidates.size() == 0) {
            throw new MalformedResponseException("gemini returned no candidates");
        }

        JsonNode parts = candidates.get(0).path("content").path("parts");
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        if (text.toString().isBlank()) {
            throw new MalformedResponseException("gemini returned empty content");
        }
        return text.toString();
    }
}
