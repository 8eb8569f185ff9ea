package com.healthbud.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.healthbud.errors.MalformedResponseException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.time.Duration;

/**
 * OpenRouter chat-completions client.
 */
public class OpenRouterClient extends HttpProviderClient {

    public static final HttpUrl DEFAULT_ENDPOINT = HttpUrl.get("https://openrouter.ai/api/v1/chat/completions");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(45);

    private final HttpUrl endpoint;

    public OpenRouterClient(ProviderConfig config, OkHttpClient httpClient, ObjectMapper jsonMapper) {
        this(config, httpClient, jsonMapper, DEFAULT_ENDPOINT, DEFAULT_TIMEOUT);
    }

    public OpenRouterClient(ProviderConfig config, OkHttpClient httpClient, ObjectMapper jsonMapper,
                            HttpUrl endpoint, Duration callTimeout) {
        super(config, httpClient, jsonMapper, callTimeout);
        this.endpoint = endpoint;
    }

    @Override
    public Provider provider() {
        return Provider.OPENROUTER;
    }

    @Override
    protected Request buildRequest(String systemPrompt, JsonNode userPayload, double temperature) {
        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("model", config.model);
        payload.put("temperature", temperature);

        ArrayNode messages = payload.putArray("messages");
        messages.addObject()
            .put("role", "system")
            .put("content", systemPrompt);
        messages.addObject()
            .put("role", "user")
            .put("content", userPayload.toString());

        payload.putObject("response_format").put("type", "json_object");

        Request.Builder builder = new Request.Builder()
            .url(endpoint)
            .header("Authorization", "Bearer " + config.apiKey.trim())
            .post(RequestBody.create(payload.toString(), JSON));
        if (config.siteUrl != null && !config.siteUrl.isBlank()) {
            builder.header("HTTP-Referer", config.siteUrl);
        }
        if (config.appName != null && !config.appName.isBlank()) {
            builder.header("X-Title", config.appName);
        }
        return builder.build();
    }

    /**
     * Accepts, in order: a plain content string, a list of content parts, or the argument
     * string of the first tool call.
     */
    @Override
    protected String extractText(JsonNode envelope) throws MalformedResponseException {
        JsonNode message = envelope.path("choices").path(0).path("message");

        JsonNode content = message.path("content");
        if (hasText(content)) {
            return content.asText();
        }

        if (content.isArray()) {
            StringBuilder joined = new StringBuilder();
            for (JsonNode part : content) {
                if (part.isTextual()) {
                    joined.append(part.asText());
                } else if (part.path("text").isTextual()) {
                    joined.append(part.path("text").asText());
                }
            }
            if (!joined.toString().isBlank()) {
                return joined.toString();
            }
        }

        JsonNode arguments = message.path("tool_calls").path(0).path("function").path("arguments");
        if (hasText(arguments)) {
            return arguments.asText();
        }

        String error = envelope.path("error").path("message").asText("");
        throw new MalformedResponseException("openrouter returned no usable content"
            + (error.isEmpty() ? "" : ": " + error));
    }
}
