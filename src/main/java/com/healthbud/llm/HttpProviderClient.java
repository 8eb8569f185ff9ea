package com.healthbud.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthbud.errors.MalformedResponseException;
import com.healthbud.errors.ProviderDisabledException;
import com.healthbud.errors.ProviderHttpException;
import com.healthbud.errors.ProviderNetworkException;
import com.healthbud.errors.RecoverableAssessmentException;
import okhttp3.*;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Shared OkHttp plumbing for providers reached over a single JSON POST.
 *
 * <p>The call is enqueued and awaited, so interrupting the waiting thread cancels the call and
 * closes its connection instead of letting it run to completion.
 */
abstract class HttpProviderClient implements ProviderClient {

    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    protected final ProviderConfig config;
    protected final ObjectMapper jsonMapper;
    private final OkHttpClient httpClient;

    protected HttpProviderClient(ProviderConfig config, OkHttpClient baseClient,
                                 ObjectMapper jsonMapper, Duration callTimeout) {
        this.config = config;
        this.jsonMapper = jsonMapper;
        this.httpClient = baseClient.newBuilder()
            .callTimeout(callTimeout)
            .build();
    }

    @Override
    public boolean isEnabled() {
        return config.hasUsableKey();
    }

    @Override
    public final String generate(String systemPrompt, JsonNode userPayload, double temperature)
        throws RecoverableAssessmentException {
        if (!isEnabled()) {
            throw new ProviderDisabledException(provider().setting());
        }
        Request request = buildRequest(systemPrompt, userPayload, temperature);
        String body = execute(request);
        JsonNode envelope;
        try {
            envelope = jsonMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(provider().setting() + " returned a non-JSON envelope", e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new MalformedResponseException(provider().setting() + " returned an empty envelope");
        }
        return extractText(envelope);
    }

    protected abstract Request buildRequest(String systemPrompt, JsonNode userPayload, double temperature);

    /**
     * Pulls exactly one text payload out of a decoded 2xx envelope.
     */
    protected abstract String extractText(JsonNode envelope) throws MalformedResponseException;

    private String execute(Request request) throws RecoverableAssessmentException {
        String name = provider().setting();
        Call call = httpClient.newCall(request);
        CompletableFuture<String> result = new CompletableFuture<>();

        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                result.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    ResponseBody responseBody = response.body();
                    String text = responseBody != null ? responseBody.string() : "";
                    if (response.isSuccessful()) {
                        result.complete(text);
                    } else {
                        result.completeExceptionally(new ProviderHttpException(name, response.code(), text));
                    }
                } catch (IOException e) {
                    result.completeExceptionally(e);
                }
            }
        });

        try {
            return result.get();
        } catch (InterruptedException e) {
            call.cancel();
            Thread.currentThread().interrupt();
            throw new ProviderNetworkException(name, "call abandoned", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderHttpException) {
                throw (ProviderHttpException) cause;
            }
            throw new ProviderNetworkException(name, describe(cause), cause);
        }
    }

    private static String describe(Throwable cause) {
        if (cause instanceof InterruptedIOException) {
            return "timeout";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    protected static boolean hasText(JsonNode node) {
        return node != null && node.isTextual() && !node.asText().isBlank();
    }
}
