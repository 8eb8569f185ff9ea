package com.healthbud.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the {@link ProviderClient} implementation once, at construction time.
 */
public final class ProviderClients {

    private static final Logger log = LoggerFactory.getLogger(ProviderClients.class);

    private ProviderClients() {
    }

    public static ProviderClient create(ProviderConfig config, OkHttpClient httpClient, ObjectMapper jsonMapper) {
        if (config.provider == Provider.DISABLED) {
            log.info("LLM provider disabled, all assessments use the rule-based engine");
            return new DisabledProviderClient(Provider.DISABLED);
        }
        if (!config.hasUsableKey()) {
            log.warn("LLM provider {} has no usable API key, all assessments use the rule-based engine",
                config.provider.setting());
            return new DisabledProviderClient(config.provider);
        }

        log.info("LLM provider {} enabled with model {}", config.provider.setting(), config.model);
        switch (config.provider) {
            case OPENROUTER:
                return new OpenRouterClient(config, httpClient, jsonMapper);
            case GEMINI:
                return new GeminiClient(config, httpClient, jsonMapper);
            default:
                throw new IllegalStateException("No client for provider " + config.provider);
        }
    }
}
