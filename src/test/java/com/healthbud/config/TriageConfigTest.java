package com.healthbud.config;

import com.healthbud.errors.UnsupportedProviderException;
import com.healthbud.llm.Provider;
import com.healthbud.llm.ProviderConfig;
import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriageConfigTest {

    @TempDir
    Path dir;

    private Dotenv env(String... lines) throws Exception {
        Files.write(dir.resolve("test.env"), List.of(lines));
        return Dotenv.configure().directory(dir.toString()).filename("test.env").load();
    }

    @Test
    void defaultsWhenUnset() throws Exception {
        TriageConfig config = new TriageConfig(env("LLM_PROVIDER=gemini"));

        assertEquals(Provider.GEMINI, config.provider);
        assertEquals(6, config.historyWindow);
        assertEquals(20, config.assessRateLimitPerMin);
        assertEquals(10, config.analyzeRateLimitPerMin);
        assertEquals(TriageConfig.DEFAULT_TRUSTED_DOMAINS, config.trustedMedicalDomains);
        assertEquals("gemini-1.5-flash", config.geminiModel);
    }

    @Test
    void readsOpenRouterSettings() throws Exception {
        TriageConfig config = new TriageConfig(env(
            "LLM_PROVIDER=OpenRouter",
            "OPENROUTER_API_KEY=sk-or-abc123",
            "OPENROUTER_MODEL=meta/llama-3",
            "CHAT_HISTORY_WINDOW=4",
            "CHAT_ASSESS_RATE_LIMIT_PER_MIN=0",
            "ENABLE_WEB_SEARCH=false",
            "TRUSTED_MEDICAL_DOMAINS= nhs.uk , ,cdc.gov",
            "HTTP_PORT=9090"));

        assertEquals(Provider.OPENROUTER, config.provider);
        assertEquals(4, config.historyWindow);
        assertEquals(0, config.assessRateLimitPerMin);
        assertFalse(config.webSearchEnabled);
        assertEquals(List.of("nhs.uk", "cdc.gov"), config.trustedMedicalDomains);
        assertEquals(9090, config.httpPort);

        ProviderConfig provider = config.providerConfig();
        assertEquals(Provider.OPENROUTER, provider.provider);
        assertEquals("meta/llama-3", provider.model);
        assertTrue(provider.hasUsableKey());
        assertFalse(provider.toString().contains("sk-or-abc123"));
    }

    @Test
    void noneDisablesProvider() throws Exception {
        TriageConfig config = new TriageConfig(env("LLM_PROVIDER=none"));

        assertEquals(Provider.DISABLED, config.providerConfig().provider);
    }

    @Test
    void unknownProviderFailsAtStartup() throws Exception {
        Dotenv env = env("LLM_PROVIDER=anthropic-direct");

        assertThrows(UnsupportedProviderException.class, () -> new TriageConfig(env));
    }
}
