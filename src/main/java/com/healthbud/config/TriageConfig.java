package com.healthbud.config;

import com.healthbud.llm.Provider;
import com.healthbud.llm.ProviderConfig;
import io.github.cdimascio.dotenv.Dotenv;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * TriageConfig - application settings from .env and the process environment.
 * Read once at startup.
 */
public class TriageConfig {
    public static final List<String> DEFAULT_TRUSTED_DOMAINS = List.of(
        "mayoclinic.org", "medlineplus.gov", "nhs.uk", "who.int", "cdc.gov",
        "clevelandclinic.org", "webmd.com");

    public final Provider provider;
    public final String openRouterApiKey;
    public final String openRouterModel;
    public final String openRouterSiteUrl;
    public final String openRouterAppName;
    public final String geminiApiKey;
    public final String geminiModel;

    public final int historyWindow;             // prior turns sent to the model
    public final int assessRateLimitPerMin;     // 0 disables
    public final int analyzeRateLimitPerMin;    // 0 disables

    public final boolean webSearchEnabled;
    public final int webSearchMaxResults;
    public final List<String> trustedMedicalDomains;

    public final String httpHost;
    public final int httpPort;

    public TriageConfig() {
        this(Dotenv.configure().ignoreIfMissing().load());
    }

    public TriageConfig(Dotenv d) {
        this.provider = Provider.fromSetting(d.get("LLM_PROVIDER", "gemini"));
        this.openRouterApiKey = d.get("OPENROUTER_API_KEY");
        this.openRouterModel = d.get("OPENROUTER_MODEL", "openai/gpt-4o-mini");
        this.openRouterSiteUrl = d.get("OPENROUTER_SITE_URL", "http://localhost:8080");
        this.openRouterAppName = d.get("OPENROUTER_APP_NAME", "HealthBud");
        this.geminiApiKey = d.get("GEMINI_API_KEY");
        this.geminiModel = d.get("GEMINI_MODEL", "gemini-1.5-flash");

        this.historyWindow = Integer.parseInt(d.get("CHAT_HISTORY_WINDOW", "6"));
        this.assessRateLimitPerMin = Integer.parseInt(d.get("CHAT_ASSESS_RATE_LIMIT_PER_MIN", "20"));
        this.analyzeRateLimitPerMin = Integer.parseInt(d.get("CHAT_ANALYZE_RATE_LIMIT_PER_MIN", "10"));

        this.webSearchEnabled = Boolean.parseBoolean(d.get("ENABLE_WEB_SEARCH", "true"));
        this.webSearchMaxResults = Integer.parseInt(d.get("WEB_SEARCH_MAX_RESULTS", "8"));
        String domains = d.get("TRUSTED_MEDICAL_DOMAINS");
        this.trustedMedicalDomains = domains == null || domains.isBlank()
            ? DEFAULT_TRUSTED_DOMAINS
            : Arrays.stream(domains.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableList());

        this.httpHost = d.get("HTTP_HOST", "localhost");
        this.httpPort = Integer.parseInt(d.get("HTTP_PORT", "8080"));
    }

    /**
     * Credentials and model for the selected provider only.
     */
    public ProviderConfig providerConfig() {
        switch (provider) {
            case OPENROUTER:
                return new ProviderConfig(provider, openRouterApiKey, openRouterModel,
                    openRouterSiteUrl, openRouterAppName);
            case GEMINI:
                return new ProviderConfig(provider, geminiApiKey, geminiModel, null, null);
            default:
                return ProviderConfig.disabled();
        }
    }

    @Override
    public String toString() {
        return String.format("TriageConfig{provider=%s, historyWindow=%d, assessLimit=%d/min, analyzeLimit=%d/min, "
                + "webSearch=%s, maxResults=%d, http=%s:%d}",
            provider, historyWindow, assessRateLimitPerMin, analyzeRateLimitPerMin,
            webSearchEnabled, webSearchMaxResults, httpHost, httpPort);
    }
}
