package com.healthbud.llm;

import java.util.Objects;

/**
 * Provider selection and credentials, read once at startup.
 */
public final class ProviderConfig {
    public final Provider provider;
    public final String apiKey;
    public final String model;
    public final String siteUrl;      // OpenRouter HTTP-Referer
    public final String appName;      // OpenRouter X-Title

    public ProviderConfig(Provider provider, String apiKey, String model, String siteUrl, String appName) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.apiKey = apiKey;
        this.model = model;
        this.siteUrl = siteUrl;
        this.appName = appName;
    }

    public static ProviderConfig disabled() {
        return new ProviderConfig(Provider.DISABLED, null, null, null, null);
    }

    public boolean hasUsableKey() {
        return ApiKeys.isUsable(apiKey);
    }

    @Override
    public String toString() {
        return String.format("ProviderConfig{provider=%s, model='%s', apiKey=%s}",
            provider, model, hasUsableKey() ? "present" : "missing");
    }
}
