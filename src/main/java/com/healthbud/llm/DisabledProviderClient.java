package com.healthbud.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthbud.errors.ProviderDisabledException;

/**
 * Stand-in used when no provider or no usable key is configured.
 */
public final class DisabledProviderClient implements ProviderClient {

    private final Provider configured;

    public DisabledProviderClient(Provider configured) {
        this.configured = configured;
    }

    @Override
    public Provider provider() {
        return configured;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String generate(String systemPrompt, JsonNode userPayload, double temperature)
        throws ProviderDisabledException {
        throw new ProviderDisabledException(configured.setting());
    }
}
