package com.healthbud.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.healthbud.errors.RecoverableAssessmentException;

/**
 * One structured generation request against one configured provider.
 * Implementations make a single attempt per call and never retry.
 */
public interface ProviderClient {

    Provider provider();

    /**
     * @return false when no usable API key is configured; callers must not call {@link #generate}
     */
    boolean isEnabled();

    /**
     * Sends the prompt and returns the raw text the model produced.
     *
     * @param systemPrompt instructions for the model
     * @param userPayload  structured request, sent as a JSON string
     * @param temperature  sampling temperature
     * @throws RecoverableAssessmentException on HTTP, network or envelope failures
     */
    String generate(String systemPrompt, JsonNode userPayload, double temperature)
        throws RecoverableAssessmentException;
}
