package com.healthbud.errors;

/**
 * Configuration names a provider this build does not know. Not recoverable.
 */
public class UnsupportedProviderException extends IllegalArgumentException {

    public UnsupportedProviderException(String value) {
        super("Unsupported LLM provider: '" + value + "' (expected none, openrouter or gemini)");
    }
}
