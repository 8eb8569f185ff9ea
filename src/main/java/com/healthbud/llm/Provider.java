package com.healthbud.llm;

import com.healthbud.errors.UnsupportedProviderException;

import java.util.Locale;

/**
 * LLM providers this service can talk to. Chosen once from configuration.
 */
public enum Provider {
    DISABLED("none"),
    OPENROUTER("openrouter"),
    GEMINI("gemini");

    private final String setting;

    Provider(String setting) {
        this.setting = setting;
    }

    public String setting() {
        return setting;
    }

    /**
     * Maps the LLM_PROVIDER setting. Blank, "none" and "disabled" select {@link #DISABLED}.
     *
     * @throws UnsupportedProviderException for any other unknown value
     */
    public static Provider fromSetting(String value) {
        if (value == null || value.isBlank()) {
            return DISABLED;
        }
        String candidate = value.trim().toLowerCase(Locale.ROOT);
        switch (candidate) {
            case "none":
            case "disabled":
                return DISABLED;
            case "openrouter":
                return OPENROUTER;
            case "gemini":
                return GEMINI;
            default:
                throw new UnsupportedProviderException(value);
        }
    }
}
