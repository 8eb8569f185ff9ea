package com.healthbud.llm;

import java.util.Locale;

final class ApiKeys {

    private ApiKeys() {
    }

    /**
     * False for missing, blank or template placeholder keys such as {@code your_api_key_here}.
     */
    static boolean isUsable(String apiKey) {
        if (apiKey == null) {
            return false;
        }
        String trimmed = apiKey.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        return !lower.startsWith("your_") && !lower.startsWith("your-") && !lower.startsWith("<");
    }
}
