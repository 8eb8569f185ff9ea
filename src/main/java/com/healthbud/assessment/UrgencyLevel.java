package com.healthbud.assessment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum UrgencyLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    EMERGENCY("emergency");

    private final String token;

    UrgencyLevel(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    @JsonCreator
    public static UrgencyLevel fromToken(String value) {
        return parseToken(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown urgency level: " + value));
    }

    /**
     * Exact token match after trimming and lower-casing.
     */
    public static Optional<UrgencyLevel> parseToken(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.trim().toLowerCase(Locale.ROOT);
        for (UrgencyLevel level : values()) {
            if (level.token.equals(candidate)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Buckets a 0-10 style score: 8+ emergency, 6+ high, 3+ medium, else low.
     */
    public static UrgencyLevel fromScore(double score) {
        if (score >= 8) return EMERGENCY;
        if (score >= 6) return HIGH;
        if (score >= 3) return MEDIUM;
        return LOW;
    }
}
