package com.healthbud.assessment;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a turn is about health. Attached symptoms always count; otherwise the
 * message and recent user turns are scanned for health keywords anywhere in the text, so
 * "seasick" and "breathing" both count.
 */
public class HealthTopicClassifier {

    static final List<String> HEALTH_TERMS = List.of(
        "pain", "fever", "cough", "vomit", "nausea", "headache", "dizzy",
        "breath", "chest", "doctor", "symptom", "sick", "ill");

    public boolean isHealthRelated(TriageRequest request, List<ConversationTurn> history) {
        if (!request.symptoms.isEmpty()) {
            return true;
        }

        StringBuilder text = new StringBuilder(request.message);
        if (history != null) {
            for (ConversationTurn turn : history) {
                text.append(' ').append(turn.userMessage);
            }
        }
        String haystack = text.toString().toLowerCase(Locale.ROOT);
        return HEALTH_TERMS.stream().anyMatch(haystack::contains);
    }
}
