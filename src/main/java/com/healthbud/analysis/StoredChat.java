package com.healthbud.analysis;

import com.healthbud.assessment.PatientContext;
import com.healthbud.assessment.SymptomEntry;
import com.healthbud.assessment.TriageRequest;

import java.time.Instant;
import java.util.List;

/**
 * An assessed turn as kept by the chat store, the input to re-analysis.
 */
public final class StoredChat {
    public final long chatNumber;
    public final String sessionId;
    public final String message;
    public final PatientContext patientContext;
    public final List<SymptomEntry> symptoms;
    public final Instant createdAt;

    public StoredChat(long chatNumber, String sessionId, String message, PatientContext patientContext,
                      List<SymptomEntry> symptoms, Instant createdAt) {
        this.chatNumber = chatNumber;
        this.sessionId = sessionId;
        this.message = message == null ? "" : message;
        this.patientContext = patientContext;
        this.symptoms = symptoms == null ? List.of() : List.copyOf(symptoms);
        this.createdAt = createdAt;
    }

    public static StoredChat from(long chatNumber, TriageRequest request, Instant createdAt) {
        return new StoredChat(chatNumber, request.sessionId, request.message, request.patientContext,
            request.symptoms, createdAt);
    }

    public int maxSeverity() {
        int max = 0;
        for (SymptomEntry symptom : symptoms) {
            max = Math.max(max, symptom.severity);
        }
        return max;
    }
}
