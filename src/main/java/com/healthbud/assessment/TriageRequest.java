package com.healthbud.assessment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Free-text message plus structured symptom data for one assessment turn.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TriageRequest {
    public static final String DEFAULT_LOCALE = "en-NG";

    @JsonProperty("message") public final String message;
    @JsonProperty("symptoms") public final List<SymptomEntry> symptoms;
    @JsonProperty("patient_context") public final PatientContext patientContext;
    @JsonProperty("locale") public final String locale;
    @JsonProperty("session_id") public final String sessionId;

    @JsonCreator
    public TriageRequest(
            @JsonProperty("message") String message,
            @JsonProperty("symptoms") List<SymptomEntry> symptoms,
            @JsonProperty("patient_context") PatientContext patientContext,
            @JsonProperty("locale") String locale,
            @JsonProperty("session_id") String sessionId) {
        this.message = message == null ? "" : message;
        this.symptoms = Lists.copyOrEmpty(symptoms);
        this.patientContext = patientContext;
        this.locale = locale == null || locale.isBlank() ? DEFAULT_LOCALE : locale;
        this.sessionId = sessionId;
    }

    public static TriageRequest of(String message, SymptomEntry... symptoms) {
        return new TriageRequest(message, List.of(symptoms), null, null, null);
    }

    public TriageRequest withSessionId(String newSessionId) {
        return new TriageRequest(message, symptoms, patientContext, locale, newSessionId);
    }
}
