package com.healthbud.http;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthbud.assessment.TriageAssessment;

/**
 * ApiModels - response DTOs for the HTTP API.
 * Request bodies bind straight onto {@link com.healthbud.assessment.TriageRequest}.
 */
public final class ApiModels {

    private ApiModels() {
    }

    /**
     * ChatAssessmentResponse - one assessed turn, numbered for later re-analysis
     */
    public static final class ChatAssessmentResponse {
        @JsonProperty("chat_number") public final long chatNumber;
        @JsonProperty("session_id") public final String sessionId;
        @JsonProperty("timestamp") public final String timestamp;   // ISO-8601 UTC
        @JsonProperty("assessment") public final TriageAssessment assessment;

        @JsonCreator
        public ChatAssessmentResponse(
                @JsonProperty("chat_number") long chatNumber,
                @JsonProperty("session_id") String sessionId,
                @JsonProperty("timestamp") String timestamp,
                @JsonProperty("assessment") TriageAssessment assessment) {
            this.chatNumber = chatNumber;
            this.sessionId = sessionId;
            this.timestamp = timestamp;
            this.assessment = assessment;
        }
    }

    /**
     * ErrorResponse - body of every non-2xx reply
     */
    public static final class ErrorResponse {
        @JsonProperty("detail") public final String detail;

        @JsonCreator
        public ErrorResponse(@JsonProperty("detail") String detail) {
            this.detail = detail;
        }
    }

    public static final class HealthStatus {
        @JsonProperty("status") public final String status;

        @JsonCreator
        public HealthStatus(@JsonProperty("status") String status) {
            this.status = status;
        }
    }
}
