package com.healthbud.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthbud.assessment.UrgencyLevel;

import java.util.List;

/**
 * Evidence-grounded re-analysis of a stored chat.
 */
public final class StoredChatAnalysis {
    @JsonProperty("chat_number") public final long chatNumber;
    @JsonProperty("session_id") public final String sessionId;
    @JsonProperty("analyzed_at") public final String analyzedAt;   // ISO-8601 UTC
    @JsonProperty("urgency_level") public final UrgencyLevel urgencyLevel;
    @JsonProperty("urgency_reason") public final String urgencyReason;
    @JsonProperty("seek_care_within") public final String seekCareWithin;
    @JsonProperty("conditions") public final List<ConditionAnalysis> conditions;
    @JsonProperty("recommended_remedies") public final List<String> recommendedRemedies;
    @JsonProperty("red_flags") public final List<String> redFlags;
    @JsonProperty("disclaimer") public final String disclaimer;

    public StoredChatAnalysis(long chatNumber, String sessionId, String analyzedAt, UrgencyLevel urgencyLevel,
                              String urgencyReason, String seekCareWithin, List<ConditionAnalysis> conditions,
                              List<String> recommendedRemedies, List<String> redFlags, String disclaimer) {
        this.chatNumber = chatNumber;
        this.sessionId = sessionId;
        this.analyzedAt = analyzedAt;
        this.urgencyLevel = urgencyLevel;
        this.urgencyReason = urgencyReason;
        this.seekCareWithin = seekCareWithin;
        this.conditions = List.copyOf(conditions);
        this.recommendedRemedies = List.copyOf(recommendedRemedies);
        this.redFlags = List.copyOf(redFlags);
        this.disclaimer = disclaimer;
    }
}
