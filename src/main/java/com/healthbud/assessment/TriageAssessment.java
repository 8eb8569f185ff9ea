package com.healthbud.assessment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * The single output shape of both the model path and the rule-based path.
 * Callers cannot tell which path produced an instance.
 */
public final class TriageAssessment {
    @JsonProperty("assistant_message") public final String assistantMessage;
    @JsonProperty("show_structured_output") public final boolean showStructuredOutput;
    @JsonProperty("summary") public final String summary;
    @JsonProperty("follow_up_questions") public final List<String> followUpQuestions;
    @JsonProperty("possible_conditions") public final List<String> possibleConditions;
    @JsonProperty("possible_remedies") public final List<String> possibleRemedies;
    @JsonProperty("urgency_level") public final UrgencyLevel urgencyLevel;
    @JsonProperty("urgency_reason") public final String urgencyReason;
    @JsonProperty("seek_care_within") public final String seekCareWithin;
    @JsonProperty("red_flags") public final List<String> redFlags;
    @JsonProperty("specialist_types") public final List<String> specialistTypes;
    @JsonProperty("safety_disclaimer") public final String safetyDisclaimer;

    @JsonCreator
    public TriageAssessment(
            @JsonProperty("assistant_message") String assistantMessage,
            @JsonProperty("show_structured_output") boolean showStructuredOutput,
            @JsonProperty("summary") String summary,
            @JsonProperty("follow_up_questions") List<String> followUpQuestions,
            @JsonProperty("possible_conditions") List<String> possibleConditions,
            @JsonProperty("possible_remedies") List<String> possibleRemedies,
            @JsonProperty("urgency_level") UrgencyLevel urgencyLevel,
            @JsonProperty("urgency_reason") String urgencyReason,
            @JsonProperty("seek_care_within") String seekCareWithin,
            @JsonProperty("red_flags") List<String> redFlags,
            @JsonProperty("specialist_types") List<String> specialistTypes,
            @JsonProperty("safety_disclaimer") String safetyDisclaimer) {
        this.assistantMessage = assistantMessage;
        this.showStructuredOutput = showStructuredOutput;
        this.summary = summary;
        this.followUpQuestions = Lists.copyOrEmpty(followUpQuestions);
        this.possibleConditions = Lists.copyOrEmpty(possibleConditions);
        this.possibleRemedies = Lists.copyOrEmpty(possibleRemedies);
        this.urgencyLevel = urgencyLevel;
        this.urgencyReason = urgencyReason;
        this.seekCareWithin = seekCareWithin;
        this.redFlags = Lists.copyOrEmpty(redFlags);
        this.specialistTypes = Lists.copyOrEmpty(specialistTypes);
        this.safetyDisclaimer = safetyDisclaimer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .assistantMessage(assistantMessage)
            .showStructuredOutput(showStructuredOutput)
            .summary(summary)
            .followUpQuestions(followUpQuestions)
            .possibleConditions(possibleConditions)
            .possibleRemedies(possibleRemedies)
            .urgencyLevel(urgencyLevel)
            .urgencyReason(urgencyReason)
            .seekCareWithin(seekCareWithin)
            .redFlags(redFlags)
            .specialistTypes(specialistTypes)
            .safetyDisclaimer(safetyDisclaimer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TriageAssessment)) return false;
        TriageAssessment that = (TriageAssessment) o;
        return showStructuredOutput == that.showStructuredOutput
            && Objects.equals(assistantMessage, that.assistantMessage)
            && Objects.equals(summary, that.summary)
            && followUpQuestions.equals(that.followUpQuestions)
            && possibleConditions.equals(that.possibleConditions)
            && possibleRemedies.equals(that.possibleRemedies)
            && urgencyLevel == that.urgencyLevel
            && Objects.equals(urgencyReason, that.urgencyReason)
            && Objects.equals(seekCareWithin, that.seekCareWithin)
            && redFlags.equals(that.redFlags)
            && specialistTypes.equals(that.specialistTypes)
            && Objects.equals(safetyDisclaimer, that.safetyDisclaimer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assistantMessage, showStructuredOutput, summary, followUpQuestions,
            possibleConditions, possibleRemedies, urgencyLevel, urgencyReason, seekCareWithin,
            redFlags, specialistTypes, safetyDisclaimer);
    }

    @Override
    public String toString() {
        return String.format("TriageAssessment{urgency=%s, structured=%s, summary='%s'}",
            urgencyLevel, showStructuredOutput, summary);
    }

    public static final class Builder {
        private String assistantMessage;
        private boolean showStructuredOutput = true;
        private String summary;
        private List<String> followUpQuestions = List.of();
        private List<String> possibleConditions = List.of();
        private List<String> possibleRemedies = List.of();
        private UrgencyLevel urgencyLevel = UrgencyLevel.MEDIUM;
        private String urgencyReason;
        private String seekCareWithin;
        private List<String> redFlags = List.of();
        private List<String> specialistTypes = List.of();
        private String safetyDisclaimer;

        private Builder() {
        }

        public Builder assistantMessage(String value) { this.assistantMessage = value; return this; }
        public Builder showStructuredOutput(boolean value) { this.showStructuredOutput = value; return this; }
        public Builder summary(String value) { this.summary = value; return this; }
        public Builder followUpQuestions(List<String> value) { this.followUpQuestions = value; return this; }
        public Builder possibleConditions(List<String> value) { this.possibleConditions = value; return this; }
        public Builder possibleRemedies(List<String> value) { this.possibleRemedies = value; return this; }
        public Builder urgencyLevel(UrgencyLevel value) { this.urgencyLevel = value; return this; }
        public Builder urgencyReason(String value) { this.urgencyReason = value; return this; }
        public Builder seekCareWithin(String value) { this.seekCareWithin = value; return this; }
        public Builder redFlags(List<String> value) { this.redFlags = value; return this; }
        public Builder specialistTypes(List<String> value) { this.specialistTypes = value; return this; }
        public Builder safetyDisclaimer(String value) { this.safetyDisclaimer = value; return this; }

        public TriageAssessment build() {
            return new TriageAssessment(assistantMessage, showStructuredOutput, summary,
                followUpQuestions, possibleConditions, possibleRemedies, urgencyLevel,
                urgencyReason, seekCareWithin, redFlags, specialistTypes, safetyDisclaimer);
        }
    }
}
