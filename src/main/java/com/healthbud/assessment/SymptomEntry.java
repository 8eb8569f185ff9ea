package com.healthbud.assessment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One reported symptom with its optional structured attributes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SymptomEntry {
    @JsonProperty("name") public final String name;
    @JsonProperty("severity") public final int severity;              // 0-10
    @JsonProperty("symptom_started_at") public final String startedAt; // ISO-8601 as sent
    @JsonProperty("body_location") public final String bodyLocation;
    @JsonProperty("character") public final String character;
    @JsonProperty("aggravating_factors") public final List<String> aggravatingFactors;
    @JsonProperty("radiation") public final String radiation;
    @JsonProperty("duration_pattern") public final String durationPattern;
    @JsonProperty("timing_pattern") public final String timingPattern;
    @JsonProperty("relieving_factors") public final List<String> relievingFactors;
    @JsonProperty("associated_symptoms") public final List<String> associatedSymptoms;
    @JsonProperty("progression") public final String progression;
    @JsonProperty("is_constant") public final Boolean constant;
    @JsonProperty("duration_hours") public final Integer durationHours;
    @JsonProperty("notes") public final String notes;

    @JsonCreator
    public SymptomEntry(
            @JsonProperty("name") String name,
            @JsonProperty("severity") int severity,
            @JsonProperty("symptom_started_at") String startedAt,
            @JsonProperty("body_location") String bodyLocation,
            @JsonProperty("character") String character,
            @JsonProperty("aggravating_factors") List<String> aggravatingFactors,
            @JsonProperty("radiation") String radiation,
            @JsonProperty("duration_pattern") String durationPattern,
            @JsonProperty("timing_pattern") String timingPattern,
            @JsonProperty("relieving_factors") List<String> relievingFactors,
            @JsonProperty("associated_symptoms") List<String> associatedSymptoms,
            @JsonProperty("progression") String progression,
            @JsonProperty("is_constant") Boolean constant,
            @JsonProperty("duration_hours") Integer durationHours,
            @JsonProperty("notes") String notes) {
        this.name = name == null ? "" : name.trim();
        this.severity = Math.max(0, Math.min(10, severity));
        this.startedAt = startedAt;
        this.bodyLocation = bodyLocation;
        this.character = character;
        this.aggravatingFactors = Lists.copyOrEmpty(aggravatingFactors);
        this.radiation = radiation;
        this.durationPattern = durationPattern;
        this.timingPattern = timingPattern;
        this.relievingFactors = Lists.copyOrEmpty(relievingFactors);
        this.associatedSymptoms = Lists.copyOrEmpty(associatedSymptoms);
        this.progression = progression;
        this.constant = constant;
        this.durationHours = durationHours;
        this.notes = notes;
    }

    public static SymptomEntry of(String name, int severity) {
        return new SymptomEntry(name, severity, null, null, null, null, null, null, null,
            null, null, null, null, null, null);
    }
}
