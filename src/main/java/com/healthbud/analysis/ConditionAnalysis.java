package com.healthbud.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthbud.evidence.EvidenceSource;

import java.util.List;

/**
 * One candidate condition backed by at least one evidence item.
 */
public final class ConditionAnalysis {
    @JsonProperty("condition") public final String condition;
    @JsonProperty("confidence") public final double confidence;   // 0..1
    @JsonProperty("rationale") public final String rationale;
    @JsonProperty("related_symptoms") public final List<String> relatedSymptoms;
    @JsonProperty("recommended_remedies") public final List<String> recommendedRemedies;
    @JsonProperty("doctor_specialties") public final List<String> doctorSpecialties;
    @JsonProperty("evidence") public final List<EvidenceSource> evidence;

    public ConditionAnalysis(String condition, double confidence, String rationale,
                             List<String> relatedSymptoms, List<String> recommendedRemedies,
                             List<String> doctorSpecialties, List<EvidenceSource> evidence) {
        this.condition = condition;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.rationale = rationale;
        this.relatedSymptoms = List.copyOf(relatedSymptoms);
        this.recommendedRemedies = List.copyOf(recommendedRemedies);
        this.doctorSpecialties = List.copyOf(doctorSpecialties);
        this.evidence = List.copyOf(evidence);
    }
}
