package com.healthbud.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.healthbud.assessment.FallbackTriageEngine;
import com.healthbud.assessment.JsonFields;
import com.healthbud.assessment.ResponseNormalizer;
import com.healthbud.assessment.SymptomEntry;
import com.healthbud.assessment.TriagePrompts;
import com.healthbud.errors.RecoverableAssessmentException;
import com.healthbud.evidence.EvidenceSearch;
import com.healthbud.evidence.EvidenceSource;
import com.healthbud.llm.ProviderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Re-analyzes a stored chat against retrieved evidence.
 *
 * <p>The model path is only taken when the provider is enabled and evidence exists; its
 * conditions are kept only when they cite evidence that was actually supplied. Anything else
 * ends in {@link FallbackTriageEngine#analyzeStored}. Never throws.
 */
public class StoredChatAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(StoredChatAnalyzer.class);

    static final double TEMPERATURE = 0.1;
    static final int QUERY_SYMPTOM_LIMIT = 4;
    static final double DEFAULT_CONFIDENCE = 0.2;

    private final ProviderClient providerClient;
    private final EvidenceSearch evidenceSearch;
    private final ResponseNormalizer normalizer;
    private final FallbackTriageEngine fallback;
    private final ObjectMapper jsonMapper;
    private final Clock clock;

    public StoredChatAnalyzer(ProviderClient providerClient, EvidenceSearch evidenceSearch,
                              ResponseNormalizer normalizer, FallbackTriageEngine fallback,
                              ObjectMapper jsonMapper, Clock clock) {
        this.providerClient = providerClient;
        this.evidenceSearch = evidenceSearch;
        this.normalizer = normalizer;
        this.fallback = fallback;
        this.jsonMapper = jsonMapper;
        this.clock = clock;
    }

    public StoredChatAnalysis analyze(StoredChat chat) {
        Instant now = clock.instant();
        List<EvidenceSource> evidence = buildEvidence(chat);

        if (providerClient.isEnabled() && !evidence.isEmpty()) {
            try {
                return groundedAnalysis(chat, evidence, now);
            } catch (RecoverableAssessmentException e) {
                log.warn("Stored chat {} analysis via {} failed; using fallback: {}",
                    chat.chatNumber, providerClient.provider().setting(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected failure analyzing stored chat {}; using fallback", chat.chatNumber, e);
            }
        }
        return fallback.analyzeStored(chat, evidence, now);
    }

    /**
     * Rule-based analysis without evidence, for when {@link #analyze} could not run at all.
     */
    public StoredChatAnalysis fallbackAnalysis(StoredChat chat) {
        return fallback.analyzeStored(chat, List.of(), clock.instant());
    }

    List<EvidenceSource> buildEvidence(StoredChat chat) {
        if (chat.symptoms.isEmpty()) {
            return List.of();
        }
        String query = chat.symptoms.stream()
            .limit(QUERY_SYMPTOM_LIMIT)
            .map(s -> s.name)
            .collect(Collectors.joining(" ")) + " possible causes triage severity";
        return evidenceSearch.search(query);
    }

    private StoredChatAnalysis groundedAnalysis(StoredChat chat, List<EvidenceSource> evidence, Instant now)
        throws RecoverableAssessmentException {
        String raw = providerClient.generate(TriagePrompts.STORED_ANALYSIS, buildPayload(chat, evidence), TEMPERATURE);
        ObjectNode parsed = normalizer.parse(raw);

        List<ConditionAnalysis> conditions = new ArrayList<>();
        JsonNode items = parsed.path("conditions");
        if (items.isArray()) {
            for (JsonNode item : items) {
                List<EvidenceSource> cited = citedEvidence(item.path("evidence_ids"), evidence);
                if (cited.isEmpty()) {
                    continue;
                }
                conditions.add(new ConditionAnalysis(
                    JsonFields.textOr(item, "condition", "Unknown condition"),
                    confidence(item.get("confidence")),
                    JsonFields.textOr(item, "rationale", "Evidence suggests this may be related."),
                    JsonFields.stringList(item, "related_symptoms"),
                    JsonFields.stringList(item, "recommended_remedies"),
                    JsonFields.stringList(item, "doctor_specialties"),
                    cited));
            }
        }

        List<String> redFlags = JsonFields.stringList(parsed, "red_flags");
        if (!parsed.has("red_flags")) {
            redFlags = List.of("Worsening breathing", "Chest pain", "Fainting", "Confusion");
        }

        return new StoredChatAnalysis(
            chat.chatNumber,
            chat.sessionId,
            now.truncatedTo(ChronoUnit.MILLIS).toString(),
            JsonFields.urgency(parsed, "urgency_level"),
            JsonFields.textOr(parsed, "urgency_reason", "Urgency estimated from symptom pattern and severity."),
            JsonFields.textOr(parsed, "seek_care_within", "Within 24 hours if symptoms persist or worsen."),
            conditions,
            JsonFields.stringList(parsed, "recommended_remedies"),
            redFlags,
            JsonFields.textOr(parsed, "disclaimer",
                "AI-assisted triage is not a diagnosis. Seek in-person care for severe or worsening symptoms."));
    }

    private ObjectNode buildPayload(StoredChat chat, List<EvidenceSource> evidence) {
        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("chat_number", chat.chatNumber);
        payload.put("message", chat.message);
        if (chat.patientContext != null) {
            payload.set("patient", jsonMapper.valueToTree(chat.patientContext));
        } else {
            payload.putObject("patient");
        }

        ArrayNode symptoms = payload.putArray("symptoms");
        for (SymptomEntry symptom : chat.symptoms) {
            symptoms.add(jsonMapper.valueToTree(symptom));
        }

        ArrayNode items = payload.putArray("evidence");
        for (int i = 0; i < evidence.size(); i++) {
            EvidenceSource source = evidence.get(i);
            items.addObject()
                .put("id", i + 1)
                .put("title", source.title)
                .put("url", source.url)
                .put("snippet", source.snippet);
        }
        return payload;
    }

    /**
     * Maps 1-based integer ids onto supplied evidence, ignoring anything out of range.
     */
    static List<EvidenceSource> citedEvidence(JsonNode ids, List<EvidenceSource> evidence) {
        List<EvidenceSource> cited = new ArrayList<>();
        if (!ids.isArray()) {
            return cited;
        }
        for (JsonNode id : ids) {
            if (!id.isIntegralNumber()) {
                continue;
            }
            int index = id.asInt();
            if (index >= 1 && index <= evidence.size()) {
                cited.add(evidence.get(index - 1));
            }
        }
        return cited;
    }

    static double confidence(JsonNode value) {
        if (value == null || value.isNull()) {
            return DEFAULT_CONFIDENCE;
        }
        double score;
        if (value.isNumber()) {
            score = value.asDouble();
        } else {
            try {
                score = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return DEFAULT_CONFIDENCE;
            }
        }
        if (Double.isNaN(score)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
