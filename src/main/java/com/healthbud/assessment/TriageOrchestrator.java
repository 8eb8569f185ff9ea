package com.healthbud.assessment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.healthbud.errors.RecoverableAssessmentException;
import com.healthbud.llm.ProviderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs one assessment turn: topic gate, provider call, normalization, validation, and the
 * rule-based fallback for every failure along that chain.
 *
 * <p>{@link #assess} never throws. A disabled provider goes straight to the fallback without any
 * network call, and every failure on the provider path lands on the same fallback, so an
 * outage and a missing key produce the same answer for the same input.
 */
public class TriageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TriageOrchestrator.class);

    static final double TEMPERATURE = 0.2;
    static final int CAUSE_LOG_LIMIT = 200;

    static final List<String> DEFAULT_FOLLOW_UP_QUESTIONS = List.of(
        "When did this start, and has it been getting better, worse, or staying the same?",
        "How severe is it right now on a scale of 0 to 10?",
        "Do you have any other symptoms like fever, shortness of breath, vomiting, or dizziness?",
        "What makes it better or worse, and have you tried any treatment so far?");

    private final ProviderClient providerClient;
    private final ResponseNormalizer normalizer;
    private final AssessmentValidator validator;
    private final FallbackTriageEngine fallback;
    private final HealthTopicClassifier classifier;
    private final ObjectMapper jsonMapper;
    private final int historyWindow;

    public TriageOrchestrator(ProviderClient providerClient, ResponseNormalizer normalizer,
                              AssessmentValidator validator, FallbackTriageEngine fallback,
                              HealthTopicClassifier classifier, ObjectMapper jsonMapper, int historyWindow) {
        this.providerClient = providerClient;
        this.normalizer = normalizer;
        this.validator = validator;
        this.fallback = fallback;
        this.classifier = classifier;
        this.jsonMapper = jsonMapper;
        this.historyWindow = Math.max(0, historyWindow);
    }

    public static TriageOrchestrator create(ProviderClient providerClient, ObjectMapper jsonMapper, int historyWindow) {
        return new TriageOrchestrator(providerClient, new ResponseNormalizer(jsonMapper), new AssessmentValidator(),
            new FallbackTriageEngine(), new HealthTopicClassifier(), jsonMapper, historyWindow);
    }

    public TriageAssessment assess(TriageRequest request, List<ConversationTurn> history) {
        List<ConversationTurn> recent = recentTurns(history);
        boolean healthRelated = classifier.isHealthRelated(request, recent);

        if (!providerClient.isEnabled()) {
            return fallback.respond(request, healthRelated);
        }

        try {
            return assessWithProvider(request, recent, healthRelated);
        } catch (RecoverableAssessmentException e) {
            log.warn("LLM request failed ({}); using fallback assessment: {}",
                providerClient.provider().setting(), truncate(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {} assessment chain; using fallback assessment: {}",
                providerClient.provider().setting(), truncate(String.valueOf(e)), e);
        }
        return fallback.respond(request, healthRelated);
    }

    /**
     * Rule-based answer for the same turn, skipping the provider entirely.
     */
    public TriageAssessment fallbackAssessment(TriageRequest request, List<ConversationTurn> history) {
        return fallback.respond(request, classifier.isHealthRelated(request, recentTurns(history)));
    }

    public boolean isProviderEnabled() {
        return providerClient.isEnabled();
    }

    private TriageAssessment assessWithProvider(TriageRequest request, List<ConversationTurn> recent,
                                                boolean healthRelated) throws RecoverableAssessmentException {
        ObjectNode payload = buildPayload(request, recent);
        String raw = providerClient.generate(TriagePrompts.ASSESSMENT, payload, TEMPERATURE);

        TriageAssessment assessment = normalizer.normalize(normalizer.parse(raw), healthRelated);
        if (healthRelated && assessment.showStructuredOutput && assessment.followUpQuestions.isEmpty()) {
            assessment = assessment.toBuilder().followUpQuestions(DEFAULT_FOLLOW_UP_QUESTIONS).build();
        }

        validator.validate(assessment);
        return assessment;
    }

    ObjectNode buildPayload(TriageRequest request, List<ConversationTurn> recent) {
        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", request.message);
        payload.set("symptoms", jsonMapper.valueToTree(request.symptoms));
        if (request.patientContext != null) {
            payload.set("patient_context", jsonMapper.valueToTree(request.patientContext));
        } else {
            payload.putObject("patient_context");
        }
        payload.put("locale", request.locale);

        ArrayNode turns = payload.putArray("conversation_history");
        for (ConversationTurn turn : recent) {
            turns.add(jsonMapper.valueToTree(turn));
        }
        return payload;
    }

    private List<ConversationTurn> recentTurns(List<ConversationTurn> history) {
        if (history == null || history.isEmpty() || historyWindow == 0) {
            return List.of();
        }
        int from = Math.max(0, history.size() - historyWindow);
        return List.copyOf(history.subList(from, history.size()));
    }

    static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= CAUSE_LOG_LIMIT ? value : value.substring(0, CAUSE_LOG_LIMIT) + "...";
    }
}
