package com.healthbud.assessment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.healthbud.errors.MalformedResponseException;

import java.util.List;

/**
 * Turns raw model text into a {@link TriageAssessment}.
 */
public class ResponseNormalizer {

    static final String DEFAULT_ASSISTANT_MESSAGE = "I am here to help. Tell me what you are feeling today.";
    static final String DEFAULT_SUMMARY = "AI triage assessment generated.";
    static final String DEFAULT_URGENCY_REASON = "Estimated from symptoms and available context.";
    static final String DEFAULT_SEEK_CARE = "Within 24-48 hours if symptoms persist or worsen.";
    static final String DEFAULT_DISCLAIMER =
        "This is not a medical diagnosis. Seek urgent care for severe or worsening symptoms.";

    static final String NON_HEALTH_URGENCY_REASON = "No health symptoms were provided in this message.";
    static final String NON_HEALTH_SEEK_CARE = "Not applicable unless you develop symptoms.";

    private final LenientJsonParser parser;
    private final SecondPersonRewriter rewriter;

    public ResponseNormalizer(ObjectMapper jsonMapper) {
        this(new LenientJsonParser(jsonMapper), new SecondPersonRewriter());
    }

    public ResponseNormalizer(LenientJsonParser parser, SecondPersonRewriter rewriter) {
        this.parser = parser;
        this.rewriter = rewriter;
    }

    public ObjectNode parse(String rawText) throws MalformedResponseException {
        return parser.parse(rawText).value;
    }

    public ParseOutcome parseWithStage(String rawText) throws MalformedResponseException {
        return parser.parse(rawText);
    }

    /**
     * Coerces a parsed object into the output schema. Non-health turns are reduced to a plain
     * conversational reply with no clinical content.
     */
    public TriageAssessment normalize(JsonNode parsed, boolean healthRelated) throws MalformedResponseException {
        if (parsed == null || !parsed.isObject()) {
            throw new MalformedResponseException("Model response must be a JSON object");
        }

        String summary = JsonFields.text(parsed, "summary");
        String assistantMessage = JsonFields.text(parsed, "assistant_message");
        if (assistantMessage == null) {
            assistantMessage = summary != null ? summary : DEFAULT_ASSISTANT_MESSAGE;
        }

        TriageAssessment.Builder builder = TriageAssessment.builder()
            .assistantMessage(assistantMessage)
            .showStructuredOutput(true)
            .summary(summary != null ? summary : DEFAULT_SUMMARY)
            .followUpQuestions(JsonFields.stringList(parsed, "follow_up_questions"))
            .possibleConditions(JsonFields.stringList(parsed, "possible_conditions"))
            .possibleRemedies(JsonFields.stringList(parsed, "possible_remedies"))
            .urgencyLevel(JsonFields.urgency(parsed, "urgency_level"))
            .urgencyReason(JsonFields.textOr(parsed, "urgency_reason", DEFAULT_URGENCY_REASON))
            .seekCareWithin(JsonFields.textOr(parsed, "seek_care_within", DEFAULT_SEEK_CARE))
            .redFlags(JsonFields.stringList(parsed, "red_flags"))
            .specialistTypes(JsonFields.stringList(parsed, "specialist_types"))
            .safetyDisclaimer(JsonFields.textOr(parsed, "safety_disclaimer", DEFAULT_DISCLAIMER));

        if (!healthRelated) {
            builder.showStructuredOutput(false)
                .urgencyLevel(UrgencyLevel.LOW)
                .urgencyReason(NON_HEALTH_URGENCY_REASON)
                .seekCareWithin(NON_HEALTH_SEEK_CARE)
                .followUpQuestions(List.of())
                .possibleConditions(List.of())
                .possibleRemedies(List.of())
                .redFlags(List.of())
                .specialistTypes(List.of());
        }

        return rewriter.rewrite(builder.build());
    }

    /**
     * {@link #parse} followed by {@link #normalize}.
     */
    public TriageAssessment normalizeText(String rawText, boolean healthRelated) throws MalformedResponseException {
        return normalize(parse(rawText), healthRelated);
    }
}
