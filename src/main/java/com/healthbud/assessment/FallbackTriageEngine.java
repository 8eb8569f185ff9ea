package com.healthbud.assessment;

import com.healthbud.analysis.ConditionAnalysis;
import com.healthbud.analysis.StoredChat;
import com.healthbud.analysis.StoredChatAnalysis;
import com.healthbud.evidence.EvidenceSource;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Rule-based triage used whenever the model path is disabled or fails.
 *
 * <p>Pure: no I/O, no randomness. Keyword tiers are checked most severe first and the first
 * match wins, so a message carrying both an emergency and a high-risk keyword is an emergency.
 * Each tier returns a fixed bundle; nothing here is computed from medical knowledge.
 */
public class FallbackTriageEngine {

    static final List<String> EMERGENCY_TERMS = List.of(
        "chest pain", "difficulty breathing", "can't breathe", "cannot breathe", "stroke",
        "seizure", "fainted", "passed out", "bleeding heavily", "heavy bleeding");

    static final List<String> HIGH_RISK_TERMS = List.of(
        "high fever", "persistent vomiting", "severe headache", "blood pressure");

    // stored-chat analysis also watches these
    static final List<String> STORED_EMERGENCY_TERMS = List.of("shortness of breath");
    static final List<String> STORED_HIGH_RISK_TERMS = List.of("blood in stool");

    static final String SAFETY_DISCLAIMER =
        "This is decision support, not a medical diagnosis. If symptoms are severe, worsening, "
            + "or you feel unsafe, seek urgent in-person medical care immediately.";

    static final String ANALYSIS_DISCLAIMER =
        "This output is decision support, not a diagnosis. It may be incomplete without clinical examination.";

    private static final List<String> FOLLOW_UP_QUESTIONS = List.of(
        "When did each symptom start, and has it changed over time?",
        "Do you have fever, chest pain, shortness of breath, or fainting?",
        "What medications have you taken for this and did they help?");

    private static final List<String> REMEDIES = List.of(
        "Rest, hydration, and symptom monitoring.",
        "Use only previously prescribed or pharmacist-recommended over-the-counter medicine.",
        "Avoid strenuous activity until assessed if symptoms are worsening.");

    private static final List<String> RED_FLAGS = List.of(
        "Severe chest pain",
        "Difficulty breathing",
        "Confusion, fainting, or seizures",
        "Uncontrolled bleeding");

    private static final Tier EMERGENCY = new Tier(
        UrgencyLevel.EMERGENCY,
        "Possible emergency warning signs were detected in your symptoms.",
        "Immediately (call emergency services now).",
        List.of("Cardiovascular emergency", "Respiratory emergency", "Neurological emergency"),
        List.of("Emergency Medicine", "Cardiology", "Neurology"));

    private static final Tier HIGH = new Tier(
        UrgencyLevel.HIGH,
        "Potentially serious symptoms may need rapid in-person evaluation.",
        "Within 4-12 hours, preferably urgent care or ER if worsening.",
        List.of("Acute infection", "Migraine or neurological issue", "Metabolic issue"),
        List.of("Internal Medicine", "Emergency Medicine", "Neurology"));

    private static final Tier ROUTINE = new Tier(
        UrgencyLevel.MEDIUM,
        "Symptoms appear non-emergency but should still be reviewed clinically.",
        "Within 24-48 hours if symptoms persist or worsen.",
        List.of("Viral illness", "Mild gastrointestinal issue", "Stress-related symptoms"),
        List.of("General Practitioner", "Internal Medicine"));

    /**
     * Health-path assessment.
     */
    public TriageAssessment assess(TriageRequest request) {
        Tier tier = classify(haystack(request.message, request.symptoms));

        return TriageAssessment.builder()
            .assistantMessage("Thanks for sharing that. From what you described, here is what I am thinking right now. "
                + "I will keep it simple, and if your symptoms get worse I will tell you when to escalate care.")
            .showStructuredOutput(true)
            .summary("Preliminary triage generated from your message and symptom details.")
            .followUpQuestions(FOLLOW_UP_QUESTIONS)
            .possibleConditions(tier.conditions)
            .possibleRemedies(REMEDIES)
            .urgencyLevel(tier.urgency)
            .urgencyReason(tier.reason)
            .seekCareWithin(tier.seekCare)
            .redFlags(RED_FLAGS)
            .specialistTypes(tier.specialists)
            .safetyDisclaimer(SAFETY_DISCLAIMER)
            .build();
    }

    /**
     * Non-clinical reply for turns that are not about health.
     */
    public TriageAssessment generalReply(TriageRequest request) {
        String excerpt = excerpt(request.message, 180);
        return TriageAssessment.builder()
            .assistantMessage("I hear you. You said: '" + excerpt + "'. I can chat about that. "
                + "Whenever you want, share how your body feels today and I can help with a health check-in.")
            .showStructuredOutput(false)
            .summary("General conversational message received: '" + excerpt + "'.")
            .urgencyLevel(UrgencyLevel.LOW)
            .urgencyReason("No clear health-risk indicators were detected from this non-health message.")
            .seekCareWithin("Not applicable unless you have symptoms.")
            .safetyDisclaimer("For urgent or severe symptoms, seek immediate in-person medical care.")
            .build();
    }

    /**
     * Either {@link #assess} or {@link #generalReply}, by topic.
     */
    public TriageAssessment respond(TriageRequest request, boolean healthRelated) {
        return healthRelated ? assess(request) : generalReply(request);
    }

    /**
     * Stored-chat variant: keyword tiers combined with severity thresholds
     * (9+ emergency, 7+ high, 4+ medium, else low). Evidence, when present, backs a single
     * generic condition; without evidence no condition is listed.
     */
    public StoredChatAnalysis analyzeStored(StoredChat chat, List<EvidenceSource> evidence, Instant analyzedAt) {
        String text = haystack(chat.message, chat.symptoms);
        int maxSeverity = chat.maxSeverity();

        UrgencyLevel urgency;
        String reason;
        String seekCare;
        if (containsAny(text, EMERGENCY_TERMS) || containsAny(text, STORED_EMERGENCY_TERMS) || maxSeverity >= 9) {
            urgency = UrgencyLevel.EMERGENCY;
            reason = "Emergency-pattern symptoms or very high severity are present.";
            seekCare = "Immediately. Seek emergency care now.";
        } else if (containsAny(text, HIGH_RISK_TERMS) || containsAny(text, STORED_HIGH_RISK_TERMS) || maxSeverity >= 7) {
            urgency = UrgencyLevel.HIGH;
            reason = "High-risk symptom pattern or high severity suggests urgent in-person care.";
            seekCare = "Within 4-12 hours.";
        } else if (maxSeverity >= 4) {
            urgency = UrgencyLevel.MEDIUM;
            reason = "Symptoms appear moderate and should be reviewed soon.";
            seekCare = "Within 24-48 hours if not improving.";
        } else {
            urgency = UrgencyLevel.LOW;
            reason = "Symptoms currently appear mild.";
            seekCare = "Routine care if persistent or worsening.";
        }

        List<EvidenceSource> topEvidence = evidence.stream().limit(3).collect(Collectors.toList());
        List<ConditionAnalysis> conditions = topEvidence.isEmpty() ? List.of() : List.of(
            new ConditionAnalysis(
                "Possible symptom-related condition",
                0.3,
                "Based on stored symptom profile; evidence is limited.",
                chat.symptoms.stream().limit(5).map(s -> s.name).collect(Collectors.toList()),
                List.of(
                    "Rest and hydration.",
                    "Monitor symptom progression and severity.",
                    "Use only clinician- or pharmacist-approved medication."),
                List.of("General Practice", "Internal Medicine"),
                topEvidence));

        return new StoredChatAnalysis(
            chat.chatNumber,
            chat.sessionId,
            analyzedAt.truncatedTo(ChronoUnit.MILLIS).toString(),
            urgency,
            reason,
            seekCare,
            conditions,
            List.of(
                "Rest, fluids, and avoid known triggers.",
                "Track symptoms over time for clinician review.",
                "Seek urgent care if red flags appear."),
            List.of(
                "Severe chest pain",
                "Difficulty breathing",
                "Fainting or confusion",
                "Uncontrolled bleeding"),
            ANALYSIS_DISCLAIMER);
    }

    private static Tier classify(String text) {
        if (containsAny(text, EMERGENCY_TERMS)) {
            return EMERGENCY;
        }
        if (containsAny(text, HIGH_RISK_TERMS)) {
            return HIGH;
        }
        return ROUTINE;
    }

    static String haystack(String message, List<SymptomEntry> symptoms) {
        StringBuilder text = new StringBuilder(message == null ? "" : message);
        for (SymptomEntry symptom : symptoms) {
            text.append(' ').append(symptom.name);
        }
        // curly apostrophes from mobile keyboards
        return text.toString().replace('\u2019', '\'').toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, List<String> terms) {
        for (String term : terms) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }

    private static String excerpt(String message, int limit) {
        String trimmed = message == null ? "" : message.strip();
        return trimmed.length() <= limit ? trimmed : trimmed.substring(0, limit);
    }

    private static final class Tier {
        private final UrgencyLevel urgency;
        private final String reason;
        private final String seekCare;
        private final List<String> conditions;
        private final List<String> specialists;

        private Tier(UrgencyLevel urgency, String reason, String seekCare,
                     List<String> conditions, List<String> specialists) {
            this.urgency = urgency;
            this.reason = reason;
            this.seekCare = seekCare;
            this.conditions = conditions;
            this.specialists = specialists;
        }
    }
}
