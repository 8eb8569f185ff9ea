package com.healthbud.assessment;

import com.healthbud.analysis.StoredChat;
import com.healthbud.analysis.StoredChatAnalysis;
import com.healthbud.evidence.EvidenceSource;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FallbackTriageEngineTest {

    private final FallbackTriageEngine engine = new FallbackTriageEngine();

    @Test
    void chestPainAndBreathingIsAnEmergency() {
        TriageAssessment a = engine.assess(TriageRequest.of("I have chest pain and can't breathe"));

        assertEquals(UrgencyLevel.EMERGENCY, a.urgencyLevel);
        assertTrue(a.seekCareWithin.contains("Immediately"));
        assertTrue(a.showStructuredOutput);
        assertEquals(3, a.followUpQuestions.size());
        assertEquals(FallbackTriageEngine.SAFETY_DISCLAIMER, a.safetyDisclaimer);
    }

    @Test
    void curlyApostropheMatchesToo() {
        TriageAssessment a = engine.assess(TriageRequest.of("I can\u2019t breathe properly"));

        assertEquals(UrgencyLevel.EMERGENCY, a.urgencyLevel);
    }

    @Test
    void emergencyBeatsHighRisk() {
        TriageAssessment a = engine.assess(TriageRequest.of("high fever and a seizure this morning"));

        assertEquals(UrgencyLevel.EMERGENCY, a.urgencyLevel);
    }

    @Test
    void highRiskTier() {
        TriageAssessment a = engine.assess(TriageRequest.of("Severe headache for two days"));

        assertEquals(UrgencyLevel.HIGH, a.urgencyLevel);
        assertTrue(a.seekCareWithin.startsWith("Within 4-12 hours"));
    }

    @Test
    void symptomNamesAreScannedAlongsideMessage() {
        TriageAssessment a = engine.assess(TriageRequest.of("not feeling great", SymptomEntry.of("Persistent vomiting", 6)));

        assertEquals(UrgencyLevel.HIGH, a.urgencyLevel);
    }

    @Test
    void routineTierIsMedium() {
        TriageAssessment a = engine.assess(TriageRequest.of("runny nose and sneezing"));

        assertEquals(UrgencyLevel.MEDIUM, a.urgencyLevel);
        assertEquals("Within 24-48 hours if symptoms persist or worsen.", a.seekCareWithin);
    }

    @Test
    void sameInputSameOutput() {
        TriageRequest request = TriageRequest.of("mild cough", SymptomEntry.of("cough", 2));

        assertEquals(engine.assess(request), engine.assess(request));
        assertEquals(engine.respond(request, false), engine.respond(request, false));
    }

    @Test
    void generalReplyHasNoClinicalContent() {
        TriageAssessment a = engine.generalReply(TriageRequest.of("what's the weather"));

        assertFalse(a.showStructuredOutput);
        assertEquals(UrgencyLevel.LOW, a.urgencyLevel);
        assertTrue(a.assistantMessage.contains("what's the weather"));
        assertTrue(a.followUpQuestions.isEmpty());
        assertTrue(a.possibleConditions.isEmpty());
        assertTrue(a.redFlags.isEmpty());
    }

    @Test
    void generalReplyExcerptIsBounded() {
        String longMessage = "a".repeat(500);

        TriageAssessment a = engine.generalReply(TriageRequest.of(longMessage));

        assertTrue(a.assistantMessage.contains("a".repeat(180)));
        assertFalse(a.assistantMessage.contains("a".repeat(181)));
    }

    @Test
    void storedAnalysisUsesSeverityThresholds() {
        Instant at = Instant.parse("2024-05-01T10:00:00Z");

        assertEquals(UrgencyLevel.EMERGENCY, engine.analyzeStored(chat("tired", 9), List.of(), at).urgencyLevel);
        assertEquals(UrgencyLevel.HIGH, engine.analyzeStored(chat("tired", 7), List.of(), at).urgencyLevel);
        assertEquals(UrgencyLevel.MEDIUM, engine.analyzeStored(chat("tired", 4), List.of(), at).urgencyLevel);
        assertEquals(UrgencyLevel.LOW, engine.analyzeStored(chat("tired", 2), List.of(), at).urgencyLevel);
        assertEquals(UrgencyLevel.EMERGENCY,
            engine.analyzeStored(chat("shortness of breath", 1), List.of(), at).urgencyLevel);
        assertEquals(UrgencyLevel.HIGH, engine.analyzeStored(chat("blood in stool", 1), List.of(), at).urgencyLevel);
    }

    @Test
    void storedAnalysisListsConditionOnlyWithEvidence() {
        Instant at = Instant.parse("2024-05-01T10:00:00Z");
        List<EvidenceSource> evidence = List.of(
            new EvidenceSource("A", "https://nhs.uk/a", "a"),
            new EvidenceSource("B", "https://nhs.uk/b", "b"),
            new EvidenceSource("C", "https://nhs.uk/c", "c"),
            new EvidenceSource("D", "https://nhs.uk/d", "d"));

        StoredChatAnalysis without = engine.analyzeStored(chat("tired", 3), List.of(), at);
        StoredChatAnalysis with = engine.analyzeStored(chat("tired", 3), evidence, at);

        assertTrue(without.conditions.isEmpty());
        assertEquals(1, with.conditions.size());
        assertEquals(3, with.conditions.get(0).evidence.size());
        assertEquals("2024-05-01T10:00:00Z", with.analyzedAt);
    }

    private static StoredChat chat(String symptomName, int severity) {
        return new StoredChat(7L, "s-1", "checking in", null, List.of(SymptomEntry.of(symptomName, severity)),
            Instant.parse("2024-05-01T09:00:00Z"));
    }
}
