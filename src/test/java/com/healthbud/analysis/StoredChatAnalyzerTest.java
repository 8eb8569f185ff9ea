package com.healthbud.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthbud.assessment.FallbackTriageEngine;
import com.healthbud.assessment.ResponseNormalizer;
import com.healthbud.assessment.SymptomEntry;
import com.healthbud.assessment.TriagePrompts;
import com.healthbud.assessment.UrgencyLevel;
import com.healthbud.errors.ProviderNetworkException;
import com.healthbud.evidence.EvidenceSearch;
import com.healthbud.evidence.EvidenceSource;
import com.healthbud.llm.DisabledProviderClient;
import com.healthbud.llm.Provider;
import com.healthbud.llm.ProviderClient;
import com.healthbud.llm.StubProviderClient;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoredChatAnalyzerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:30:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final FallbackTriageEngine fallback = new FallbackTriageEngine();
    private final List<String> queries = new ArrayList<>();

    private final List<EvidenceSource> evidence = List.of(
        new EvidenceSource("Migraine - NHS", "https://www.nhs.uk/conditions/migraine/", "Migraine is a headache..."),
        new EvidenceSource("Fever - MedlinePlus", "https://medlineplus.gov/fever.html", "Fever is..."));

    private StoredChatAnalyzer analyzer(ProviderClient client, List<EvidenceSource> results) {
        EvidenceSearch search = query -> {
            queries.add(query);
            return results;
        };
        return new StoredChatAnalyzer(client, search, new ResponseNormalizer(mapper), fallback, mapper,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static StoredChat chat(SymptomEntry... symptoms) {
        return new StoredChat(42L, "session-9", "feeling rough", null, List.of(symptoms),
            Instant.parse("2024-06-01T12:00:00Z"));
    }

    @Test
    void queryUsesFirstFourSymptomNames() {
        analyzer(new DisabledProviderClient(Provider.DISABLED), List.of()).analyze(chat(
            SymptomEntry.of("headache", 5), SymptomEntry.of("fever", 5), SymptomEntry.of("nausea", 3),
            SymptomEntry.of("fatigue", 2), SymptomEntry.of("rash", 1)));

        assertEquals(List.of("headache fever nausea fatigue possible causes triage severity"), queries);
    }

    @Test
    void noSymptomsMeansNoSearch() {
        StoredChatAnalysis result = analyzer(StubProviderClient.returning("{}"), evidence).analyze(chat());

        assertTrue(queries.isEmpty());
        assertTrue(result.conditions.isEmpty());
        assertEquals(UrgencyLevel.LOW, result.urgencyLevel);
    }

    @Test
    void keepsOnlyConditionsCitingSuppliedEvidence() {
        StubProviderClient stub = StubProviderClient.returning("{"
            + "\"urgency_level\":\"high\","
            + "\"urgency_reason\":\"Severe headache with fever.\","
            + "\"seek_care_within\":\"Within 12 hours\","
            + "\"conditions\":["
            + "  {\"condition\":\"Migraine\",\"confidence\":0.6,\"evidence_ids\":[1],\"related_symptoms\":[\"headache\"]},"
            + "  {\"condition\":\"Meningitis\",\"confidence\":\"1.7\",\"evidence_ids\":[1,2,99]},"
            + "  {\"condition\":\"Made up\",\"confidence\":0.9,\"evidence_ids\":[7]},"
            + "  {\"condition\":\"No ids\",\"confidence\":0.9}"
            + "],"
            + "\"recommended_remedies\":[\"Rest\"]}");

        StoredChatAnalysis result = analyzer(stub, evidence).analyze(chat(SymptomEntry.of("headache", 8)));

        assertEquals(42L, result.chatNumber);
        assertEquals("session-9", result.sessionId);
        assertEquals("2024-06-01T12:30:00Z", result.analyzedAt);
        assertEquals(UrgencyLevel.HIGH, result.urgencyLevel);
        assertEquals(2, result.conditions.size());

        ConditionAnalysis migraine = result.conditions.get(0);
        assertEquals("Migraine", migraine.condition);
        assertEquals(0.6, migraine.confidence, 1e-9);
        assertEquals(List.of(evidence.get(0)), migraine.evidence);

        ConditionAnalysis meningitis = result.conditions.get(1);
        assertEquals(1.0, meningitis.confidence, 1e-9);
        assertEquals(evidence, meningitis.evidence);

        assertEquals(TriagePrompts.STORED_ANALYSIS, stub.systemPrompts.get(0));
        assertEquals(StoredChatAnalyzer.TEMPERATURE, stub.temperatures.get(0), 1e-9);
        assertEquals(2, stub.payloads.get(0).path("evidence").size());
        assertEquals(1, stub.payloads.get(0).path("evidence").path(0).path("id").asInt());
    }

    @Test
    void providerFailureUsesRuleBasedAnalysis() {
        StubProviderClient stub = StubProviderClient.failing(
            new ProviderNetworkException("gemini", "timeout", new java.io.InterruptedIOException("timeout")));
        StoredChat chat = chat(SymptomEntry.of("shortness of breath", 5));

        StoredChatAnalysis result = analyzer(stub, evidence).analyze(chat);

        assertEquals(UrgencyLevel.EMERGENCY, result.urgencyLevel);
        assertEquals(1, result.conditions.size());
        assertEquals(fallback.analyzeStored(chat, evidence, NOW).urgencyReason, result.urgencyReason);
    }

    @Test
    void disabledProviderNeverCalled() {
        StoredChat chat = chat(SymptomEntry.of("cough", 3));

        StoredChatAnalysis result = analyzer(new DisabledProviderClient(Provider.GEMINI), evidence).analyze(chat);

        assertEquals(UrgencyLevel.LOW, result.urgencyLevel);
        assertEquals(1, result.conditions.size());
    }

    @Test
    void confidenceCoercion() {
        assertEquals(StoredChatAnalyzer.DEFAULT_CONFIDENCE, StoredChatAnalyzer.confidence(null), 1e-9);
        assertEquals(StoredChatAnalyzer.DEFAULT_CONFIDENCE,
            StoredChatAnalyzer.confidence(mapper.getNodeFactory().textNode("likely")), 1e-9);
        assertEquals(0.0, StoredChatAnalyzer.confidence(mapper.getNodeFactory().numberNode(-2)), 1e-9);
        assertEquals(0.35, StoredChatAnalyzer.confidence(mapper.getNodeFactory().textNode(" 0.35 ")), 1e-9);
    }

    @Test
    void fallbackAnalysisHasNoEvidence() {
        StoredChatAnalysis result = analyzer(StubProviderClient.returning("{}"), evidence)
            .fallbackAnalysis(chat(SymptomEntry.of("headache", 7)));

        assertEquals(UrgencyLevel.HIGH, result.urgencyLevel);
        assertTrue(result.conditions.isEmpty());
    }
}
