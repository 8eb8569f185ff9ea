package com.healthbud.assessment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthbud.errors.ProviderHttpException;
import com.healthbud.errors.SchemaValidationException;
import com.healthbud.llm.DisabledProviderClient;
import com.healthbud.llm.GeminiClient;
import com.healthbud.llm.Provider;
import com.healthbud.llm.ProviderClient;
import com.healthbud.llm.ProviderConfig;
import com.healthbud.llm.StubProviderClient;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriageOrchestratorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final FallbackTriageEngine fallback = new FallbackTriageEngine();

    private TriageOrchestrator orchestrator(ProviderClient client) {
        return TriageOrchestrator.create(client, mapper, 6);
    }

    @Test
    void disabledProviderUsesFallbackWithoutCallingOut() {
        TriageOrchestrator disabled = orchestrator(new DisabledProviderClient(Provider.DISABLED));
        TriageRequest request = TriageRequest.of("I have chest pain and can't breathe");

        TriageAssessment a = disabled.assess(request, List.of());

        assertEquals(fallback.assess(request), a);
        assertEquals(UrgencyLevel.EMERGENCY, a.urgencyLevel);
        assertTrue(a.seekCareWithin.contains("Immediately"));
    }

    @Test
    void timeoutGivesSameAnswerAsDisabledProvider() throws Exception {
        TriageRequest request = TriageRequest.of("I have chest pain and can't breathe");
        TriageAssessment expected = orchestrator(new DisabledProviderClient(Provider.DISABLED)).assess(request, List.of());

        MockWebServer server = new MockWebServer();
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        server.start();
        try {
            GeminiClient slow = new GeminiClient(
                new ProviderConfig(Provider.GEMINI, "AIza-test", "gemini-1.5-flash", null, null),
                new OkHttpClient(), mapper, server.url("/"), Duration.ofMillis(300));

            assertEquals(expected, orchestrator(slow).assess(request, List.of()));
        } finally {
            server.shutdown();
        }
    }

    @Test
    void httpErrorFallsBack() {
        TriageRequest request = TriageRequest.of("persistent vomiting since last night");
        StubProviderClient failing = StubProviderClient.failing(new ProviderHttpException("gemini", 500, "boom"));

        TriageAssessment a = orchestrator(failing).assess(request, List.of());

        assertEquals(fallback.assess(request), a);
        assertEquals(UrgencyLevel.HIGH, a.urgencyLevel);
        assertEquals(1, failing.calls());
    }

    @Test
    void unexpectedRuntimeFailureStillFallsBack() {
        TriageRequest request = TriageRequest.of("headache");
        StubProviderClient broken = StubProviderClient.throwingUnchecked(new IllegalStateException("bug"));

        assertEquals(fallback.assess(request), orchestrator(broken).assess(request, List.of()));
    }

    @Test
    void providerAnswerIsNormalizedAndValidated() {
        StubProviderClient stub = StubProviderClient.returning("```json\n{"
            + "\"assistant_message\":\"The patient has signs of a migraine.\","
            + "\"summary\":\"Probable migraine.\","
            + "\"follow_up_questions\":[\"Any visual aura?\"],"
            + "\"possible_conditions\":[\"Migraine\"],"
            + "\"urgency_level\":\"medium\","
            + "\"urgency_reason\":\"No red flags reported.\","
            + "\"seek_care_within\":\"Within 24-48 hours\","
            + "\"red_flags\":[\"Sudden worst headache\"],"
            + "\"specialist_types\":[\"Neurology\"],"
            + "\"safety_disclaimer\":\"Not a diagnosis.\"}\n```");

        TriageAssessment a = orchestrator(stub).assess(TriageRequest.of("throbbing headache"), List.of());

        assertEquals("You have signs of a migraine.", a.assistantMessage);
        assertEquals(List.of("Migraine"), a.possibleConditions);
        assertEquals(UrgencyLevel.MEDIUM, a.urgencyLevel);
        assertEquals(TriagePrompts.ASSESSMENT, stub.systemPrompts.get(0));
        assertEquals(TriageOrchestrator.TEMPERATURE, stub.temperatures.get(0), 1e-9);
    }

    @Test
    void payloadCarriesRequestAndRecentHistoryOnly() {
        StubProviderClient stub = StubProviderClient.returning("{\"summary\":\"ok\",\"follow_up_questions\":[\"q\"]}");
        List<ConversationTurn> history = new ArrayList<>();
        for (int i = 1; i <= 9; i++) {
            history.add(new ConversationTurn("pain update " + i, "noted " + i));
        }
        TriageRequest request = new TriageRequest("still sore", List.of(SymptomEntry.of("back pain", 5)),
            new PatientContext(34, "female", List.of("asthma"), List.of(), List.of()), null, "s-1");

        orchestrator(stub).assess(request, history);

        JsonNode payload = stub.payloads.get(0);
        assertEquals("still sore", payload.path("message").asText());
        assertEquals("back pain", payload.path("symptoms").path(0).path("name").asText());
        assertEquals(34, payload.path("patient_context").path("age").asInt());
        assertEquals("en-NG", payload.path("locale").asText());
        JsonNode turns = payload.path("conversation_history");
        assertEquals(6, turns.size());
        assertEquals("pain update 4", turns.path(0).path("user_message").asText());
        assertEquals("noted 9", turns.path(5).path("assistant_message").asText());
    }

    @Test
    void proseAnswerGetsDefaultFollowUps() {
        StubProviderClient stub = StubProviderClient.returning("I think you have a cold");

        TriageAssessment a = orchestrator(stub).assess(TriageRequest.of("sore throat and cough"), List.of());

        assertEquals("I think you have a cold", a.assistantMessage);
        assertTrue(a.showStructuredOutput);
        assertEquals(TriageOrchestrator.DEFAULT_FOLLOW_UP_QUESTIONS, a.followUpQuestions);
    }

    @Test
    void nonHealthTurnIsConversational() {
        StubProviderClient stub = StubProviderClient.returning(
            "{\"assistant_message\":\"I cannot check live weather, but I am happy to chat.\","
                + "\"urgency_level\":\"high\",\"possible_conditions\":[\"Heatstroke\"]}");

        TriageAssessment a = orchestrator(stub).assess(TriageRequest.of("what's the weather"), List.of());

        assertFalse(a.showStructuredOutput);
        assertEquals(UrgencyLevel.LOW, a.urgencyLevel);
        assertTrue(a.possibleConditions.isEmpty());
        assertTrue(a.followUpQuestions.isEmpty());
        assertEquals("I cannot check live weather, but I am happy to chat.", a.assistantMessage);
    }

    @Test
    void contractViolationFallsBack() {
        AssessmentValidator rejecting = new AssessmentValidator() {
            @Override
            public void validate(TriageAssessment assessment) throws SchemaValidationException {
                throw new SchemaValidationException(List.of("summary is required"));
            }
        };
        StubProviderClient stub = StubProviderClient.returning("{\"summary\":\"ok\",\"follow_up_questions\":[\"q\"]}");
        TriageOrchestrator strict = new TriageOrchestrator(stub, new ResponseNormalizer(mapper), rejecting,
            fallback, new HealthTopicClassifier(), mapper, 6);
        TriageRequest request = TriageRequest.of("dizzy spells");

        assertEquals(fallback.assess(request), strict.assess(request, List.of()));
        assertEquals(1, stub.calls());
    }

    @Test
    void longProseAnswerIsKept() {
        StringBuilder prose = new StringBuilder("You likely have a viral throat infection.");
        while (prose.length() < 4600) {
            prose.append(" Keep drinking warm fluids and rest your voice as much as you can.");
        }
        StubProviderClient stub = StubProviderClient.returning(prose.toString());

        TriageAssessment a = orchestrator(stub).assess(TriageRequest.of("I have a cough and a sore throat"), List.of());

        assertEquals(prose.toString(), a.assistantMessage);
        assertNotEquals(fallback.assess(TriageRequest.of("I have a cough and a sore throat")).summary, a.summary);
    }

    @Test
    void longListsAreKept() {
        StringBuilder conditions = new StringBuilder();
        for (int i = 1; i <= 21; i++) {
            conditions.append(i == 1 ? "" : ",").append("\"condition ").append(i).append('"');
        }
        StubProviderClient stub = StubProviderClient.returning("{\"summary\":\"model summary\","
            + "\"follow_up_questions\":[\"q\"],\"possible_conditions\":[" + conditions + "]}");

        TriageAssessment a = orchestrator(stub).assess(TriageRequest.of("dizzy spells"), List.of());

        assertEquals("model summary", a.summary);
        assertEquals(21, a.possibleConditions.size());
    }

    @Test
    void emptyModelTextFallsBack() {
        StubProviderClient stub = StubProviderClient.returning("   ");
        TriageRequest request = TriageRequest.of("what's the weather");

        assertEquals(fallback.generalReply(request), orchestrator(stub).assess(request, List.of()));
    }

    @Test
    void fallbackAssessmentSkipsProvider() {
        StubProviderClient stub = StubProviderClient.returning("{}");
        TriageRequest request = TriageRequest.of("fever");

        assertEquals(fallback.assess(request), orchestrator(stub).fallbackAssessment(request, List.of()));
        assertEquals(0, stub.calls());
    }
}
