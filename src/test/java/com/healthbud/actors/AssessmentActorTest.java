package com.healthbud.actors;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import akka.actor.typed.DispatcherSelector;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthbud.assessment.ConversationTurn;
import com.healthbud.assessment.FallbackTriageEngine;
import com.healthbud.assessment.TriageOrchestrator;
import com.healthbud.assessment.TriageRequest;
import com.healthbud.assessment.UrgencyLevel;
import com.healthbud.llm.DisabledProviderClient;
import com.healthbud.llm.GeminiClient;
import com.healthbud.llm.Provider;
import com.healthbud.llm.ProviderConfig;
import com.healthbud.llm.StubProviderClient;
import com.healthbud.messages.Messages.Assess;
import com.healthbud.messages.Messages.AssessmentCommand;
import com.healthbud.messages.Messages.AssessmentReply;
import com.healthbud.messages.Messages.ConversationHistory;
import com.healthbud.messages.Messages.GetConversationHistory;
import com.healthbud.messages.Messages.LogCommand;
import com.healthbud.messages.Messages.SessionCommand;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AssessmentActorTest {

    private static final ActorTestKit testKit = ActorTestKit.create();

    private final ObjectMapper mapper = new ObjectMapper();

    @AfterAll
    static void shutdown() {
        testKit.shutdownTestKit();
    }

    @Test
    void assessesStoresAndReplies() {
        TestProbe<LogCommand> logs = testKit.createTestProbe();
        ActorRef<SessionCommand> sessions = testKit.spawn(ChatSessionActor.create(logs.getRef(), 6));
        TriageOrchestrator orchestrator =
            TriageOrchestrator.create(new DisabledProviderClient(Provider.DISABLED), mapper, 6);
        ActorRef<AssessmentCommand> assessment =
            testKit.spawn(AssessmentActor.create(orchestrator, sessions, logs.getRef()));
        TestProbe<AssessmentReply> replies = testKit.createTestProbe();

        TriageRequest request = TriageRequest.of("I have chest pain and can't breathe").withSessionId("s-1");
        assessment.tell(new Assess(request, replies.getRef()));
        AssessmentReply reply = replies.receiveMessage(Duration.ofSeconds(5));

        assertEquals(1L, reply.chatNumber);
        assertEquals("s-1", reply.sessionId);
        assertNotNull(reply.timestamp);
        assertEquals(new FallbackTriageEngine().assess(request), reply.assessment);
        assertEquals(UrgencyLevel.EMERGENCY, reply.assessment.urgencyLevel);

        TestProbe<ConversationHistory> history = testKit.createTestProbe();
        sessions.tell(new GetConversationHistory("s-1", history.getRef()));
        assertEquals(1, history.receiveMessage().turns.size());
    }

    @Test
    void blankSessionGetsGeneratedId() {
        TestProbe<LogCommand> logs = testKit.createTestProbe();
        ActorRef<SessionCommand> sessions = testKit.spawn(ChatSessionActor.create(logs.getRef(), 6));
        TriageOrchestrator orchestrator =
            TriageOrchestrator.create(new DisabledProviderClient(Provider.GEMINI), mapper, 6);
        ActorRef<AssessmentCommand> assessment =
            testKit.spawn(AssessmentActor.create(orchestrator, sessions, logs.getRef()));
        TestProbe<AssessmentReply> replies = testKit.createTestProbe();

        assessment.tell(new Assess(TriageRequest.of("fever").withSessionId("  "), replies.getRef()));
        AssessmentReply reply = replies.receiveMessage(Duration.ofSeconds(5));

        assertNotNull(reply.sessionId);
        assertFalse(reply.sessionId.isBlank());
    }

    @Test
    void previousTurnsReachTheProvider() {
        TestProbe<LogCommand> logs = testKit.createTestProbe();
        ActorRef<SessionCommand> sessions = testKit.spawn(ChatSessionActor.create(logs.getRef(), 6));
        StubProviderClient stub = StubProviderClient.returning(
            "{\"assistant_message\":\"Noted.\",\"summary\":\"ok\",\"follow_up_questions\":[\"When did it start?\"]}");
        ActorRef<AssessmentCommand> assessment = testKit.spawn(
            AssessmentActor.create(TriageOrchestrator.create(stub, mapper, 6), sessions, logs.getRef()));
        TestProbe<AssessmentReply> replies = testKit.createTestProbe();

        assessment.tell(new Assess(TriageRequest.of("my knee hurts").withSessionId("s-7"), replies.getRef()));
        assertEquals(1L, replies.receiveMessage(Duration.ofSeconds(5)).chatNumber);
        assessment.tell(new Assess(TriageRequest.of("it is swollen").withSessionId("s-7"), replies.getRef()));
        assertEquals(2L, replies.receiveMessage(Duration.ofSeconds(5)).chatNumber);

        assertEquals(0, stub.payloads.get(0).path("conversation_history").size());
        ConversationTurn first = mapper.convertValue(
            stub.payloads.get(1).path("conversation_history").path(0), ConversationTurn.class);
        assertEquals("my knee hurts", first.userMessage);
        assertEquals("Noted.", first.assistantMessage);
    }

    @Test
    void slowProviderIsAbandonedAtDeadline() throws Exception {
        MockWebServer server = new MockWebServer();
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        server.start();
        try {
            GeminiClient slow = new GeminiClient(
                new ProviderConfig(Provider.GEMINI, "AIza-test", "gemini-1.5-flash", null, null),
                new OkHttpClient(), mapper, server.url("/"), Duration.ofSeconds(30));
            TestProbe<LogCommand> logs = testKit.createTestProbe();
            ActorRef<SessionCommand> sessions = testKit.spawn(ChatSessionActor.create(logs.getRef(), 6));
            ActorRef<AssessmentCommand> assessment = testKit.spawn(AssessmentActor.create(
                TriageOrchestrator.create(slow, mapper, 6), sessions, logs.getRef(),
                DispatcherSelector.fromConfig(AssessmentActor.BLOCKING_DISPATCHER), Duration.ofMillis(300)));
            TestProbe<AssessmentReply> replies = testKit.createTestProbe();

            TriageRequest request = TriageRequest.of("high fever since yesterday").withSessionId("s-slow");
            assessment.tell(new Assess(request, replies.getRef()));
            AssessmentReply reply = replies.receiveMessage(Duration.ofSeconds(5));

            assertEquals(new FallbackTriageEngine().assess(request), reply.assessment);
            assertEquals(1, server.getRequestCount());
        } finally {
            server.shutdown();
        }
    }
}
